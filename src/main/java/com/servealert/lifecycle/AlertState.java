package com.servealert.lifecycle;

import com.servealert.domain.model.Alert;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the managed alert collection, newest first.
 *
 * <p>Every "with" method returns a new snapshot; the receiver is never modified.
 */
public final class AlertState {

    private static final AlertState EMPTY = new AlertState(List.of());

    private final List<Alert> alerts;

    private AlertState(List<Alert> alerts) {
        this.alerts = alerts;
    }

    public static AlertState empty() {
        return EMPTY;
    }

    public static AlertState of(List<Alert> alerts) {
        return alerts == null || alerts.isEmpty()
                ? EMPTY
                : new AlertState(Collections.unmodifiableList(new ArrayList<>(alerts)));
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public int size() {
        return alerts.size();
    }

    public boolean isEmpty() {
        return alerts.isEmpty();
    }

    public Optional<Alert> find(String alertId) {
        return alerts.stream().filter(a -> Objects.equals(a.getId(), alertId)).findFirst();
    }

    /** New alerts go in front of the existing ones, keeping their own relative order. */
    public AlertState withPrepended(List<Alert> added) {
        List<Alert> next = new ArrayList<>(added.size() + alerts.size());
        next.addAll(added);
        next.addAll(alerts);
        return new AlertState(Collections.unmodifiableList(next));
    }

    /** Swaps in {@code updated} at the position of the alert with the same id. */
    public AlertState withReplaced(Alert updated) {
        List<Alert> next = new ArrayList<>(alerts.size());
        for (Alert alert : alerts) {
            next.add(Objects.equals(alert.getId(), updated.getId()) ? updated : alert);
        }
        return new AlertState(Collections.unmodifiableList(next));
    }
}
