package com.servealert.event;

import com.servealert.domain.enums.AlertChangeType;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every successful write to the alert collection.
 *
 * <p>This is the subscription surface for whatever renders alerts: a listener gets
 * the kind of change and the ids it touched, then reads the current view from the
 * lifecycle manager. {@link AlertChangeType#CLEARED} and {@link AlertChangeType#RELOADED}
 * carry the ids of the collection after the change (empty for CLEARED).
 */
public class AlertCollectionChangedEvent extends ApplicationEvent {

    private final AlertChangeType changeType;
    private final List<String> alertIds;
    private final String command;

    public AlertCollectionChangedEvent(
            Object source, AlertChangeType changeType, List<String> alertIds, String command) {
        super(source);
        this.changeType = changeType;
        this.alertIds = alertIds != null ? List.copyOf(alertIds) : List.of();
        this.command = command;
    }

    public AlertChangeType getChangeType() {
        return changeType;
    }

    public List<String> getAlertIds() {
        return alertIds;
    }

    /** Name of the lifecycle command that caused the change, e.g. "acknowledge". */
    public String getCommand() {
        return command;
    }
}
