package com.servealert.lifecycle;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertFilters;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Stateless filtering and ordering of alert lists.
 *
 * <p>Criteria are applied in a fixed order (priority, type, status, time range, search,
 * tags, read, resolved). The result is sorted most urgent first, then newest first;
 * {@link List#sort} is stable so remaining ties keep their input order.
 */
@Component
public class AlertFilterService {

    static final Comparator<Alert> URGENCY_THEN_RECENCY = Comparator
            .comparing(Alert::getPriority, AlertPriority.MOST_URGENT_FIRST)
            .thenComparing(Alert::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    public List<Alert> filterAlerts(List<Alert> alerts, AlertFilters filters) {
        AlertFilters criteria = filters != null ? filters : AlertFilters.defaults();
        Stream<Alert> stream = alerts.stream();

        if (isRestricted(criteria.getPriorities())) {
            stream = stream.filter(a -> criteria.getPriorities().contains(a.getPriority()));
        }
        if (isRestricted(criteria.getTypes())) {
            stream = stream.filter(a -> criteria.getTypes().contains(a.getType()));
        }
        if (isRestricted(criteria.getStatuses())) {
            stream = stream.filter(a -> criteria.getStatuses().contains(a.getStatus()));
        }
        if (criteria.getFrom() != null) {
            stream = stream.filter(a -> a.getTimestamp() != null && !a.getTimestamp().isBefore(criteria.getFrom()));
        }
        if (criteria.getTo() != null) {
            stream = stream.filter(a -> a.getTimestamp() != null && !a.getTimestamp().isAfter(criteria.getTo()));
        }
        if (criteria.getSearchQuery() != null && !criteria.getSearchQuery().isBlank()) {
            stream = stream.filter(matchesSearch(criteria.getSearchQuery()));
        }
        if (isRestricted(criteria.getTags())) {
            stream = stream.filter(a -> a.getTags() != null
                    && a.getTags().stream().anyMatch(criteria.getTags()::contains));
        }
        if (!criteria.isIncludeRead()) {
            stream = stream.filter(a -> !a.isRead());
        }
        if (!criteria.isIncludeResolved()) {
            stream = stream.filter(a -> a.getStatus() != AlertStatus.RESOLVED);
        }

        List<Alert> result = stream.collect(Collectors.toList());
        result.sort(URGENCY_THEN_RECENCY);
        return result;
    }

    private static boolean isRestricted(Collection<?> values) {
        return values != null && !values.isEmpty();
    }

    private static Predicate<Alert> matchesSearch(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        return alert -> contains(alert.getTitle(), needle)
                || contains(alert.getMessage(), needle)
                || contains(alert.getDetails(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
