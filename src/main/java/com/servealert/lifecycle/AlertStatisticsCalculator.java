package com.servealert.lifecycle;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertStatistics;
import com.servealert.domain.model.AssignmentMetrics;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Aggregates over an alert list. Pure; the lifecycle service supplies the list.
 */
@Component
public class AlertStatisticsCalculator {

    /**
     * Counts over the alerts whose timestamp falls in {@code [from, to]}. Either bound
     * may be null for an open range.
     */
    public AlertStatistics calculate(List<Alert> alerts, LocalDateTime from, LocalDateTime to) {
        List<Alert> window = alerts.stream()
                .filter(a -> from == null || (a.getTimestamp() != null && !a.getTimestamp().isBefore(from)))
                .filter(a -> to == null || (a.getTimestamp() != null && !a.getTimestamp().isAfter(to)))
                .toList();

        return AlertStatistics.builder()
                .total(window.size())
                .byPriority(countBy(window, Alert::getPriority, AlertPriority.class))
                .byType(countBy(window, Alert::getType, AlertType.class))
                .byStatus(countBy(window, Alert::getStatus, AlertStatus.class))
                .unread(window.stream().filter(a -> !a.isRead()).count())
                .criticalActive(window.stream()
                        .filter(a -> a.getPriority() == AlertPriority.CRITICAL && a.getStatus() == AlertStatus.ACTIVE)
                        .count())
                .averageResolutionMinutes(averageResolutionMinutes(window))
                .build();
    }

    public AssignmentMetrics assignmentMetrics(List<Alert> alerts, String userId) {
        List<Alert> assigned = alerts.stream()
                .filter(a -> a.getAssignedTo() != null && Objects.equals(a.getAssignedTo(), userId))
                .toList();

        return AssignmentMetrics.builder()
                .totalAssigned(assigned.size())
                .activeAssigned((int) assigned.stream().filter(a -> a.getStatus().isOpen()).count())
                .resolvedAssigned((int) assigned.stream().filter(a -> a.getStatus() == AlertStatus.RESOLVED).count())
                .averageResolutionMinutes(Math.round(averageResolutionMinutes(assigned)))
                .byPriority(countBy(assigned, Alert::getPriority, AlertPriority.class))
                .build();
    }

    static double averageResolutionMinutes(List<Alert> alerts) {
        return alerts.stream()
                .filter(a -> a.getStatus() == AlertStatus.RESOLVED)
                .filter(a -> a.getResolvedAt() != null && a.getTimestamp() != null)
                .mapToDouble(a -> Duration.between(a.getTimestamp(), a.getResolvedAt()).toMillis() / 60_000.0)
                .average()
                .orElse(0);
    }

    private static <K extends Enum<K>> Map<K, Long> countBy(
            List<Alert> alerts, Function<Alert, K> key, Class<K> keyType) {
        Map<K, Long> counts = new EnumMap<>(keyType);
        for (Alert alert : alerts) {
            K value = key.apply(alert);
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        return counts;
    }
}
