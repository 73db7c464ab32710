package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregate view over the alerts in a time window.
 */
@Value
@Builder
public class AlertStatistics {

    int total;
    Map<AlertPriority, Long> byPriority;
    Map<AlertType, Long> byType;
    Map<AlertStatus, Long> byStatus;
    long unread;
    long criticalActive;

    /** Mean minutes from creation to resolution, 0 when nothing was resolved. */
    double averageResolutionMinutes;
}
