package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Workload summary for one assignee.
 */
@Value
@Builder
public class AssignmentMetrics {

    int totalAssigned;
    int activeAssigned;
    int resolvedAssigned;

    /** Rounded mean minutes from creation to resolution. */
    long averageResolutionMinutes;

    Map<AlertPriority, Long> byPriority;
}
