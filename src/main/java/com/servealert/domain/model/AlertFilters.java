package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Criteria for a filtered alert view. Null or empty sets mean "no restriction".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertFilters {

    private Set<AlertPriority> priorities;
    private Set<AlertType> types;
    private Set<AlertStatus> statuses;

    /** Inclusive lower bound on the alert timestamp. */
    private LocalDateTime from;

    /** Inclusive upper bound on the alert timestamp. */
    private LocalDateTime to;

    /** Case-insensitive substring matched against title, message and details. */
    private String searchQuery;

    /** An alert passes when it carries at least one of these tags. */
    private Set<String> tags;

    @Builder.Default
    private boolean includeRead = true;

    @Builder.Default
    private boolean includeResolved = false;

    public static AlertFilters defaults() {
        return AlertFilters.builder().build();
    }
}
