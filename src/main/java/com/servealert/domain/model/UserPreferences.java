package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import java.util.HashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Saved view preferences of the signed-in user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPreferences {

    private boolean showResolved;

    @Builder.Default
    private Set<AlertType> selectedTypes = new HashSet<>();

    @Builder.Default
    private Set<AlertPriority> selectedPriorities = new HashSet<>();

    /** Converts the saved selections into a filter for the lifecycle manager. */
    public AlertFilters toFilters() {
        return AlertFilters.builder()
                .types(selectedTypes)
                .priorities(selectedPriorities)
                .includeResolved(showResolved)
                .build();
    }
}
