package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User-controlled notification policy. {@link #defaults()} gives the values a fresh
 * install starts with and that a missing or unreadable stored copy falls back to.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSettings {

    private boolean enabled;
    private boolean allowCritical;
    private boolean allowHigh;
    private boolean allowMedium;
    private boolean allowLow;
    private boolean sound;
    private boolean vibration;
    private boolean badge;
    private boolean customSounds;
    private QuietHours quietHours;
    private int maxPerHour;
    private AlertPriority minimumPriority;

    @Builder.Default
    private Map<AlertType, Boolean> typeFilters = allTypesEnabled();

    public static NotificationSettings defaults() {
        return NotificationSettings.builder()
                .enabled(true)
                .allowCritical(true)
                .allowHigh(true)
                .allowMedium(true)
                .allowLow(false)
                .sound(true)
                .vibration(true)
                .badge(true)
                .customSounds(true)
                .quietHours(QuietHours.builder().enabled(false).build())
                .maxPerHour(10)
                .minimumPriority(AlertPriority.LOW)
                .typeFilters(allTypesEnabled())
                .build();
    }

    public boolean isPriorityAllowed(AlertPriority priority) {
        return switch (priority) {
            case CRITICAL -> allowCritical;
            case HIGH -> allowHigh;
            case MEDIUM -> allowMedium;
            case LOW -> allowLow;
        };
    }

    /** A type missing from the filter map counts as enabled. */
    public boolean isTypeAllowed(AlertType type) {
        return typeFilters == null || typeFilters.getOrDefault(type, Boolean.TRUE);
    }

    private static Map<AlertType, Boolean> allTypesEnabled() {
        Map<AlertType, Boolean> filters = new EnumMap<>(AlertType.class);
        for (AlertType type : AlertType.values()) {
            filters.put(type, Boolean.TRUE);
        }
        return filters;
    }
}
