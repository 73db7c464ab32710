package com.servealert.domain.model;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial settings change. Null fields leave the current value untouched; type filters
 * are merged entry by entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSettingsUpdate {

    private Boolean enabled;
    private Boolean allowCritical;
    private Boolean allowHigh;
    private Boolean allowMedium;
    private Boolean allowLow;
    private Boolean sound;
    private Boolean vibration;
    private Boolean badge;
    private Boolean customSounds;
    private QuietHours quietHours;
    private Integer maxPerHour;
    private AlertPriority minimumPriority;
    private Map<AlertType, Boolean> typeFilters;
}
