package com.servealert.domain.model;

import com.servealert.domain.enums.RestaurantType;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static description of a restaurant: size, staffing and when it is busy.
 *
 * <p>Peak hours are kept as "HH:mm" strings so they can be compared directly with a
 * formatted clock reading and persisted unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestaurantProfile {

    private String id;
    private String name;
    private RestaurantType type;
    private String address;
    private String phone;
    private String email;

    /** Seats. */
    private int capacity;

    private int staffCount;

    /** Minutes from order to service. */
    private int avgOrderTime;

    @Builder.Default
    private List<String> specialties = new ArrayList<>();

    @Builder.Default
    private List<String> peakHours = new ArrayList<>();

    @Builder.Default
    private Map<DayOfWeek, OperatingHours> hoursOfOperation = new EnumMap<>(DayOfWeek.class);

    /** True if {@code hour} is within one hour of any configured peak hour. */
    public boolean isNearPeakHour(int hour) {
        return peakHours.stream()
                .mapToInt(peak -> Integer.parseInt(peak.substring(0, 2)))
                .anyMatch(peak -> Math.abs(hour - peak) <= 1);
    }
}
