package com.servealert.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of how the restaurant is doing.
 *
 * <p>Produced by the restaurant profile collaborator and passed by value to the
 * synthesis engine and scheduler; nothing in the alert engine mutates it.
 */
@Value
@Builder(toBuilder = true)
public class RestaurantContext {

    RestaurantProfile profile;
    LocalDateTime currentTime;
    DayOfWeek dayOfWeek;
    boolean open;
    int currentCapacity;
    int activeOrders;
    int staffOnDuty;

    /** Alerts per hour. */
    double averageAlertFrequency;

    boolean demoMode;

    @Builder.Default
    double simulationSpeed = 1.0;

    /** Occupied seats over total seats, 0 when the profile reports no seats. */
    public double capacityFraction() {
        if (profile == null || profile.getCapacity() <= 0) {
            return 0.0;
        }
        return (double) currentCapacity / profile.getCapacity();
    }
}
