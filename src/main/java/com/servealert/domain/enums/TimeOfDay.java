package com.servealert.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Coarse service period used by the real-time simulation tick.
 */
@Getter
@RequiredArgsConstructor
public enum TimeOfDay {
    MORNING(1.5),
    AFTERNOON(2.0),
    EVENING(1.8),
    NIGHT(0.3);

    /** Multiplier applied to the base tick probability. */
    private final double tickMultiplier;

    /** 05-12 morning, 12-17 afternoon, 17-22 evening, night otherwise. */
    public static TimeOfDay fromHour(int hour) {
        if (hour >= 5 && hour < 12) {
            return MORNING;
        }
        if (hour >= 12 && hour < 17) {
            return AFTERNOON;
        }
        if (hour >= 17 && hour < 22) {
            return EVENING;
        }
        return NIGHT;
    }
}
