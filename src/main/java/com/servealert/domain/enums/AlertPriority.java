package com.servealert.domain.enums;

import java.util.Comparator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Urgency of an alert. Total order: CRITICAL > HIGH > MEDIUM > LOW.
 *
 * <p>Declaration order runs from most to least urgent, so {@link #MOST_URGENT_FIRST}
 * (ordinal ascending) puts CRITICAL at the head of a sorted list. {@link #getRank()}
 * is the numeric weight used where a larger number must mean more urgent.
 */
@Getter
@RequiredArgsConstructor
public enum AlertPriority {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    public static final Comparator<AlertPriority> MOST_URGENT_FIRST = Comparator.comparingInt(AlertPriority::ordinal);

    private final int rank;

    /** True for CRITICAL and HIGH. */
    public boolean isUrgent() {
        return this == CRITICAL || this == HIGH;
    }

    public boolean isAtLeast(AlertPriority other) {
        return rank >= other.rank;
    }
}
