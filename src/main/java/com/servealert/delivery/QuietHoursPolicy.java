package com.servealert.delivery;

import com.servealert.domain.model.QuietHours;
import java.time.Clock;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Quiet-hours window check at minute precision. Both ends are inclusive. A window whose
 * start is after its end runs past midnight: 22:00 to 08:00 covers 23:00 and 06:00.
 */
@Component
public class QuietHoursPolicy {

    private final Clock clock;

    public QuietHoursPolicy(Clock clock) {
        this.clock = clock;
    }

    public boolean isWithinQuietHours(QuietHours quietHours) {
        return isWithinQuietHours(quietHours, LocalTime.now(clock));
    }

    public static boolean isWithinQuietHours(QuietHours quietHours, LocalTime time) {
        if (quietHours == null || !quietHours.isEnabled()) {
            return false;
        }
        LocalTime t = time.truncatedTo(ChronoUnit.MINUTES);
        LocalTime start = quietHours.getStart();
        LocalTime end = quietHours.getEnd();

        if (quietHours.wrapsMidnight()) {
            return !t.isBefore(start) || !t.isAfter(end);
        }
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
