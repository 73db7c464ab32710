package com.servealert.delivery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.springframework.stereotype.Component;

/**
 * Sliding-window counter of notifications dispatched in the trailing hour.
 */
@Component
public class NotificationRateLimiter {

    static final Duration WINDOW = Duration.ofMinutes(60);

    private final Clock clock;
    private final Deque<Instant> dispatched = new ArrayDeque<>();

    public NotificationRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public synchronized boolean isLimitReached(int maxPerHour) {
        return countInWindow() >= maxPerHour;
    }

    /** Records a dispatch, CRITICAL ones included, and drops entries older than the window. */
    public synchronized void recordDispatch() {
        Instant now = clock.instant();
        prune(now);
        dispatched.addLast(now);
    }

    public synchronized int countInWindow() {
        prune(clock.instant());
        return dispatched.size();
    }

    /** Timestamps currently held, without pruning first. */
    public synchronized int getTrackedDispatches() {
        return dispatched.size();
    }

    public synchronized void reset() {
        dispatched.clear();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(WINDOW);
        while (!dispatched.isEmpty() && !dispatched.peekFirst().isAfter(cutoff)) {
            dispatched.removeFirst();
        }
    }
}
