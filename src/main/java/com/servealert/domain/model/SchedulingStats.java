package com.servealert.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SchedulingStats {

    /** Outstanding timers. No history is kept, so total and pending are the same figure. */
    int totalScheduled;

    int pendingNotifications;

    /** Mean configured delay of the outstanding timers, in milliseconds. */
    long averageDelayMs;
}
