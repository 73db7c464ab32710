package com.servealert.scheduling;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stops a running real-time simulation. Only the first {@link #cancel()} does anything.
 */
public class SimulationHandle {

    private final ScheduledFuture<?> tick;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    SimulationHandle(ScheduledFuture<?> tick) {
        this.tick = tick;
    }

    /** @return true if this call stopped the simulation, false if it was already stopped */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        tick.cancel(false);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
