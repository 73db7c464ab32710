package com.servealert.lifecycle.command;

import com.servealert.lifecycle.AlertState;
import com.servealert.lifecycle.AlertTransition;
import java.time.LocalDateTime;

/**
 * A change to the alert collection. Implementations are pure: they read {@code state},
 * return a new state and never touch the alerts they were given.
 *
 * <p>A command that is not allowed throws before producing anything, so a rejected
 * command leaves the caller's state exactly as it was.
 */
public interface AlertCommand {

    /** Short name used in change events and logs, e.g. {@code "acknowledge"}. */
    String name();

    AlertTransition apply(AlertState state, LocalDateTime now);
}
