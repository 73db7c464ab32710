package com.servealert.lifecycle;

import com.servealert.lifecycle.command.AlertCommand;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * The alert state machine as a function: {@code (state, command, now) -> transition}.
 *
 * <pre>
 * ACTIVE       --acknowledge--> ACKNOWLEDGED
 * ACTIVE       --resolve------> RESOLVED
 * ACTIVE       --dismiss------> DISMISSED    (not for CRITICAL)
 * ACKNOWLEDGED --resolve------> RESOLVED
 * </pre>
 *
 * RESOLVED and DISMISSED are terminal. Read marks, votes, notes, cure steps and
 * assignment are orthogonal to status. Nothing here holds state or reads a clock.
 */
public final class AlertStateReducer {

    private AlertStateReducer() {}

    public static AlertTransition reduce(AlertState state, AlertCommand command, LocalDateTime now) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(now, "now");
        return command.apply(state, now);
    }
}
