package com.servealert.recovery;

import com.servealert.domain.enums.ErrorCategory;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One logged failure, with enough context to reconstruct it later.
 */
@Value
@Builder
public class AppError {

    ErrorCategory category;
    String operation;

    /** Null when the failure is not tied to a single alert. */
    String alertId;

    String message;
    LocalDateTime timestamp;
    boolean recoverable;
}
