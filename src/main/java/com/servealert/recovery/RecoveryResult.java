package com.servealert.recovery;

import com.servealert.domain.enums.RecoveryAction;
import lombok.Builder;
import lombok.Data;

/**
 * What the recovery service did about a failure.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private RecoveryAction action;
    private AppError error;

    /** Why the recovery action itself failed, if it did. */
    private String failureReason;
}
