package com.servealert.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    NOT_FOUND("NOT_FOUND", false),
    INVALID_TRANSITION("INVALID_TRANSITION", false),
    PERMISSION_DENIED("PERMISSION_DENIED", true),
    STORAGE_FAILURE("STORAGE_FAILURE", true),
    DELIVERY_FAILURE("DELIVERY_FAILURE", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;

    /** Whether the recovery service can route this failure to a recovery action. */
    private final boolean recoverable;
}
