package com.servealert.domain.enums;

/**
 * Failure families recognised by the recovery service.
 */
public enum ErrorCategory {
    NETWORK,
    STORAGE,
    NOTIFICATION,
    PERMISSION
}
