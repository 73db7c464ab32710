package com.servealert.domain.enums;

/**
 * Device notification permission as reported by the notification gateway.
 */
public enum PermissionStatus {
    GRANTED,
    DENIED,
    UNDETERMINED
}
