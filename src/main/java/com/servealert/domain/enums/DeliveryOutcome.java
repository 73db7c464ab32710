package com.servealert.domain.enums;

/**
 * Result of running an alert through the notification delivery gate.
 *
 * <p>Only {@link #DELIVERED} means the alert reached the device. Every other value
 * is a silent skip by policy except {@link #DELIVERY_FAILED}, which is a recoverable
 * gateway error.
 */
public enum DeliveryOutcome {
    DELIVERED,
    NOTIFICATIONS_DISABLED,
    PERMISSION_NOT_GRANTED,
    PRIORITY_FILTERED,
    TYPE_FILTERED,
    QUIET_HOURS,
    RATE_LIMITED,
    DELIVERY_FAILED
}
