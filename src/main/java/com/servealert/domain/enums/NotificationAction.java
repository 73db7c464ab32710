package com.servealert.domain.enums;

/**
 * Action a user picked on a delivered notification.
 *
 * <p>Identifiers arrive from the device as strings ("ACKNOWLEDGE", "dismiss",
 * "view-details"); anything unrecognised, including a plain tap, maps to {@link #DEFAULT}.
 */
public enum NotificationAction {
    ACKNOWLEDGE,
    DISMISS,
    VIEW_DETAILS,
    DEFAULT;

    public static NotificationAction fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return DEFAULT;
        }
        String normalized = identifier.trim().toUpperCase().replace('-', '_');
        for (NotificationAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        return DEFAULT;
    }
}
