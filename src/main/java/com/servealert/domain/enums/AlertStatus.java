package com.servealert.domain.enums;

/**
 * Lifecycle status of an alert.
 *
 * <pre>
 * ACTIVE       --acknowledge--> ACKNOWLEDGED
 * ACTIVE       --resolve------> RESOLVED
 * ACTIVE       --dismiss------> DISMISSED   (never for CRITICAL)
 * ACKNOWLEDGED --resolve------> RESOLVED
 * </pre>
 *
 * <p>RESOLVED and DISMISSED are terminal.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED,
    DISMISSED;

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }

    /** ACTIVE or ACKNOWLEDGED: still needs someone's attention. */
    public boolean isOpen() {
        return !isTerminal();
    }
}
