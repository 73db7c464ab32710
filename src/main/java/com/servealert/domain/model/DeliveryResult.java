package com.servealert.domain.model;

import com.servealert.domain.enums.DeliveryOutcome;
import lombok.Value;

/**
 * Outcome of one delivery attempt through the gate.
 */
@Value
public class DeliveryResult {

    String alertId;
    DeliveryOutcome outcome;

    /** Device handle; only set when {@link #isDelivered()}. */
    String notificationId;

    String reason;

    public static DeliveryResult delivered(String alertId, String notificationId) {
        return new DeliveryResult(alertId, DeliveryOutcome.DELIVERED, notificationId, null);
    }

    public static DeliveryResult skipped(String alertId, DeliveryOutcome outcome, String reason) {
        return new DeliveryResult(alertId, outcome, null, reason);
    }

    public boolean isDelivered() {
        return outcome == DeliveryOutcome.DELIVERED;
    }
}
