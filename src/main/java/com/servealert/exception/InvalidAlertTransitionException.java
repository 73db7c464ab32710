package com.servealert.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A lifecycle command that the alert's current state does not allow. Thrown before
 * anything is changed.
 */
@Getter
public class InvalidAlertTransitionException extends BaseException {

    public enum Reason {
        ALREADY_ACKNOWLEDGED,
        CANNOT_DISMISS_CRITICAL,
        ALERT_CLOSED,
        UNSUPPORTED_TRANSITION
    }

    private final Reason reason;

    public InvalidAlertTransitionException(String alertId, Reason reason, String message) {
        super(
                ErrorCode.INVALID_TRANSITION,
                message,
                Map.of(ALERT_ID, String.valueOf(alertId), "reason", reason.name()));
        this.reason = reason;
    }

    public static InvalidAlertTransitionException alreadyAcknowledged(String alertId) {
        return new InvalidAlertTransitionException(
                alertId, Reason.ALREADY_ACKNOWLEDGED, "Alert " + alertId + " is already acknowledged");
    }

    public static InvalidAlertTransitionException cannotDismissCritical(String alertId) {
        return new InvalidAlertTransitionException(
                alertId, Reason.CANNOT_DISMISS_CRITICAL, "Critical alert " + alertId + " cannot be dismissed");
    }

    public static InvalidAlertTransitionException closed(String alertId, Object status) {
        return new InvalidAlertTransitionException(
                alertId, Reason.ALERT_CLOSED, "Alert " + alertId + " is already " + status);
    }

    public static InvalidAlertTransitionException unsupported(String alertId, Object from, String command) {
        return new InvalidAlertTransitionException(
                alertId,
                Reason.UNSUPPORTED_TRANSITION,
                "Cannot " + command + " alert " + alertId + " in status " + from);
    }
}
