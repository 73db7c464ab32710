package com.servealert.exception;

import java.util.Map;

public class NotificationDeliveryException extends BaseException {

    public NotificationDeliveryException(String message) {
        super(ErrorCode.DELIVERY_FAILURE, message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(ErrorCode.DELIVERY_FAILURE, message, cause);
    }

    public NotificationDeliveryException(String alertId, String message, Throwable cause) {
        super(ErrorCode.DELIVERY_FAILURE, message, Map.of(ALERT_ID, String.valueOf(alertId)), cause);
    }
}
