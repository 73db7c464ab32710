package com.servealert.exception;

import java.util.Map;

public class AlertNotFoundException extends BaseException {

    public AlertNotFoundException(String alertId) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("Alert not found with id: %s", alertId),
                Map.of(ALERT_ID, String.valueOf(alertId)));
    }
}
