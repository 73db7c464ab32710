package com.servealert.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * What the device gateway is asked to present. {@code data} carries the alert id,
 * type and priority so a response can be routed back to the alert.
 */
@Value
@Builder
public class NotificationPayload {

    String title;
    String body;
    Map<String, String> data;

    /** Null means the device default sound. */
    String sound;

    Integer badge;
    String categoryId;
    boolean vibrate;
}
