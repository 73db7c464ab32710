package com.servealert.event;

import com.servealert.domain.model.NotificationResponse;
import org.springframework.context.ApplicationEvent;

/**
 * A user acted on a delivered notification.
 */
public class NotificationResponseEvent extends ApplicationEvent {

    private final NotificationResponse response;

    public NotificationResponseEvent(Object source, NotificationResponse response) {
        super(source);
        this.response = response;
    }

    public NotificationResponse getResponse() {
        return response;
    }
}
