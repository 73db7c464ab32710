package com.servealert.delivery;

import com.servealert.config.ServeAlertProperties;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.NotificationCategory;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.exception.NotificationDeliveryException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Device gateway that pushes notification frames to subscribed clients on the configured
 * STOMP destination. Permission answers come from configuration, since the server has no
 * OS prompt of its own.
 */
@Component
public class StompNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(StompNotificationGateway.class);

    private final SimpMessagingTemplate simpMessagingTemplate;
    private final ServeAlertProperties serveAlertProperties;
    private final Clock clock;

    private final AtomicReference<PermissionStatus> permission = new AtomicReference<>(PermissionStatus.UNDETERMINED);

    public StompNotificationGateway(
            SimpMessagingTemplate simpMessagingTemplate, ServeAlertProperties serveAlertProperties, Clock clock) {
        this.simpMessagingTemplate = simpMessagingTemplate;
        this.serveAlertProperties = serveAlertProperties;
        this.clock = clock;
    }

    @Override
    public PermissionStatus requestPermission() {
        PermissionStatus granted = serveAlertProperties.getNotifications().isAutoGrantPermission()
                ? PermissionStatus.GRANTED
                : PermissionStatus.DENIED;
        permission.set(granted);
        return granted;
    }

    @Override
    public PermissionStatus checkPermission() {
        return permission.get();
    }

    @Override
    public String scheduleLocal(NotificationPayload payload) {
        String handle = UUID.randomUUID().toString();
        try {
            send(DeviceNotificationMessage.builder()
                    .kind(DeviceNotificationMessage.Kind.PRESENT)
                    .handle(handle)
                    .payload(payload)
                    .sentAt(LocalDateTime.now(clock))
                    .build());
        } catch (MessagingException e) {
            throw new NotificationDeliveryException("Failed to push notification " + handle, e);
        }
        log.debug("Notification {} pushed: {}", handle, payload.getTitle());
        return handle;
    }

    @Override
    public void cancel(String handle) {
        send(DeviceNotificationMessage.builder()
                .kind(DeviceNotificationMessage.Kind.CANCEL)
                .handle(handle)
                .sentAt(LocalDateTime.now(clock))
                .build());
    }

    @Override
    public void cancelAll() {
        send(DeviceNotificationMessage.builder()
                .kind(DeviceNotificationMessage.Kind.CANCEL_ALL)
                .sentAt(LocalDateTime.now(clock))
                .build());
    }

    @Override
    public void registerCategories(List<NotificationCategory> categories) {
        send(DeviceNotificationMessage.builder()
                .kind(DeviceNotificationMessage.Kind.REGISTER_CATEGORIES)
                .categories(categories)
                .sentAt(LocalDateTime.now(clock))
                .build());
    }

    private void send(DeviceNotificationMessage message) {
        simpMessagingTemplate.convertAndSend(serveAlertProperties.getNotifications().getDestination(), message);
    }
}
