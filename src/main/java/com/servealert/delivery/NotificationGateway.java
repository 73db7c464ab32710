package com.servealert.delivery;

import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.NotificationCategory;
import com.servealert.domain.model.NotificationPayload;
import java.util.List;

/**
 * The device's notification surface. Timing is decided upstream by the scheduler, so
 * {@link #scheduleLocal} presents the payload right away.
 */
public interface NotificationGateway {

    /** Prompts the user. Never returns {@link PermissionStatus#UNDETERMINED}. */
    PermissionStatus requestPermission();

    /** Current status, without prompting. */
    PermissionStatus checkPermission();

    /**
     * @return the device handle for the presented notification
     * @throws com.servealert.exception.NotificationDeliveryException when the device rejects it
     */
    String scheduleLocal(NotificationPayload payload);

    void cancel(String handle);

    void cancelAll();

    void registerCategories(List<NotificationCategory> categories);
}
