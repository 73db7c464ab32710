package com.servealert.delivery;

import com.servealert.domain.enums.NotificationAction;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.NotificationCategory;
import com.servealert.exception.StorageException;
import com.servealert.persistence.AlertStorageService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks whether the device lets us show notifications.
 *
 * <p>The last known status is cached and persisted. When the device has no answer yet
 * ({@code UNDETERMINED}) the persisted status is used, so a restart does not forget an
 * earlier grant. Interactive categories are registered every time a request is granted.
 */
@Service
public class NotificationPermissionManager {

    private static final Logger log = LoggerFactory.getLogger(NotificationPermissionManager.class);

    static final String DENIAL_FALLBACK_MESSAGE = "Notifications disabled. You can still view alerts in the app.";
    static final String EDUCATION_MESSAGE = "🔔 Get notified about critical restaurant alerts even when the app is "
            + "closed. We'll only send important updates.";

    static final List<NotificationCategory> CATEGORIES = List.of(
            new NotificationCategory(
                    "CRITICAL_ALERT", List.of(NotificationAction.ACKNOWLEDGE, NotificationAction.VIEW_DETAILS)),
            new NotificationCategory(
                    "HIGH_ALERT", List.of(NotificationAction.ACKNOWLEDGE, NotificationAction.DISMISS)),
            new NotificationCategory("MEDIUM_ALERT", List.of(NotificationAction.DISMISS)));

    private final NotificationGateway notificationGateway;
    private final AlertStorageService alertStorageService;

    private volatile PermissionStatus cachedStatus = PermissionStatus.UNDETERMINED;
    private volatile boolean educationShown;

    public NotificationPermissionManager(
            NotificationGateway notificationGateway, AlertStorageService alertStorageService) {
        this.notificationGateway = notificationGateway;
        this.alertStorageService = alertStorageService;
    }

    /**
     * Prompts the device unless permission is already granted. Failures are logged and
     * leave the cached status unchanged.
     */
    public PermissionStatus requestPermissions() {
        if (checkPermissionStatus() == PermissionStatus.GRANTED) {
            return PermissionStatus.GRANTED;
        }
        if (!educationShown) {
            educationShown = true;
            log.info("Permission education: {}", EDUCATION_MESSAGE);
        }

        PermissionStatus status;
        try {
            status = notificationGateway.requestPermission();
        } catch (RuntimeException e) {
            log.error("Failed to request notification permission: {}", e.getMessage());
            return cachedStatus;
        }

        remember(status);
        if (status == PermissionStatus.GRANTED) {
            registerCategories();
        } else {
            log.info("Notification permission denied");
        }
        return status;
    }

    /** Current status without prompting. */
    public PermissionStatus checkPermissionStatus() {
        PermissionStatus status;
        try {
            status = notificationGateway.checkPermission();
        } catch (RuntimeException e) {
            log.error("Failed to check notification permission: {}", e.getMessage());
            return PermissionStatus.UNDETERMINED;
        }

        if (status == PermissionStatus.UNDETERMINED) {
            Optional<PermissionStatus> stored = loadStored();
            if (stored.isPresent()) {
                cachedStatus = stored.get();
                return stored.get();
            }
        }
        cachedStatus = status;
        return status;
    }

    public boolean isGranted() {
        return checkPermissionStatus() == PermissionStatus.GRANTED;
    }

    public PermissionStatus getCachedStatus() {
        return cachedStatus;
    }

    /** Message shown in place of notifications once the user has said no. */
    public String handlePermissionDenial() {
        log.info("User denied notification permissions, falling back to in-app alerts");
        return DENIAL_FALLBACK_MESSAGE;
    }

    public String permissionEducationMessage() {
        return EDUCATION_MESSAGE;
    }

    public List<NotificationCategory> getCategories() {
        return CATEGORIES;
    }

    private void registerCategories() {
        try {
            notificationGateway.registerCategories(CATEGORIES);
            log.debug("Registered {} notification categories", CATEGORIES.size());
        } catch (RuntimeException e) {
            log.error("Failed to register notification categories: {}", e.getMessage());
        }
    }

    private void remember(PermissionStatus status) {
        cachedStatus = status;
        try {
            alertStorageService.savePermissionStatus(status);
        } catch (StorageException e) {
            log.error("Failed to persist permission status {}: {}", status, e.getMessage());
        }
    }

    private Optional<PermissionStatus> loadStored() {
        try {
            return alertStorageService.loadPermissionStatus();
        } catch (StorageException e) {
            log.error("Failed to load persisted permission status: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
