package com.servealert.delivery;

import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.NotificationSettings;
import com.servealert.domain.model.NotificationSettingsUpdate;
import com.servealert.exception.StorageException;
import com.servealert.persistence.AlertStorageService;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the user's notification settings: loaded lazily from storage, merged on partial
 * updates and written back.
 *
 * <p>Also carries a session-only kill switch used by the recovery service after a
 * notification failure. It is never persisted, so a restart re-enables delivery.
 */
@Service
public class NotificationSettingsService {

    private static final Logger log = LoggerFactory.getLogger(NotificationSettingsService.class);

    private final AlertStorageService alertStorageService;

    private NotificationSettings settings;
    private volatile boolean disabledForSession;

    public NotificationSettingsService(AlertStorageService alertStorageService) {
        this.alertStorageService = alertStorageService;
    }

    /** A copy of the current settings. */
    public synchronized NotificationSettings getSettings() {
        if (settings == null) {
            settings = load();
        }
        return copy(settings);
    }

    /**
     * Applies the non-null fields of {@code update} and persists the result.
     *
     * @throws StorageException when the settings could not be saved; the in-memory
     *     settings already reflect the update
     */
    public synchronized NotificationSettings updateSettings(NotificationSettingsUpdate update) {
        NotificationSettings next = merge(getSettings(), update);
        settings = next;
        alertStorageService.saveNotificationSettings(next);
        log.info("Notification settings updated");
        return copy(next);
    }

    public synchronized NotificationSettings replaceSettings(NotificationSettings replacement) {
        settings = copy(replacement);
        alertStorageService.saveNotificationSettings(settings);
        return copy(settings);
    }

    /** Drops the cached settings so the next read goes back to storage. */
    public synchronized void reload() {
        settings = null;
    }

    public void disableForSession() {
        disabledForSession = true;
    }

    public void enableForSession() {
        disabledForSession = false;
    }

    public boolean isDisabledForSession() {
        return disabledForSession;
    }

    static NotificationSettings merge(NotificationSettings base, NotificationSettingsUpdate update) {
        if (update == null) {
            return base;
        }
        NotificationSettings.NotificationSettingsBuilder builder = base.toBuilder();
        if (update.getEnabled() != null) {
            builder.enabled(update.getEnabled());
        }
        if (update.getAllowCritical() != null) {
            builder.allowCritical(update.getAllowCritical());
        }
        if (update.getAllowHigh() != null) {
            builder.allowHigh(update.getAllowHigh());
        }
        if (update.getAllowMedium() != null) {
            builder.allowMedium(update.getAllowMedium());
        }
        if (update.getAllowLow() != null) {
            builder.allowLow(update.getAllowLow());
        }
        if (update.getSound() != null) {
            builder.sound(update.getSound());
        }
        if (update.getVibration() != null) {
            builder.vibration(update.getVibration());
        }
        if (update.getBadge() != null) {
            builder.badge(update.getBadge());
        }
        if (update.getCustomSounds() != null) {
            builder.customSounds(update.getCustomSounds());
        }
        if (update.getQuietHours() != null) {
            builder.quietHours(update.getQuietHours().toBuilder().build());
        }
        if (update.getMaxPerHour() != null) {
            builder.maxPerHour(update.getMaxPerHour());
        }
        if (update.getMinimumPriority() != null) {
            builder.minimumPriority(update.getMinimumPriority());
        }
        if (update.getTypeFilters() != null) {
            Map<AlertType, Boolean> filters = copyFilters(base.getTypeFilters());
            filters.putAll(update.getTypeFilters());
            builder.typeFilters(filters);
        }
        return builder.build();
    }

    private NotificationSettings load() {
        try {
            return alertStorageService.loadNotificationSettings();
        } catch (StorageException e) {
            log.error("Failed to load notification settings, using defaults: {}", e.getMessage());
            return NotificationSettings.defaults();
        }
    }

    private static NotificationSettings copy(NotificationSettings source) {
        return source.toBuilder()
                .quietHours(source.getQuietHours() != null ? source.getQuietHours().toBuilder().build() : null)
                .typeFilters(copyFilters(source.getTypeFilters()))
                .build();
    }

    private static Map<AlertType, Boolean> copyFilters(Map<AlertType, Boolean> filters) {
        Map<AlertType, Boolean> copy = new EnumMap<>(AlertType.class);
        if (filters != null) {
            copy.putAll(filters);
        }
        return copy;
    }
}
