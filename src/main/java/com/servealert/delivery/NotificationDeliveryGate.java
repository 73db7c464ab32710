package com.servealert.delivery;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.DeliveryOutcome;
import com.servealert.domain.enums.ErrorCategory;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.DeliveryResult;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.domain.model.NotificationSettings;
import com.servealert.event.AlertEventPublisher;
import com.servealert.observability.NotificationMetricsService;
import com.servealert.recovery.ErrorRecoveryService;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Last check before an alert reaches the device.
 *
 * <p>Eligibility is evaluated in order and the first failing rule wins:
 * <ol>
 *   <li>notifications enabled (settings flag and session switch)</li>
 *   <li>permission granted</li>
 *   <li>priority allowed</li>
 *   <li>type allowed</li>
 *   <li>outside quiet hours, unless CRITICAL</li>
 *   <li>under the hourly cap, unless CRITICAL</li>
 * </ol>
 *
 * <p>A suppressed alert is not an error: the caller gets a {@link DeliveryResult} naming
 * the rule. A device failure is routed to the recovery service and also comes back as a
 * result, never as an exception. The gate never changes the alert it is given; on success
 * a {@code NotificationDeliveredEvent} is published so the lifecycle manager can book it.
 */
@Service
public class NotificationDeliveryGate {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryGate.class);

    private final NotificationSettingsService notificationSettingsService;
    private final NotificationPermissionManager notificationPermissionManager;
    private final QuietHoursPolicy quietHoursPolicy;
    private final NotificationRateLimiter notificationRateLimiter;
    private final NotificationPayloadFactory notificationPayloadFactory;
    private final NotificationGateway notificationGateway;
    private final AlertEventPublisher alertEventPublisher;
    private final NotificationMetricsService notificationMetricsService;
    private final ErrorRecoveryService errorRecoveryService;
    private final Clock clock;

    public NotificationDeliveryGate(
            NotificationSettingsService notificationSettingsService,
            NotificationPermissionManager notificationPermissionManager,
            QuietHoursPolicy quietHoursPolicy,
            NotificationRateLimiter notificationRateLimiter,
            NotificationPayloadFactory notificationPayloadFactory,
            NotificationGateway notificationGateway,
            AlertEventPublisher alertEventPublisher,
            NotificationMetricsService notificationMetricsService,
            ErrorRecoveryService errorRecoveryService,
            Clock clock) {
        this.notificationSettingsService = notificationSettingsService;
        this.notificationPermissionManager = notificationPermissionManager;
        this.quietHoursPolicy = quietHoursPolicy;
        this.notificationRateLimiter = notificationRateLimiter;
        this.notificationPayloadFactory = notificationPayloadFactory;
        this.notificationGateway = notificationGateway;
        this.alertEventPublisher = alertEventPublisher;
        this.notificationMetricsService = notificationMetricsService;
        this.errorRecoveryService = errorRecoveryService;
        this.clock = clock;
    }

    public DeliveryResult deliver(Alert alert) {
        return deliver(alert, notificationSettingsService.getSettings());
    }

    public DeliveryResult deliver(Alert alert, NotificationSettings settings) {
        DeliveryOutcome verdict = checkEligibility(alert, settings);
        if (verdict != DeliveryOutcome.DELIVERED) {
            log.debug("Notification for alert {} suppressed: {}", alert.getId(), verdict);
            notificationMetricsService.recordSuppressed(verdict);
            return DeliveryResult.skipped(alert.getId(), verdict, describe(verdict));
        }

        NotificationPayload payload = notificationPayloadFactory.build(alert, settings);
        String handle;
        try {
            handle = notificationGateway.scheduleLocal(payload);
        } catch (RuntimeException e) {
            errorRecoveryService.handleError(ErrorCategory.NOTIFICATION, e, "deliverNotification", alert.getId());
            return DeliveryResult.skipped(alert.getId(), DeliveryOutcome.DELIVERY_FAILED, e.getMessage());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        notificationRateLimiter.recordDispatch();

        log.debug("Notification {} delivered for alert {} ({})", handle, alert.getId(), alert.getPriority());
        alertEventPublisher.publishNotificationDelivered(this, alert.getId(), handle, now);
        return DeliveryResult.delivered(alert.getId(), handle);
    }

    /**
     * Runs the eligibility rules without delivering.
     *
     * @return {@link DeliveryOutcome#DELIVERED} when every rule passes, else the first
     *     rule that failed
     */
    public DeliveryOutcome checkEligibility(Alert alert, NotificationSettings settings) {
        if (!settings.isEnabled() || notificationSettingsService.isDisabledForSession()) {
            return DeliveryOutcome.NOTIFICATIONS_DISABLED;
        }
        if (notificationPermissionManager.checkPermissionStatus() != PermissionStatus.GRANTED) {
            return DeliveryOutcome.PERMISSION_NOT_GRANTED;
        }

        AlertPriority priority = alert.getPriority();
        if (!settings.isPriorityAllowed(priority)
                || (settings.getMinimumPriority() != null && !priority.isAtLeast(settings.getMinimumPriority()))) {
            return DeliveryOutcome.PRIORITY_FILTERED;
        }
        if (!settings.isTypeAllowed(alert.getType())) {
            return DeliveryOutcome.TYPE_FILTERED;
        }
        if (priority == AlertPriority.CRITICAL) {
            return DeliveryOutcome.DELIVERED;
        }
        if (quietHoursPolicy.isWithinQuietHours(settings.getQuietHours())) {
            return DeliveryOutcome.QUIET_HOURS;
        }
        if (notificationRateLimiter.isLimitReached(settings.getMaxPerHour())) {
            return DeliveryOutcome.RATE_LIMITED;
        }
        return DeliveryOutcome.DELIVERED;
    }

    public void cancelNotification(String handle) {
        try {
            notificationGateway.cancel(handle);
        } catch (RuntimeException e) {
            log.error("Failed to cancel notification {}: {}", handle, e.getMessage());
        }
    }

    public void cancelAllNotifications() {
        try {
            notificationGateway.cancelAll();
        } catch (RuntimeException e) {
            log.error("Failed to cancel all notifications: {}", e.getMessage());
        }
    }

    private static String describe(DeliveryOutcome outcome) {
        return switch (outcome) {
            case NOTIFICATIONS_DISABLED -> "Notifications are disabled";
            case PERMISSION_NOT_GRANTED -> "Notification permission not granted";
            case PRIORITY_FILTERED -> "Priority filtered by user settings";
            case TYPE_FILTERED -> "Alert type filtered by user settings";
            case QUIET_HOURS -> "Within quiet hours";
            case RATE_LIMITED -> "Hourly notification limit reached";
            case DELIVERY_FAILED -> "Device delivery failed";
            case DELIVERED -> null;
        };
    }
}
