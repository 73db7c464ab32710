package com.servealert.recovery;

import com.servealert.config.ServeAlertProperties;
import com.servealert.delivery.NotificationSettingsService;
import com.servealert.domain.enums.ErrorCategory;
import com.servealert.domain.enums.RecoveryAction;
import com.servealert.exception.BaseException;
import com.servealert.exception.NotificationDeliveryException;
import com.servealert.exception.PermissionDeniedException;
import com.servealert.exception.StorageException;
import com.servealert.persistence.AlertStorageService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Central handling for recoverable failures (storage and device delivery, mostly).
 *
 * <p>Each failure is classified into an {@link ErrorCategory}, logged with its operation,
 * alert id and time, kept in a bounded in-memory log, and answered with the first
 * action of the category's strategy:
 * <ul>
 *   <li>NETWORK: serve cached data, else prompt a retry</li>
 *   <li>STORAGE: clear and reinitialize the persisted store, else require a restart</li>
 *   <li>NOTIFICATION, PERMISSION: disable notifications for the session</li>
 * </ul>
 *
 * <p>Never throws. The worst outcome is a failed {@link RecoveryResult}.
 */
@Service
public class ErrorRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryService.class);

    private static final int RECENT_LIMIT = 10;

    private static final Map<ErrorCategory, List<RecoveryAction>> STRATEGIES = new EnumMap<>(ErrorCategory.class);
    private static final Map<ErrorCategory, List<String>> SUGGESTIONS = new EnumMap<>(ErrorCategory.class);

    static {
        STRATEGIES.put(ErrorCategory.NETWORK, List.of(RecoveryAction.SHOW_CACHED, RecoveryAction.RETRY_PROMPT));
        STRATEGIES.put(ErrorCategory.STORAGE, List.of(RecoveryAction.REINITIALIZE, RecoveryAction.RESTART_REQUIRED));
        STRATEGIES.put(ErrorCategory.NOTIFICATION, List.of(RecoveryAction.DEGRADE_GRACEFULLY));
        STRATEGIES.put(ErrorCategory.PERMISSION, List.of(RecoveryAction.DEGRADE_GRACEFULLY));

        SUGGESTIONS.put(ErrorCategory.NETWORK, List.of(
                "Check your internet connection",
                "Try again in a few moments",
                "Switch to mobile data if using WiFi",
                "Restart the app if problem persists"));
        SUGGESTIONS.put(ErrorCategory.STORAGE, List.of(
                "Restart the app to clear temporary data",
                "Ensure device has sufficient storage space",
                "Try clearing app cache",
                "Contact support if issue continues"));
        SUGGESTIONS.put(ErrorCategory.NOTIFICATION, List.of(
                "Check notification permissions in device settings",
                "Enable notifications for this app",
                "Restart the app to refresh permissions",
                "You can still view alerts within the app"));
        SUGGESTIONS.put(ErrorCategory.PERMISSION, List.of(
                "Grant necessary permissions in device settings",
                "Some features may be limited without permissions",
                "Restart the app after changing permissions",
                "Alternative workflows are available"));
    }

    private final AlertStorageService alertStorageService;
    private final NotificationSettingsService notificationSettingsService;
    private final Clock clock;
    private final int capacity;

    private final Deque<AppError> errorLog = new ArrayDeque<>();

    public ErrorRecoveryService(
            AlertStorageService alertStorageService,
            NotificationSettingsService notificationSettingsService,
            ServeAlertProperties serveAlertProperties,
            Clock clock) {
        this.alertStorageService = alertStorageService;
        this.notificationSettingsService = notificationSettingsService;
        this.clock = clock;
        this.capacity = Math.max(1, serveAlertProperties.getErrorLog().getCapacity());
    }

    // ========================
    // HANDLING
    // ========================

    /** Classifies {@code error} from its type and message, then handles it. */
    public RecoveryResult handleError(Throwable error, String operation, String alertId) {
        return handleError(classify(error), error, operation, alertId);
    }

    public RecoveryResult handleError(ErrorCategory category, Throwable error, String operation, String alertId) {
        if (alertId == null && error instanceof BaseException baseException) {
            alertId = baseException.getAlertId().orElse(null);
        }
        AppError appError = AppError.builder()
                .category(category)
                .operation(operation)
                .alertId(alertId)
                .message(error != null ? error.getMessage() : null)
                .timestamp(LocalDateTime.now(clock))
                .recoverable(isRecoverable(category, error))
                .build();

        log.error(
                "{} failure in {} (alertId={}, at={}): {}",
                category,
                operation,
                alertId,
                appError.getTimestamp(),
                appError.getMessage(),
                error);
        record(appError);

        RecoveryAction action = determineRecoveryAction(category);
        try {
            return execute(appError, action);
        } catch (RuntimeException e) {
            log.error("Recovery action {} failed for {}: {}", action, operation, e.getMessage(), e);
            return RecoveryResult.builder()
                    .success(false)
                    .action(action)
                    .error(appError)
                    .failureReason(e.getMessage())
                    .build();
        }
    }

    public ErrorCategory classify(Throwable error) {
        if (error instanceof StorageException || error instanceof DataAccessException) {
            return ErrorCategory.STORAGE;
        }
        if (error instanceof PermissionDeniedException) {
            return ErrorCategory.PERMISSION;
        }
        if (error instanceof NotificationDeliveryException) {
            return ErrorCategory.NOTIFICATION;
        }

        String message = error != null && error.getMessage() != null
                ? error.getMessage().toLowerCase(Locale.ROOT)
                : "";
        if (message.contains("storage")) {
            return ErrorCategory.STORAGE;
        }
        if (message.contains("permission")) {
            return ErrorCategory.PERMISSION;
        }
        if (message.contains("notification")) {
            return ErrorCategory.NOTIFICATION;
        }
        return ErrorCategory.NETWORK;
    }

    public RecoveryAction determineRecoveryAction(ErrorCategory category) {
        List<RecoveryAction> strategy = STRATEGIES.get(category);
        return strategy == null || strategy.isEmpty() ? RecoveryAction.RESTART_REQUIRED : strategy.get(0);
    }

    // ========================
    // QUERIES
    // ========================

    public List<String> getRecoverySuggestions(ErrorCategory category) {
        return SUGGESTIONS.getOrDefault(category, List.of("Please try restarting the app"));
    }

    public synchronized ErrorStatistics getErrorStatistics() {
        Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
        long recoverable = 0;
        for (AppError error : errorLog) {
            byCategory.merge(error.getCategory(), 1L, Long::sum);
            if (error.isRecoverable()) {
                recoverable++;
            }
        }

        LocalDateTime dayAgo = LocalDateTime.now(clock).minusHours(24);
        List<AppError> recent = errorLog.stream()
                .filter(e -> e.getTimestamp().isAfter(dayAgo))
                .toList();
        if (recent.size() > RECENT_LIMIT) {
            recent = recent.subList(recent.size() - RECENT_LIMIT, recent.size());
        }

        return ErrorStatistics.builder()
                .totalErrors(errorLog.size())
                .errorsByCategory(byCategory)
                .recentErrors(recent)
                .recoverableRate((double) recoverable / Math.max(errorLog.size(), 1))
                .build();
    }

    public synchronized List<AppError> getErrorLog() {
        return new ArrayList<>(errorLog);
    }

    public synchronized void clearErrorLog() {
        errorLog.clear();
    }

    // ========================
    // INTERNALS
    // ========================

    private RecoveryResult execute(AppError appError, RecoveryAction action) {
        RecoveryResult.RecoveryResultBuilder result = RecoveryResult.builder().action(action).error(appError);

        switch (action) {
            case SHOW_CACHED -> log.info("Serving cached alerts after failure in {}", appError.getOperation());
            case RETRY_PROMPT -> log.info("Caller should retry {}", appError.getOperation());
            case REINITIALIZE -> {
                try {
                    alertStorageService.clearAll();
                    log.warn("Persisted store cleared and reinitialized after failure in {}", appError.getOperation());
                } catch (StorageException e) {
                    log.error("Storage reinitialization failed, restart required: {}", e.getMessage());
                    return result.success(false)
                            .action(RecoveryAction.RESTART_REQUIRED)
                            .failureReason("Storage recovery failed: " + e.getMessage())
                            .build();
                }
            }
            case DEGRADE_GRACEFULLY -> {
                notificationSettingsService.disableForSession();
                log.warn("Notifications disabled for this session; alerts remain visible in-app");
            }
            case RESTART_REQUIRED -> log.warn("Restart required after failure in {}", appError.getOperation());
        }
        return result.success(true).build();
    }

    private static boolean isRecoverable(ErrorCategory category, Throwable error) {
        if (error instanceof BaseException baseException) {
            return baseException.isRecoverable();
        }
        return category != ErrorCategory.STORAGE;
    }

    private synchronized void record(AppError appError) {
        errorLog.addLast(appError);
        while (errorLog.size() > capacity) {
            errorLog.removeFirst();
        }
    }
}
