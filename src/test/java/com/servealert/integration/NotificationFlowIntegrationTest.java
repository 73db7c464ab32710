package com.servealert.integration;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static com.servealert.support.TestAlerts.context;
import static com.servealert.support.TestAlerts.objectMapper;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.servealert.config.ServeAlertProperties;
import com.servealert.delivery.NotificationDeliveryGate;
import com.servealert.delivery.NotificationGateway;
import com.servealert.delivery.NotificationPayloadFactory;
import com.servealert.delivery.NotificationPermissionManager;
import com.servealert.delivery.NotificationRateLimiter;
import com.servealert.delivery.NotificationResponseController;
import com.servealert.delivery.NotificationResponseHandler;
import com.servealert.delivery.NotificationSettingsService;
import com.servealert.delivery.QuietHoursPolicy;
import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.enums.ErrorCategory;
import com.servealert.domain.enums.PermissionStatus;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertGenerationOptions;
import com.servealert.domain.model.NotificationCategory;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.domain.model.NotificationResponse;
import com.servealert.domain.model.NotificationSettingsUpdate;
import com.servealert.domain.model.QuietHours;
import com.servealert.event.AlertCollectionChangedEvent;
import com.servealert.event.AlertEventPublisher;
import com.servealert.event.NotificationDeliveredEvent;
import com.servealert.event.NotificationResponseEvent;
import com.servealert.exception.NotificationDeliveryException;
import com.servealert.lifecycle.AlertFilterService;
import com.servealert.lifecycle.AlertLifecycleService;
import com.servealert.lifecycle.AlertStatisticsCalculator;
import com.servealert.lifecycle.AlertStore;
import com.servealert.observability.NotificationMetricsService;
import com.servealert.persistence.AlertStorageService;
import com.servealert.recovery.AppError;
import com.servealert.recovery.ErrorRecoveryService;
import com.servealert.scheduling.NotificationScheduler;
import com.servealert.support.InMemoryKeyValueStore;
import com.servealert.support.ManualTimerExecutor;
import com.servealert.support.MutableClock;
import com.servealert.synthesis.AlertSynthesisEngine;
import com.servealert.synthesis.AlertTemplateCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

/**
 * End-to-end notification flow over real components: generation, persistence, the
 * scheduler, the delivery gate and the response path back into the lifecycle.
 *
 * <p>Only the edges are replaced: a recording device gateway, an in-memory key-value
 * store, a timer executor the test fires by hand, and an event publisher that calls the
 * listeners the way Spring would.
 */
class NotificationFlowIntegrationTest {

    private static final AlertGenerationOptions LUNCH_RUSH =
            AlertGenerationOptions.builder().scenario(DemoScenario.BUSY_LUNCH_RUSH).build();

    private final List<Consumer<Object>> listeners = new CopyOnWriteArrayList<>();

    private MutableClock clock;
    private ManualTimerExecutor timerExecutor;
    private RecordingGateway gateway;
    private SimpleMeterRegistry meterRegistry;
    private NotificationSettingsService settingsService;
    private ErrorRecoveryService recoveryService;
    private NotificationScheduler scheduler;
    private AlertLifecycleService lifecycle;
    private NotificationResponseController responseController;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(BASE_TIME);
        timerExecutor = new ManualTimerExecutor();
        gateway = new RecordingGateway();
        meterRegistry = new SimpleMeterRegistry();

        ServeAlertProperties properties = new ServeAlertProperties();
        ApplicationEventPublisher springPublisher = event -> listeners.forEach(listener -> listener.accept(event));
        AlertEventPublisher publisher = new AlertEventPublisher(springPublisher);

        AlertStorageService storage =
                new AlertStorageService(new InMemoryKeyValueStore(), objectMapper(), clock, properties);
        settingsService = new NotificationSettingsService(storage);
        recoveryService = new ErrorRecoveryService(storage, settingsService, properties, clock);
        NotificationMetricsService metrics = new NotificationMetricsService(meterRegistry);

        NotificationDeliveryGate gate = new NotificationDeliveryGate(
                settingsService,
                new NotificationPermissionManager(gateway, storage),
                new QuietHoursPolicy(clock),
                new NotificationRateLimiter(clock),
                new NotificationPayloadFactory(),
                gateway,
                publisher,
                metrics,
                recoveryService,
                clock);
        scheduler = new NotificationScheduler(gate, timerExecutor, clock, new Random(3), metrics);
        lifecycle = new AlertLifecycleService(
                new AlertStore(),
                new AlertSynthesisEngine(new AlertTemplateCatalog(), clock, new Random(3)),
                storage,
                scheduler,
                settingsService,
                new AlertFilterService(),
                new AlertStatisticsCalculator(),
                publisher,
                recoveryService,
                properties,
                clock,
                new Random(3));
        NotificationResponseHandler responseHandler = new NotificationResponseHandler(lifecycle, properties);
        responseController = new NotificationResponseController(publisher, clock);

        listeners.add(event -> {
            if (event instanceof NotificationDeliveredEvent delivered) {
                lifecycle.onNotificationDelivered(delivered);
                metrics.onNotificationDelivered(delivered);
            } else if (event instanceof AlertCollectionChangedEvent changed) {
                metrics.onAlertCollectionChanged(changed);
            } else if (event instanceof NotificationResponseEvent response) {
                responseHandler.onNotificationResponse(response);
            }
        });
    }

    @AfterEach
    void tearDown() {
        timerExecutor.shutdownNow();
    }

    private List<Alert> lunchRush() {
        return lifecycle.generateAlerts(context(72, false), LUNCH_RUSH);
    }

    private static String idOf(List<Alert> alerts, AlertPriority priority) {
        return alerts.stream().filter(a -> a.getPriority() == priority).findFirst().orElseThrow().getId();
    }

    private double suppressed(String reason) {
        return meterRegistry.get("notifications.suppressed.count").tag("reason", reason).counter().count();
    }

    private void respond(String alertId, String action) {
        responseController.onResponse(NotificationResponse.builder()
                .notificationId("n-" + alertId)
                .data(Map.of("alertId", alertId))
                .actionIdentifier(action)
                .build());
    }

    @Test
    @DisplayName("critical goes out at once, high alerts follow when their timers fire")
    void lunchRushDelivery() {
        List<Alert> created = lunchRush();
        String criticalId = idOf(created, AlertPriority.CRITICAL);

        assertThat(gateway.presented).extracting(NotificationPayload::getTitle)
                .containsExactly("🚨 CRITICAL: Freezer Temperature Alert");
        Alert storedCritical = lifecycle.getAlertById(criticalId).orElseThrow();
        assertThat(storedCritical.isNotificationSent()).isTrue();
        assertThat(storedCritical.getNotificationId()).isEqualTo(gateway.handles.get(0));
        assertThat(scheduler.getPendingCount()).isEqualTo(2);
        assertThat(timerExecutor.queuedDelaysMs())
                .allSatisfy(delay -> assertThat(delay).isBetween(30_000L, 119_999L));

        timerExecutor.runPending();

        assertThat(gateway.presented).hasSize(3);
        assertThat(lifecycle.getAllAlerts()).allMatch(Alert::isNotificationSent);
        assertThat(scheduler.getPendingCount()).isZero();
        assertThat(meterRegistry.get("alerts.generated.count").counter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("notifications.delivered.count").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("acknowledging from the notification cancels the pending timer")
    void acknowledgeFromNotification() {
        List<Alert> created = lunchRush();
        String highId = idOf(created, AlertPriority.HIGH);

        respond(highId, "ACKNOWLEDGE");

        Alert acknowledged = lifecycle.getAlertById(highId).orElseThrow();
        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo(NotificationResponseHandler.NOTIFICATION_USER);
        assertThat(scheduler.isScheduled(highId)).isFalse();

        timerExecutor.runPending();

        assertThat(gateway.presented).hasSize(2);
        assertThat(lifecycle.getAlertById(highId).orElseThrow().isNotificationSent()).isFalse();
    }

    @Test
    @DisplayName("dismissing a critical alert from the lock screen is refused")
    void dismissCriticalRefused() {
        String criticalId = idOf(lunchRush(), AlertPriority.CRITICAL);

        respond(criticalId, "dismiss");

        assertThat(lifecycle.getAlertById(criticalId).orElseThrow().getStatus()).isEqualTo(AlertStatus.ACTIVE);
    }

    @Test
    @DisplayName("quiet hours hold back the high alerts at night but not the critical one")
    void quietHoursAtNight() {
        settingsService.updateSettings(NotificationSettingsUpdate.builder()
                .quietHours(QuietHours.builder()
                        .enabled(true)
                        .start(LocalTime.of(22, 0))
                        .end(LocalTime.of(8, 0))
                        .build())
                .build());
        clock.advance(Duration.ofHours(11));

        lunchRush();
        timerExecutor.runPending();

        assertThat(gateway.presented)
                .extracting(NotificationPayload::getCategoryId)
                .containsExactly("CRITICAL_ALERT");
        assertThat(suppressed("quiet_hours")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("a device failure switches notifications off for the session and alerts stay in-app")
    void deviceFailureDegrades() {
        gateway.failDelivery = true;

        List<Alert> created = lunchRush();
        timerExecutor.runPending();

        assertThat(settingsService.isDisabledForSession()).isTrue();
        assertThat(suppressed("notifications_disabled")).isEqualTo(2.0);
        assertThat(lifecycle.getActiveAlerts()).hasSize(created.size()).noneMatch(Alert::isNotificationSent);
        assertThat(recoveryService.getErrorLog())
                .extracting(AppError::getCategory, AppError::getOperation)
                .containsExactly(tuple(ErrorCategory.NOTIFICATION, "deliverNotification"));
    }

    @Test
    @DisplayName("without device permission nothing is presented")
    void permissionDenied() {
        gateway.permission = PermissionStatus.DENIED;

        lunchRush();
        timerExecutor.runPending();

        assertThat(gateway.presented).isEmpty();
        assertThat(suppressed("permission_not_granted")).isEqualTo(3.0);
    }

    /** Device gateway that records what it was asked to present. */
    private static final class RecordingGateway implements NotificationGateway {

        private final List<NotificationPayload> presented = new ArrayList<>();
        private final List<String> handles = new ArrayList<>();
        private volatile PermissionStatus permission = PermissionStatus.GRANTED;
        private volatile boolean failDelivery;

        @Override
        public PermissionStatus requestPermission() {
            return permission;
        }

        @Override
        public PermissionStatus checkPermission() {
            return permission;
        }

        @Override
        public synchronized String scheduleLocal(NotificationPayload payload) {
            if (failDelivery) {
                throw new NotificationDeliveryException("device unreachable");
            }
            String handle = "device-" + (handles.size() + 1);
            presented.add(payload);
            handles.add(handle);
            return handle;
        }

        @Override
        public void cancel(String handle) {}

        @Override
        public void cancelAll() {}

        @Override
        public void registerCategories(List<NotificationCategory> categories) {}
    }
}
