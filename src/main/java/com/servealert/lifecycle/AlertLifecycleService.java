package com.servealert.lifecycle;

import com.servealert.config.ServeAlertProperties;
import com.servealert.delivery.NotificationSettingsService;
import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.enums.ErrorCategory;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertFilters;
import com.servealert.domain.model.AlertGenerationOptions;
import com.servealert.domain.model.AlertStatistics;
import com.servealert.domain.model.AssignmentMetrics;
import com.servealert.domain.model.RestaurantContext;
import com.servealert.event.AlertEventPublisher;
import com.servealert.event.NotificationDeliveredEvent;
import com.servealert.exception.AlertNotFoundException;
import com.servealert.exception.StorageException;
import com.servealert.lifecycle.command.AcknowledgeCommand;
import com.servealert.lifecycle.command.AddAlertsCommand;
import com.servealert.lifecycle.command.AddResolutionNotesCommand;
import com.servealert.lifecycle.command.AlertCommand;
import com.servealert.lifecycle.command.AssignCommand;
import com.servealert.lifecycle.command.ClearAllCommand;
import com.servealert.lifecycle.command.DismissCommand;
import com.servealert.lifecycle.command.DismissUntilRefreshCommand;
import com.servealert.lifecycle.command.MarkAsReadCommand;
import com.servealert.lifecycle.command.MarkHelpfulCommand;
import com.servealert.lifecycle.command.ReassignCommand;
import com.servealert.lifecycle.command.RecordNotificationSentCommand;
import com.servealert.lifecycle.command.ReplaceAllCommand;
import com.servealert.lifecycle.command.ResolveCommand;
import com.servealert.lifecycle.command.UnassignCommand;
import com.servealert.lifecycle.command.UpdateCureStepCommand;
import com.servealert.persistence.AlertStorageService;
import com.servealert.recovery.ErrorRecoveryService;
import com.servealert.scheduling.NotificationScheduler;
import com.servealert.synthesis.AlertSynthesisEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Owns the authoritative alert collection: creates alerts through the synthesis engine,
 * applies user transitions, answers filtered queries and keeps persistence in step.
 *
 * <p><b>Writes:</b> every change goes through {@link #commit}, which dispatches a command
 * to the {@link AlertStore}, persists the resulting collection and publishes an
 * {@code AlertCollectionChangedEvent}. Writes are serialized so the persisted copy never
 * lags behind a later in-memory state. A failed save is logged and handed to the recovery
 * service; the in-memory change stands and the next write or read retries the save.
 *
 * <p><b>Reads:</b> the working set is trusted for {@code servealert.cache.ttl}; a read
 * after that reloads from persistence first. A failed reload keeps the cached set.
 *
 * <p><b>Notifications:</b> newly created alerts are handed to the
 * {@link NotificationScheduler} as copies, outside the write lock. When the delivery gate
 * reports a hand-off, {@link #onNotificationDelivered} records it on the stored alert.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    private final AlertStore alertStore;
    private final AlertSynthesisEngine alertSynthesisEngine;
    private final AlertStorageService alertStorageService;
    private final NotificationScheduler notificationScheduler;
    private final NotificationSettingsService notificationSettingsService;
    private final AlertFilterService alertFilterService;
    private final AlertStatisticsCalculator alertStatisticsCalculator;
    private final AlertEventPublisher alertEventPublisher;
    private final ErrorRecoveryService errorRecoveryService;
    private final Clock clock;
    private final Random random;
    private final Duration cacheTtl;

    private final Object writeLock = new Object();
    private volatile boolean persistencePending;

    public AlertLifecycleService(
            AlertStore alertStore,
            AlertSynthesisEngine alertSynthesisEngine,
            AlertStorageService alertStorageService,
            NotificationScheduler notificationScheduler,
            NotificationSettingsService notificationSettingsService,
            AlertFilterService alertFilterService,
            AlertStatisticsCalculator alertStatisticsCalculator,
            AlertEventPublisher alertEventPublisher,
            ErrorRecoveryService errorRecoveryService,
            ServeAlertProperties properties,
            Clock clock,
            Random random) {
        this.alertStore = alertStore;
        this.alertSynthesisEngine = alertSynthesisEngine;
        this.alertStorageService = alertStorageService;
        this.notificationScheduler = notificationScheduler;
        this.notificationSettingsService = notificationSettingsService;
        this.alertFilterService = alertFilterService;
        this.alertStatisticsCalculator = alertStatisticsCalculator;
        this.alertEventPublisher = alertEventPublisher;
        this.errorRecoveryService = errorRecoveryService;
        this.clock = clock;
        this.random = random;
        this.cacheTtl = properties.getCache().getTtl();
    }

    // ========================
    // GENERATION
    // ========================

    public List<Alert> generateAlerts(RestaurantContext context) {
        return generateAlerts(context, AlertGenerationOptions.none());
    }

    /**
     * Synthesizes a batch of alerts, inserts them newest first, persists and schedules them.
     *
     * <p>An explicit scenario in {@code options} always wins. Otherwise a context in demo mode
     * gets the scenario that fits the moment, and anything else goes through weighted
     * generation with the optional count and distributions.
     */
    public List<Alert> generateAlerts(RestaurantContext context, AlertGenerationOptions options) {
        AlertGenerationOptions effective = options != null ? options : AlertGenerationOptions.none();
        List<Alert> generated = synthesize(context, effective);
        List<Alert> created = insert(generated, context);
        log.info("Generated {} alerts for {}", created.size(), context.getProfile().getName());
        return created;
    }

    /**
     * One tick of the live feed: with the per-minute probability from the synthesis engine,
     * creates a single alert and schedules it.
     */
    public Optional<Alert> simulateRealTimeAlert(RestaurantContext context) {
        double probability = alertSynthesisEngine.calculateAlertProbability(LocalDateTime.now(clock), context);
        if (random.nextDouble() >= probability) {
            return Optional.empty();
        }
        return Optional.of(createRealTimeAlert(context));
    }

    /** Creates, stores and schedules one weighted alert unconditionally. */
    public Alert createRealTimeAlert(RestaurantContext context) {
        Alert created = insert(List.of(alertSynthesisEngine.generateSingleAlert(context)), context).get(0);
        log.info("Real-time alert {} ({}) created", created.getId(), created.getPriority());
        return created;
    }

    private List<Alert> synthesize(RestaurantContext context, AlertGenerationOptions options) {
        if (options.getScenario() != null) {
            return alertSynthesisEngine.generateDemoScenario(options.getScenario(), context);
        }
        if (context.isDemoMode()) {
            DemoScenario scenario = alertSynthesisEngine.selectDemoScenario(context);
            log.debug("Demo mode picked scenario {}", scenario);
            return alertSynthesisEngine.generateDemoScenario(scenario, context);
        }
        int count = options.getAlertCount() != null
                ? options.getAlertCount()
                : alertSynthesisEngine.defaultAlertCount(context);
        return alertSynthesisEngine.generateRealisticAlerts(context, count, options);
    }

    private List<Alert> insert(List<Alert> generated, RestaurantContext context) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Alert> created = generated.stream().map(alert -> prepare(alert, context, now)).toList();
        if (created.isEmpty()) {
            return created;
        }

        synchronized (writeLock) {
            refreshIfStale();
            alertStore.dispatch(new AddAlertsCommand(created), now);
            persist(alertStore.snapshot(), "generateAlerts", null);
        }
        alertEventPublisher.publishAlertsCreated(this, created.stream().map(Alert::getId).toList());

        List<Alert> toSchedule = created.stream().map(alert -> alert.toBuilder().build()).toList();
        notificationScheduler.scheduleNotifications(toSchedule, notificationSettingsService.getSettings());
        return created;
    }

    private Alert prepare(Alert alert, RestaurantContext context, LocalDateTime now) {
        Set<String> tags = new LinkedHashSet<>(alert.getTags());
        tags.add(context.getProfile().getType().name());
        tags.add(AlertSynthesisEngine.timeBucketTag(now.getHour()));
        tags.add(capacityTag(context.capacityFraction()));

        return alert.toBuilder()
                .status(AlertStatus.ACTIVE)
                .read(false)
                .notificationSent(false)
                .shouldNotify(shouldNotifyAt(alert.getPriority(), now.getHour()))
                .tags(new ArrayList<>(tags))
                .build();
    }

    /** CRITICAL always; between 22:00 and 06:59 only HIGH besides; otherwise everything. */
    static boolean shouldNotifyAt(AlertPriority priority, int hour) {
        if (priority == AlertPriority.CRITICAL) {
            return true;
        }
        if (hour >= 22 || hour <= 6) {
            return priority == AlertPriority.HIGH;
        }
        return true;
    }

    static String capacityTag(double capacityFraction) {
        if (capacityFraction > 0.8) {
            return "high-capacity";
        }
        if (capacityFraction > 0.5) {
            return "medium-capacity";
        }
        return "low-capacity";
    }

    // ========================
    // TRANSITIONS
    // ========================

    public Alert acknowledgeAlert(String alertId, String userId) {
        Alert alert = commit(new AcknowledgeCommand(alertId, userId), alertId).getAlert();
        notificationScheduler.cancelScheduledNotification(alertId);
        return alert;
    }

    public Alert resolveAlert(String alertId) {
        Alert alert = commit(new ResolveCommand(alertId), alertId).getAlert();
        notificationScheduler.cancelScheduledNotification(alertId);
        return alert;
    }

    public Alert dismissAlert(String alertId) {
        Alert alert = commit(new DismissCommand(alertId), alertId).getAlert();
        notificationScheduler.cancelScheduledNotification(alertId);
        return alert;
    }

    public Alert markAsRead(String alertId) {
        return commit(new MarkAsReadCommand(alertId), alertId).getAlert();
    }

    public Alert assignAlert(
            String alertId, String assignedTo, String assignedToName, String assignedBy, String assignedByName) {
        return commit(new AssignCommand(alertId, assignedTo, assignedToName, assignedBy, assignedByName), alertId)
                .getAlert();
    }

    public Alert reassignAlert(
            String alertId,
            String assignedTo,
            String assignedToName,
            String assignedBy,
            String assignedByName,
            String reason) {
        return commit(
                        new ReassignCommand(alertId, assignedTo, assignedToName, assignedBy, assignedByName, reason),
                        alertId)
                .getAlert();
    }

    public Alert unassignAlert(String alertId, String unassignedBy) {
        return commit(new UnassignCommand(alertId, unassignedBy), alertId).getAlert();
    }

    public Alert updateCureStep(String alertId, String stepId, Boolean completed, String completedBy, String notes) {
        return commit(new UpdateCureStepCommand(alertId, stepId, completed, completedBy, notes), alertId)
                .getAlert();
    }

    public Alert addResolutionNotes(String alertId, String notes) {
        return commit(new AddResolutionNotesCommand(alertId, notes), alertId).getAlert();
    }

    public Alert markHelpful(String alertId, boolean helpful) {
        return commit(new MarkHelpfulCommand(alertId, helpful), alertId).getAlert();
    }

    public Alert dismissUntilRefresh(String alertId) {
        return commit(new DismissUntilRefreshCommand(alertId), alertId).getAlert();
    }

    /** Empties the collection and persisted list, and drops every pending notification timer. */
    public void clearAll() {
        notificationScheduler.cancelAllScheduledNotifications();
        commit(new ClearAllCommand(), null);
    }

    /**
     * Applies one command under the write lock. NotFound and InvalidTransition propagate
     * to the caller with the state untouched; an unchanged result is neither persisted nor
     * published.
     */
    AlertTransition commit(AlertCommand command, String alertId) {
        AlertTransition transition;
        synchronized (writeLock) {
            refreshIfStale();
            transition = alertStore.dispatch(command, LocalDateTime.now(clock));
            if (!transition.isChanged()) {
                log.debug("{} on alert {} changed nothing", command.name(), alertId);
                return transition;
            }
            persist(transition.getState(), command.name(), alertId);
        }

        log.info("Applied {} to alert {}", command.name(), alertId != null ? alertId : "*");
        if (command instanceof ClearAllCommand) {
            alertEventPublisher.publishAlertsCleared(this);
        } else {
            alertEventPublisher.publishAlertUpdated(this, alertId, command.name());
        }
        return transition;
    }

    private void persist(AlertState state, String operation, String alertId) {
        try {
            alertStorageService.saveAlerts(state.getAlerts());
            alertStorageService.saveAlertHistory(state.getAlerts());
            alertStore.markSynced(LocalDateTime.now(clock));
            persistencePending = false;
        } catch (StorageException e) {
            persistencePending = true;
            log.error("Failed to persist alerts after {} (alert {}) at {}: {}",
                    operation, alertId, LocalDateTime.now(clock), e.getMessage());
            errorRecoveryService.handleError(ErrorCategory.STORAGE, e, operation, alertId);
        }
    }

    // ========================
    // NOTIFICATION BOOKKEEPING
    // ========================

    @EventListener
    public void onNotificationDelivered(NotificationDeliveredEvent event) {
        try {
            commit(
                    new RecordNotificationSentCommand(
                            event.getAlertId(), event.getNotificationId(), event.getDeliveredAt()),
                    event.getAlertId());
        } catch (AlertNotFoundException e) {
            log.debug("Delivered notification {} refers to alert {} which is no longer held",
                    event.getNotificationId(), event.getAlertId());
        }
    }

    // ========================
    // QUERIES
    // ========================

    public Optional<Alert> getAlertById(String alertId) {
        return currentState().find(alertId);
    }

    public List<Alert> getAllAlerts() {
        return currentState().getAlerts();
    }

    /** ACTIVE or ACKNOWLEDGED. */
    public List<Alert> getActiveAlerts() {
        return currentState().getAlerts().stream()
                .filter(alert -> alert.getStatus().isOpen())
                .toList();
    }

    /** RESOLVED or DISMISSED. */
    public List<Alert> getAlertHistory() {
        return currentState().getAlerts().stream()
                .filter(alert -> alert.getStatus().isTerminal())
                .toList();
    }

    /** The working view: alerts hidden until the next refresh are left out before filtering. */
    public List<Alert> getFilteredAlerts(AlertFilters filters) {
        List<Alert> visible = currentState().getAlerts().stream()
                .filter(alert -> !alert.isDismissedUntilRefresh())
                .toList();
        return alertFilterService.filterAlerts(visible, filters);
    }

    public List<Alert> filterAlerts(List<Alert> alerts, AlertFilters filters) {
        return alertFilterService.filterAlerts(alerts, filters);
    }

    public AlertStatistics getStatistics() {
        return getStatistics(null, null);
    }

    public AlertStatistics getStatistics(LocalDateTime from, LocalDateTime to) {
        return alertStatisticsCalculator.calculate(currentState().getAlerts(), from, to);
    }

    public AssignmentMetrics getAssignmentMetrics(String userId) {
        return alertStatisticsCalculator.assignmentMetrics(currentState().getAlerts(), userId);
    }

    // ========================
    // CACHE
    // ========================

    /** Reloads from persistence now, regardless of the cache age. */
    public List<Alert> refresh() {
        synchronized (writeLock) {
            reload();
        }
        return alertStore.snapshot().getAlerts();
    }

    private AlertState currentState() {
        synchronized (writeLock) {
            refreshIfStale();
        }
        return alertStore.snapshot();
    }

    /** Callers hold the write lock. */
    private void refreshIfStale() {
        LocalDateTime lastSynced = alertStore.getLastSyncedAt();
        if (lastSynced == null || lastSynced.plus(cacheTtl).isBefore(LocalDateTime.now(clock))) {
            reload();
        }
    }

    private void reload() {
        if (persistencePending) {
            // unsaved changes win over the persisted copy
            persist(alertStore.snapshot(), "reload", null);
            return;
        }
        try {
            List<Alert> loaded = alertStorageService.loadAlerts();
            LocalDateTime now = LocalDateTime.now(clock);
            AlertTransition transition = alertStore.dispatch(new ReplaceAllCommand(loaded), now);
            alertStore.markSynced(now);
            log.debug("Reloaded {} alerts from storage", transition.getState().size());
            alertEventPublisher.publishAlertsReloaded(
                    this, transition.getState().getAlerts().stream().map(Alert::getId).toList());
        } catch (StorageException e) {
            // retry after another TTL rather than on every read
            alertStore.markSynced(LocalDateTime.now(clock));
            log.error("Failed to reload alerts, keeping {} cached: {}", alertStore.snapshot().size(), e.getMessage());
            errorRecoveryService.handleError(ErrorCategory.STORAGE, e, "loadAlerts", null);
        }
    }
}
