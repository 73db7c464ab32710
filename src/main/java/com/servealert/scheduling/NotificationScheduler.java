package com.servealert.scheduling;

import com.servealert.delivery.NotificationDeliveryGate;
import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.enums.DayType;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.NotificationSettings;
import com.servealert.domain.model.SchedulingStats;
import com.servealert.domain.model.SimulationContext;
import com.servealert.observability.NotificationMetricsService;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Decides when an eligible alert's notification fires and which alerts are worth
 * notifying about at all.
 *
 * <p><b>Timers:</b> at most one pending timer per alert id, held in a concurrent map and
 * run on the single-threaded {@code notificationTimerExecutor}. A timer hands its alert
 * to the {@link NotificationDeliveryGate} and removes its own entry. CRITICAL alerts skip
 * the timer and go to the gate straight away.
 *
 * <p><b>Selection:</b> batching, engagement adaptation, time-of-day and service-period
 * filters are pure list transforms. The hour comes from the injected clock and every
 * random draw from the injected {@link Random}.
 */
@Service
public class NotificationScheduler {

    private static final Logger log = LoggerFactory.getLogger(NotificationScheduler.class);

    static final long HIGH_MIN_DELAY_MS = 30_000;
    static final long HIGH_MAX_DELAY_MS = 120_000;
    static final long MEDIUM_MIN_DELAY_MS = 120_000;
    static final long MEDIUM_MAX_DELAY_MS = 300_000;
    static final long LOW_MIN_DELAY_MS = 300_000;
    static final long LOW_MAX_DELAY_MS = 900_000;

    static final Duration RELATED_WINDOW = Duration.ofMinutes(5);
    static final int BUSY_PERIOD_LIMIT = 5;

    static final double BASE_TICK_PROBABILITY = 0.1;
    static final double MAX_TICK_PROBABILITY = 0.5;

    private final NotificationDeliveryGate notificationDeliveryGate;
    private final ScheduledExecutorService notificationTimerExecutor;
    private final Clock clock;
    private final Random random;

    private final Map<String, PendingNotification> pending = new ConcurrentHashMap<>();

    public NotificationScheduler(
            NotificationDeliveryGate notificationDeliveryGate,
            @Qualifier("notificationTimerExecutor") ScheduledExecutorService notificationTimerExecutor,
            Clock clock,
            Random random,
            NotificationMetricsService notificationMetricsService) {
        this.notificationDeliveryGate = notificationDeliveryGate;
        this.notificationTimerExecutor = notificationTimerExecutor;
        this.clock = clock;
        this.random = random;
        notificationMetricsService.bindPendingGauge(this, NotificationScheduler::getPendingCount);
    }

    // ========================
    // TIMING
    // ========================

    /**
     * Delay in milliseconds before the alert's notification fires: 0 for CRITICAL, else
     * uniform in [30s, 2m) for HIGH, [2m, 5m) for MEDIUM, [5m, 15m) for LOW.
     *
     * <p>{@code settings} does not change the bounds yet.
     */
    public long calculateOptimalNotificationTime(Alert alert, NotificationSettings settings) {
        return switch (alert.getPriority()) {
            case CRITICAL -> 0;
            case HIGH -> randomDelay(HIGH_MIN_DELAY_MS, HIGH_MAX_DELAY_MS);
            case MEDIUM -> randomDelay(MEDIUM_MIN_DELAY_MS, MEDIUM_MAX_DELAY_MS);
            case LOW -> randomDelay(LOW_MIN_DELAY_MS, LOW_MAX_DELAY_MS);
        };
    }

    /**
     * Schedules every alert that should notify and has not been sent yet.
     *
     * <p>Each alert is handled on its own: a failure is logged and the batch carries on.
     * An immediate (CRITICAL) alert only counts when the gate delivered it.
     *
     * @return how many alerts were scheduled or delivered
     */
    public int scheduleNotifications(List<Alert> alerts, NotificationSettings settings) {
        int scheduled = 0;
        for (Alert alert : alerts) {
            if (!alert.isShouldNotify() || alert.isNotificationSent()) {
                continue;
            }
            try {
                if (scheduleOne(alert, settings)) {
                    scheduled++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to schedule notification for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }
        log.debug("Scheduled {} of {} alerts", scheduled, alerts.size());
        return scheduled;
    }

    private boolean scheduleOne(Alert alert, NotificationSettings settings) {
        long delayMs = calculateOptimalNotificationTime(alert, settings);
        if (delayMs == 0) {
            return notificationDeliveryGate.deliver(alert, settings).isDelivered();
        }

        String alertId = alert.getId();
        PendingNotification entry = new PendingNotification(delayMs);
        PendingNotification previous = pending.put(alertId, entry);
        if (previous != null) {
            previous.cancel();
        }
        entry.attach(notificationTimerExecutor.schedule(
                () -> fire(alertId, alert, entry), delayMs, TimeUnit.MILLISECONDS));
        log.debug("Notification for alert {} ({}) due in {} ms", alertId, alert.getPriority(), delayMs);
        return true;
    }

    private void fire(String alertId, Alert alert, PendingNotification entry) {
        if (!pending.remove(alertId, entry)) {
            log.debug("Timer for alert {} was cancelled or replaced, not delivering", alertId);
            return;
        }
        try {
            notificationDeliveryGate.deliver(alert);
        } catch (RuntimeException e) {
            log.error("Scheduled notification for alert {} failed: {}", alertId, e.getMessage(), e);
        }
    }

    // ========================
    // CANCELLATION
    // ========================

    /** @return true if a pending timer existed for the id */
    public boolean cancelScheduledNotification(String alertId) {
        PendingNotification entry = pending.remove(alertId);
        if (entry == null) {
            return false;
        }
        entry.cancel();
        log.debug("Cancelled pending notification for alert {}", alertId);
        return true;
    }

    public void cancelAllScheduledNotifications() {
        for (String alertId : new ArrayList<>(pending.keySet())) {
            PendingNotification entry = pending.remove(alertId);
            if (entry != null) {
                entry.cancel();
            }
        }
    }

    public boolean isScheduled(String alertId) {
        return pending.containsKey(alertId);
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Without a history of past timers, total and pending both report the outstanding
     * timers. The average is the mean configured delay of those timers.
     */
    public SchedulingStats getSchedulingStats() {
        List<PendingNotification> snapshot = new ArrayList<>(pending.values());
        long averageDelay = snapshot.isEmpty()
                ? 0
                : Math.round(snapshot.stream().mapToLong(p -> p.delayMs).average().orElse(0));
        return SchedulingStats.builder()
                .totalScheduled(snapshot.size())
                .pendingNotifications(snapshot.size())
                .averageDelayMs(averageDelay)
                .build();
    }

    // ========================
    // SELECTION
    // ========================

    /**
     * Greedy single pass: each alert not yet taken seeds a batch and pulls in every later
     * untaken alert related to the seed. Relatedness is not followed transitively.
     */
    public List<List<Alert>> batchRelatedAlerts(List<Alert> alerts) {
        List<List<Alert>> batches = new ArrayList<>();
        Set<Integer> processed = new HashSet<>();

        for (int i = 0; i < alerts.size(); i++) {
            if (!processed.add(i)) {
                continue;
            }
            Alert seed = alerts.get(i);
            List<Alert> batch = new ArrayList<>();
            batch.add(seed);

            for (int j = i + 1; j < alerts.size(); j++) {
                if (!processed.contains(j) && areAlertsRelated(seed, alerts.get(j))) {
                    batch.add(alerts.get(j));
                    processed.add(j);
                }
            }
            batches.add(batch);
        }
        return batches;
    }

    /**
     * Same type less than five minutes apart, any two equipment alerts, or an inventory
     * alert paired with an order alert.
     */
    public static boolean areAlertsRelated(Alert first, Alert second) {
        AlertType a = first.getType();
        AlertType b = second.getType();
        if (a == b) {
            if (a == AlertType.EQUIPMENT) {
                return true;
            }
            if (first.getTimestamp() == null || second.getTimestamp() == null) {
                return false;
            }
            Duration gap = Duration.between(first.getTimestamp(), second.getTimestamp()).abs();
            return gap.compareTo(RELATED_WINDOW) < 0;
        }
        return (a == AlertType.INVENTORY && b == AlertType.ORDER) || (a == AlertType.ORDER && b == AlertType.INVENTORY);
    }

    /**
     * Below 0.3 only CRITICAL and HIGH survive. Above 0.8 LOW alerts are switched on for
     * notification (as copies). In between the input list is returned as is.
     */
    public List<Alert> adaptSchedulingBasedOnUserBehavior(List<Alert> alerts, double engagementScore) {
        if (engagementScore < 0.3) {
            return alerts.stream().filter(a -> a.getPriority().isUrgent()).toList();
        }
        if (engagementScore > 0.8) {
            return alerts.stream()
                    .map(a -> a.getPriority() == AlertPriority.LOW
                            ? a.toBuilder().shouldNotify(true).build()
                            : a)
                    .toList();
        }
        return alerts;
    }

    /**
     * Filters by the current hour: 05-08 urgent only, 08-18 everything, 18-22 urgent plus
     * roughly half of MEDIUM, otherwise CRITICAL only.
     */
    public List<Alert> optimizeForTimeOfDay(List<Alert> alerts) {
        int hour = LocalDateTime.now(clock).getHour();

        if (hour >= 5 && hour < 8) {
            return alerts.stream().filter(a -> a.getPriority().isUrgent()).toList();
        }
        if (hour >= 8 && hour < 18) {
            return alerts;
        }
        if (hour >= 18 && hour < 22) {
            List<Alert> kept = new ArrayList<>();
            for (Alert alert : alerts) {
                if (alert.getPriority().isUrgent()
                        || (alert.getPriority() == AlertPriority.MEDIUM && random.nextDouble() > 0.5)) {
                    kept.add(alert);
                }
            }
            return kept;
        }
        return alerts.stream().filter(a -> a.getPriority() == AlertPriority.CRITICAL).toList();
    }

    public List<Alert> scheduleForRestaurantContext(List<Alert> alerts, DemoScenario scenario) {
        if (scenario == null) {
            return alerts;
        }
        return switch (scenario) {
            case BUSY_LUNCH_RUSH -> prioritizeForBusyPeriod(alerts);
            case MORNING_PREP -> alerts.stream()
                    .filter(a -> a.getType() == AlertType.INVENTORY
                            || a.getType() == AlertType.EQUIPMENT
                            || a.getPriority() == AlertPriority.CRITICAL)
                    .toList();
            case EVENING_SERVICE -> reduceForEveningService(alerts);
            default -> alerts;
        };
    }

    private List<Alert> prioritizeForBusyPeriod(List<Alert> alerts) {
        List<Alert> sorted = new ArrayList<>(alerts);
        sorted.sort(Comparator.comparing(Alert::getPriority, AlertPriority.MOST_URGENT_FIRST));
        return sorted.subList(0, Math.min(sorted.size(), BUSY_PERIOD_LIMIT));
    }

    /** Most urgent alert of each batch; on a tie the later alert in the batch wins. */
    private List<Alert> reduceForEveningService(List<Alert> alerts) {
        List<Alert> reduced = new ArrayList<>();
        for (List<Alert> batch : batchRelatedAlerts(alerts)) {
            Alert best = batch.get(0);
            for (Alert candidate : batch) {
                if (candidate.getPriority().getRank() >= best.getPriority().getRank()) {
                    best = candidate;
                }
            }
            reduced.add(best);
        }
        return reduced;
    }

    // ========================
    // REAL-TIME SIMULATION
    // ========================

    /**
     * Per-tick chance of a new alert: 0.1 scaled by time of day, restaurant type and
     * weekend (×1.2), capped at 0.5.
     */
    public double calculateTickProbability(SimulationContext context) {
        double probability = BASE_TICK_PROBABILITY;
        if (context.getTimeOfDay() != null) {
            probability *= context.getTimeOfDay().getTickMultiplier();
        }
        if (context.getRestaurantType() != null) {
            probability *= switch (context.getRestaurantType()) {
                case FAST_CASUAL -> 1.3;
                case FINE_DINING -> 0.8;
                case CAFE -> 1.1;
                case BAR -> 0.9;
                default -> 1.0;
            };
        }
        if (context.getDayType() == DayType.WEEKEND) {
            probability *= 1.2;
        }
        return Math.min(probability, MAX_TICK_PROBABILITY);
    }

    public SimulationHandle startRealTimeSimulation(SimulationContext context, long intervalMs) {
        return startRealTimeSimulation(
                context, intervalMs, () -> log.info("Real-time simulation tick would generate an alert now"));
    }

    /**
     * Starts a repeating tick every {@code intervalMs}. Each tick draws against
     * {@link #calculateTickProbability} and runs {@code onTrigger} on success. A failing
     * trigger is logged and does not stop later ticks. Notifications already scheduled by
     * earlier ticks are not affected by cancelling the handle.
     */
    public SimulationHandle startRealTimeSimulation(SimulationContext context, long intervalMs, Runnable onTrigger) {
        ScheduledFuture<?> tick = notificationTimerExecutor.scheduleAtFixedRate(
                () -> {
                    try {
                        if (random.nextDouble() < calculateTickProbability(context)) {
                            onTrigger.run();
                        }
                    } catch (RuntimeException e) {
                        log.error("Real-time simulation tick failed: {}", e.getMessage(), e);
                    }
                },
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Real-time simulation started every {} ms for {}", intervalMs, context.getScenario());
        return new SimulationHandle(tick);
    }

    private long randomDelay(long minInclusive, long maxExclusive) {
        return minInclusive + random.nextInt((int) (maxExclusive - minInclusive));
    }

    /**
     * A timer entry. It is published in the map before the executor hands back its future,
     * so a cancel can arrive first; the future is then cancelled as soon as it is attached.
     */
    private static final class PendingNotification {

        private final long delayMs;
        private ScheduledFuture<?> future;
        private boolean cancelled;

        private PendingNotification(long delayMs) {
            this.delayMs = delayMs;
        }

        private synchronized void attach(ScheduledFuture<?> scheduled) {
            future = scheduled;
            if (cancelled) {
                future.cancel(false);
            }
        }

        private synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
