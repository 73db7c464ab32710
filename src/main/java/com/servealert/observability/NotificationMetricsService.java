package com.servealert.observability;

import com.servealert.domain.enums.AlertChangeType;
import com.servealert.domain.enums.DeliveryOutcome;
import com.servealert.event.AlertCollectionChangedEvent;
import com.servealert.event.NotificationDeliveredEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.function.ToDoubleFunction;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the alert engine:
 * <ul>
 *   <li><b>alerts.generated.count</b> (counter): alerts inserted by generation or simulation</li>
 *   <li><b>notifications.delivered.count</b> (counter): hand-offs to the device gateway</li>
 *   <li><b>notifications.suppressed.count</b> (counter, tag {@code reason}): alerts the
 *       delivery gate held back</li>
 *   <li><b>notifications.pending</b> (gauge): outstanding notification timers</li>
 * </ul>
 *
 * <p>The first two follow application events; suppressions are reported by the gate and
 * the pending gauge is bound by the scheduler that owns the timers.
 */
@Service
public class NotificationMetricsService {

    static final String SUPPRESSED = "notifications.suppressed.count";

    private final MeterRegistry meterRegistry;
    private final Counter alertsGeneratedCounter;
    private final Counter notificationsDeliveredCounter;

    public NotificationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsGeneratedCounter = Counter.builder("alerts.generated.count")
                .description("Alerts inserted into the managed collection")
                .register(meterRegistry);

        this.notificationsDeliveredCounter = Counter.builder("notifications.delivered.count")
                .description("Notifications handed to the device gateway")
                .register(meterRegistry);
    }

    @EventListener
    public void onAlertCollectionChanged(AlertCollectionChangedEvent event) {
        if (event.getChangeType() == AlertChangeType.CREATED) {
            alertsGeneratedCounter.increment(event.getAlertIds().size());
        }
    }

    @EventListener
    public void onNotificationDelivered(NotificationDeliveredEvent event) {
        notificationsDeliveredCounter.increment();
    }

    public void recordSuppressed(DeliveryOutcome reason) {
        Counter.builder(SUPPRESSED)
                .description("Notifications held back by the delivery gate")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public <T> void bindPendingGauge(T owner, ToDoubleFunction<T> pendingCount) {
        meterRegistry.gauge("notifications.pending", owner, pendingCount);
    }
}
