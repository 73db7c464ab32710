package com.servealert.unit.observability;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;

import com.servealert.domain.enums.AlertChangeType;
import com.servealert.domain.enums.DeliveryOutcome;
import com.servealert.event.AlertCollectionChangedEvent;
import com.servealert.event.NotificationDeliveredEvent;
import com.servealert.observability.NotificationMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NotificationMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private NotificationMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new NotificationMetricsService(registry);
    }

    private double counter(String name) {
        return registry.get(name).counter().count();
    }

    @Test
    @DisplayName("only CREATED changes count as generated alerts")
    void generated() {
        metrics.onAlertCollectionChanged(
                new AlertCollectionChangedEvent(this, AlertChangeType.CREATED, List.of("a", "b", "c"), "addAlerts"));
        metrics.onAlertCollectionChanged(
                new AlertCollectionChangedEvent(this, AlertChangeType.UPDATED, List.of("a"), "acknowledge"));

        assertThat(counter("alerts.generated.count")).isEqualTo(3.0);
    }

    @Test
    @DisplayName("each delivered event counts once")
    void delivered() {
        metrics.onNotificationDelivered(new NotificationDeliveredEvent(this, "a", "n-1", BASE_TIME));
        metrics.onNotificationDelivered(new NotificationDeliveredEvent(this, "b", "n-2", BASE_TIME));

        assertThat(counter("notifications.delivered.count")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("suppressions are tagged by reason")
    void suppressed() {
        metrics.recordSuppressed(DeliveryOutcome.QUIET_HOURS);
        metrics.recordSuppressed(DeliveryOutcome.QUIET_HOURS);
        metrics.recordSuppressed(DeliveryOutcome.RATE_LIMITED);

        assertThat(registry.get("notifications.suppressed.count").tag("reason", "quiet_hours").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("notifications.suppressed.count").tag("reason", "rate_limited").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("the pending gauge reads the owner on each poll")
    void pendingGauge() {
        AtomicInteger pending = new AtomicInteger(2);
        metrics.bindPendingGauge(pending, AtomicInteger::get);

        pending.set(5);

        assertThat(registry.get("notifications.pending").gauge().value()).isEqualTo(5.0);
    }
}
