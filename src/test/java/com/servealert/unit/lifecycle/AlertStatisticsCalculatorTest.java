package com.servealert.unit.lifecycle;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static com.servealert.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertStatistics;
import com.servealert.domain.model.AssignmentMetrics;
import com.servealert.lifecycle.AlertStatisticsCalculator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AlertStatisticsCalculatorTest {

    private AlertStatisticsCalculator calculator;
    private List<Alert> alerts;

    @BeforeEach
    void setUp() {
        calculator = new AlertStatisticsCalculator();
        alerts = List.of(
                alert("c1", AlertPriority.CRITICAL, AlertType.EQUIPMENT, BASE_TIME),
                alert("c2", AlertPriority.CRITICAL, AlertType.SAFETY, BASE_TIME).toBuilder()
                        .status(AlertStatus.ACKNOWLEDGED)
                        .read(true)
                        .assignedTo("cook-1")
                        .build(),
                alert("r1", AlertPriority.HIGH, AlertType.ORDER, BASE_TIME).toBuilder()
                        .status(AlertStatus.RESOLVED)
                        .resolvedAt(BASE_TIME.plusMinutes(10))
                        .assignedTo("cook-1")
                        .build(),
                alert("r2", AlertPriority.LOW, AlertType.ORDER, BASE_TIME).toBuilder()
                        .status(AlertStatus.RESOLVED)
                        .resolvedAt(BASE_TIME.plusMinutes(25))
                        .assignedTo("cook-1")
                        .build(),
                alert("late", AlertPriority.MEDIUM, AlertType.STAFF, BASE_TIME.plusDays(1)));
    }

    @Nested
    @DisplayName("calculate")
    class Calculate {

        @Test
        @DisplayName("open range counts everything")
        void openRange() {
            AlertStatistics stats = calculator.calculate(alerts, null, null);

            assertThat(stats.getTotal()).isEqualTo(5);
            assertThat(stats.getByPriority()).containsEntry(AlertPriority.CRITICAL, 2L);
            assertThat(stats.getByType()).containsEntry(AlertType.ORDER, 2L);
            assertThat(stats.getByStatus()).containsEntry(AlertStatus.RESOLVED, 2L);
            assertThat(stats.getUnread()).isEqualTo(4);
            assertThat(stats.getCriticalActive()).isEqualTo(1);
            assertThat(stats.getAverageResolutionMinutes()).isEqualTo(17.5);
        }

        @Test
        @DisplayName("window bounds are inclusive")
        void window() {
            AlertStatistics stats = calculator.calculate(alerts, BASE_TIME, BASE_TIME.plusHours(1));

            assertThat(stats.getTotal()).isEqualTo(4);
            assertThat(stats.getByType()).doesNotContainKey(AlertType.STAFF);
        }

        @Test
        @DisplayName("nothing resolved gives a zero average")
        void noResolutions() {
            assertThat(calculator.calculate(alerts.subList(0, 2), null, null).getAverageResolutionMinutes()).isZero();
        }
    }

    @Test
    @DisplayName("assignment metrics only count the user's alerts")
    void assignmentMetrics() {
        AssignmentMetrics metrics = calculator.assignmentMetrics(alerts, "cook-1");

        assertThat(metrics.getTotalAssigned()).isEqualTo(3);
        assertThat(metrics.getActiveAssigned()).isEqualTo(1);
        assertThat(metrics.getResolvedAssigned()).isEqualTo(2);
        assertThat(metrics.getAverageResolutionMinutes()).isEqualTo(18);
        assertThat(metrics.getByPriority()).containsEntry(AlertPriority.CRITICAL, 1L);
    }

    @Test
    @DisplayName("unknown user has an empty workload")
    void unknownUser() {
        AssignmentMetrics metrics = calculator.assignmentMetrics(alerts, "nobody");

        assertThat(metrics.getTotalAssigned()).isZero();
        assertThat(metrics.getByPriority()).isEmpty();
    }
}
