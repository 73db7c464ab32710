package com.servealert.unit.lifecycle;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static com.servealert.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertFilters;
import com.servealert.lifecycle.AlertFilterService;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AlertFilterServiceTest {

    private AlertFilterService filterService;
    private List<Alert> alerts;

    @BeforeEach
    void setUp() {
        filterService = new AlertFilterService();
        alerts = List.of(
                alert("low-new", AlertPriority.LOW, AlertType.ORDER, BASE_TIME.plusMinutes(30)),
                alert("crit-old", AlertPriority.CRITICAL, AlertType.EQUIPMENT, BASE_TIME),
                alert("crit-new", AlertPriority.CRITICAL, AlertType.SAFETY, BASE_TIME.plusMinutes(20)),
                alert("high", AlertPriority.HIGH, AlertType.ORDER, BASE_TIME.plusMinutes(10)).toBuilder()
                        .read(true)
                        .tags(List.of("lunch"))
                        .build(),
                alert("resolved", AlertPriority.MEDIUM, AlertType.STAFF, BASE_TIME.plusMinutes(5)).toBuilder()
                        .status(AlertStatus.RESOLVED)
                        .details("Walk-in freezer door left open")
                        .build());
    }

    @Test
    @DisplayName("defaults hide resolved alerts and sort most urgent, then newest first")
    void defaultsSortAndHideResolved() {
        List<Alert> result = filterService.filterAlerts(alerts, null);

        assertThat(result).extracting(Alert::getId).containsExactly("crit-new", "crit-old", "high", "low-new");
    }

    @Test
    @DisplayName("priority and type sets restrict the view")
    void prioritiesAndTypes() {
        AlertFilters filters = AlertFilters.builder()
                .priorities(Set.of(AlertPriority.CRITICAL, AlertPriority.LOW))
                .types(Set.of(AlertType.ORDER, AlertType.EQUIPMENT))
                .build();

        assertThat(filterService.filterAlerts(alerts, filters))
                .extracting(Alert::getId)
                .containsExactly("crit-old", "low-new");
    }

    @Test
    @DisplayName("time bounds are inclusive")
    void inclusiveRange() {
        AlertFilters filters = AlertFilters.builder()
                .from(BASE_TIME.plusMinutes(10))
                .to(BASE_TIME.plusMinutes(20))
                .build();

        assertThat(filterService.filterAlerts(alerts, filters))
                .extracting(Alert::getId)
                .containsExactlyInAnyOrder("crit-new", "high");
    }

    @Test
    @DisplayName("search is case-insensitive over title, message and details")
    void search() {
        AlertFilters filters = AlertFilters.builder().searchQuery("FREEZER").includeResolved(true).build();

        assertThat(filterService.filterAlerts(alerts, filters)).extracting(Alert::getId).containsExactly("resolved");
    }

    @Test
    @DisplayName("tags match on any shared tag; unread-only drops read alerts")
    void tagsAndRead() {
        assertThat(filterService.filterAlerts(alerts, AlertFilters.builder().tags(Set.of("lunch", "x")).build()))
                .extracting(Alert::getId)
                .containsExactly("high");
        assertThat(filterService.filterAlerts(alerts, AlertFilters.builder().includeRead(false).build()))
                .extracting(Alert::getId)
                .doesNotContain("high");
    }

    @Test
    @DisplayName("status set restricts the view")
    void statusFilter() {
        AlertFilters filters = AlertFilters.builder()
                .statuses(Set.of(AlertStatus.RESOLVED))
                .includeResolved(true)
                .build();

        assertThat(filterService.filterAlerts(alerts, filters)).extracting(Alert::getId).containsExactly("resolved");
    }

    @Test
    @DisplayName("the input list is left as it was")
    void inputUntouched() {
        List<Alert> copy = List.copyOf(alerts);

        filterService.filterAlerts(alerts, AlertFilters.defaults());

        assertThat(alerts).containsExactlyElementsOf(copy);
    }
}
