package com.servealert.unit.delivery;

import static com.servealert.support.TestAlerts.alert;
import static org.assertj.core.api.Assertions.assertThat;

import com.servealert.delivery.NotificationPayloadFactory;
import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.NotificationPayload;
import com.servealert.domain.model.NotificationSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NotificationPayloadFactoryTest {

    private final NotificationPayloadFactory factory = new NotificationPayloadFactory();

    @ParameterizedTest(name = "{0}")
    @CsvSource({
        "CRITICAL, 🚨 CRITICAL: Walk-in cooler down, critical-alert.caf",
        "HIGH, ⚠️ HIGH: Walk-in cooler down, high-priority.caf",
        "MEDIUM, 📢 ALERT: Walk-in cooler down, medium-alert.caf",
        "LOW, 💡 INFO: Walk-in cooler down, low-priority.caf"
    })
    @DisplayName("title prefix, sound and category follow the priority")
    void perPriority(AlertPriority priority, String title, String sound) {
        Alert alert = alert("a-1", priority, AlertType.EQUIPMENT).toBuilder()
                .title("Walk-in cooler down")
                .build();

        NotificationPayload payload = factory.build(alert, NotificationSettings.defaults());

        assertThat(payload.getTitle()).isEqualTo(title);
        assertThat(payload.getSound()).isEqualTo(sound);
        assertThat(payload.getCategoryId()).isEqualTo(priority + "_ALERT");
    }

    @Test
    @DisplayName("long bodies are cut to 100 characters plus an ellipsis")
    void truncation() {
        String exact = "x".repeat(100);

        assertThat(factory.formatBody(exact)).isEqualTo(exact);
        assertThat(factory.formatBody(exact + "y")).isEqualTo(exact + "...");
        assertThat(factory.formatBody(null)).isEmpty();
    }

    @Test
    @DisplayName("routing data and device switches come from the alert and the settings")
    void dataAndSwitches() {
        NotificationSettings plain = NotificationSettings.defaults().toBuilder()
                .customSounds(false)
                .badge(false)
                .vibration(false)
                .build();

        NotificationPayload payload = factory.build(alert("a-7", AlertPriority.HIGH, AlertType.STAFF), plain);

        assertThat(payload.getData())
                .containsEntry("alertId", "a-7")
                .containsEntry("type", "STAFF")
                .containsEntry("priority", "HIGH");
        assertThat(payload.getSound()).isNull();
        assertThat(payload.getBadge()).isNull();
        assertThat(payload.isVibrate()).isFalse();
    }

    @Test
    @DisplayName("defaults show a badge of one and vibrate")
    void defaults() {
        NotificationPayload payload =
                factory.build(alert("a-8", AlertPriority.MEDIUM, AlertType.ORDER), NotificationSettings.defaults());

        assertThat(payload.getBadge()).isEqualTo(1);
        assertThat(payload.isVibrate()).isTrue();
    }
}
