package com.servealert.unit.delivery;

import static com.servealert.support.TestAlerts.clockAtHour;
import static org.assertj.core.api.Assertions.assertThat;

import com.servealert.delivery.QuietHoursPolicy;
import com.servealert.domain.model.QuietHours;
import java.time.LocalTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QuietHoursPolicyTest {

    private static QuietHours window(String start, String end) {
        return QuietHours.builder()
                .enabled(true)
                .start(LocalTime.parse(start))
                .end(LocalTime.parse(end))
                .build();
    }

    @ParameterizedTest(name = "{0} in 22:00-08:00 -> {1}")
    @CsvSource({"23:00, true", "06:00, true", "22:00, true", "08:00, true", "08:01, false", "12:00, false"})
    @DisplayName("a window past midnight covers both sides of it")
    void overnight(String time, boolean expected) {
        assertThat(QuietHoursPolicy.isWithinQuietHours(window("22:00", "08:00"), LocalTime.parse(time)))
                .isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} in 13:00-15:00 -> {1}")
    @CsvSource({"12:59, false", "13:00, true", "14:30, true", "15:00, true", "15:01, false"})
    @DisplayName("a same-day window includes both ends")
    void sameDay(String time, boolean expected) {
        assertThat(QuietHoursPolicy.isWithinQuietHours(window("13:00", "15:00"), LocalTime.parse(time)))
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("seconds are ignored at the end minute")
    void minutePrecision() {
        assertThat(QuietHoursPolicy.isWithinQuietHours(window("22:00", "08:00"), LocalTime.of(8, 0, 45)))
                .isTrue();
    }

    @Test
    @DisplayName("disabled or missing windows never apply")
    void disabled() {
        QuietHours off = window("00:00", "23:59").toBuilder().enabled(false).build();

        assertThat(QuietHoursPolicy.isWithinQuietHours(off, LocalTime.NOON)).isFalse();
        assertThat(QuietHoursPolicy.isWithinQuietHours(null, LocalTime.NOON)).isFalse();
    }

    @Test
    @DisplayName("the instance form reads the injected clock")
    void usesClock() {
        assertThat(new QuietHoursPolicy(clockAtHour(23)).isWithinQuietHours(window("22:00", "08:00"))).isTrue();
        assertThat(new QuietHoursPolicy(clockAtHour(12)).isWithinQuietHours(window("22:00", "08:00"))).isFalse();
    }
}
