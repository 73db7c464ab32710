package com.servealert.unit.synthesis;

import static com.servealert.support.TestAlerts.BASE_TIME;
import static com.servealert.support.TestAlerts.clockAtHour;
import static com.servealert.support.TestAlerts.profile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.servealert.domain.enums.RestaurantType;
import com.servealert.domain.model.RestaurantContext;
import com.servealert.domain.model.RestaurantProfile;
import com.servealert.synthesis.RestaurantProfileFactory;
import java.time.DayOfWeek;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RestaurantProfileFactoryTest {

    private final RestaurantProfileFactory factory = new RestaurantProfileFactory(clockAtHour(12), new Random(5));

    @Nested
    @DisplayName("Profiles")
    class Profiles {

        @ParameterizedTest
        @EnumSource(RestaurantType.class)
        @DisplayName("every type gets a complete profile with hours for each weekday")
        void completeProfile(RestaurantType type) {
            RestaurantProfile profile = factory.generateRestaurantProfile(type);

            assertThat(profile.getId()).isNotBlank();
            assertThat(profile.getType()).isEqualTo(type);
            assertThat(profile.getCapacity()).isPositive();
            assertThat(profile.getPeakHours()).isNotEmpty().allMatch(h -> h.matches("\\d{2}:\\d{2}"));
            assertThat(profile.getHoursOfOperation()).hasSize(7);
            assertThat(profile.getEmail()).isEqualTo("info@" + type.name().toLowerCase() + "restaurant.com");
        }

        @Test
        @DisplayName("fast casual sizing matches the burger joint")
        void fastCasual() {
            RestaurantProfile profile = factory.generateRestaurantProfile(RestaurantType.FAST_CASUAL);

            assertThat(profile.getName()).endsWith(" Burger Co.");
            assertThat(profile.getCapacity()).isEqualTo(80);
            assertThat(profile.getStaffCount()).isEqualTo(12);
        }

        @Test
        @DisplayName("catering is closed on Sunday only")
        void cateringSunday() {
            RestaurantProfile profile = factory.generateRestaurantProfile(RestaurantType.CATERING);

            assertThat(profile.getHoursOfOperation().get(DayOfWeek.SUNDAY).isClosed()).isTrue();
            assertThat(profile.getHoursOfOperation().get(DayOfWeek.MONDAY).isClosed()).isFalse();
        }
    }

    @Nested
    @DisplayName("Operating hours")
    class OperatingHoursRules {

        @Test
        @DisplayName("a bar open past midnight counts 01:00 as open and 03:00 as closed")
        void overnight() {
            RestaurantProfile bar = factory.generateRestaurantProfile(RestaurantType.BAR);

            assertThat(factory.isWithinOperatingHours(bar, BASE_TIME.withHour(1))).isTrue();
            assertThat(factory.isWithinOperatingHours(bar, BASE_TIME.withHour(3))).isFalse();
            assertThat(factory.isWithinOperatingHours(bar, BASE_TIME.withHour(16))).isTrue();
        }

        @Test
        @DisplayName("same-day hours include both ends")
        void sameDay() {
            RestaurantProfile burger = factory.generateRestaurantProfile(RestaurantType.FAST_CASUAL);

            assertThat(factory.isWithinOperatingHours(burger, BASE_TIME.withHour(10))).isFalse();
            assertThat(factory.isWithinOperatingHours(burger, BASE_TIME.withHour(11))).isTrue();
            assertThat(factory.isWithinOperatingHours(burger, BASE_TIME.withHour(22))).isTrue();
        }

        @Test
        @DisplayName("a profile without hours is never open")
        void noHours() {
            assertThat(factory.isWithinOperatingHours(profile(), BASE_TIME)).isFalse();
        }
    }

    @Test
    @DisplayName("snapshot adds the peak bonus near a peak hour")
    void contextSnapshot() {
        Random random = mock(Random.class);
        when(random.nextDouble()).thenReturn(0.0);
        when(random.nextInt(anyInt())).thenReturn(0);
        RestaurantProfileFactory pinned = new RestaurantProfileFactory(clockAtHour(12), random);

        RestaurantContext context = pinned.generateRestaurantContext(profile());

        // 30% base + 40% peak bonus of 80 seats
        assertThat(context.getCurrentCapacity()).isEqualTo(56);
        assertThat(context.getActiveOrders()).isEqualTo(5);
        assertThat(context.getStaffOnDuty()).isEqualTo(8);
        assertThat(context.getAverageAlertFrequency()).isEqualTo(2.0);
        assertThat(context.isDemoMode()).isTrue();
        assertThat(context.getCurrentTime()).isEqualTo(BASE_TIME);
    }

    @Test
    @DisplayName("occupancy never exceeds the number of seats")
    void capped() {
        Random random = mock(Random.class);
        when(random.nextDouble()).thenReturn(0.999);
        RestaurantProfileFactory pinned = new RestaurantProfileFactory(clockAtHour(12), random);

        RestaurantProfile tiny = profile();
        tiny.setCapacity(10);

        assertThat(pinned.generateRestaurantContext(tiny).getCurrentCapacity()).isLessThanOrEqualTo(10);
    }
}
