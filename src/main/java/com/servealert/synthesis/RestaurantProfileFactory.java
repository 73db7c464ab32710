package com.servealert.synthesis;

import com.servealert.domain.enums.RestaurantType;
import com.servealert.domain.model.OperatingHours;
import com.servealert.domain.model.RestaurantContext;
import com.servealert.domain.model.RestaurantProfile;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds restaurant profiles for each restaurant type and derives a live context
 * snapshot from a profile.
 *
 * <p>Stands in for the restaurant-profile collaborator when the engine runs on its own,
 * e.g. in demo mode or for the real-time simulation.
 */
@Component
public class RestaurantProfileFactory {

    private static final List<String> NAMES = List.of(
            "Golden", "Silver", "Royal", "Prime", "Elite", "Garden", "Ocean", "Mountain", "Sunset", "Sunrise",
            "Corner", "Main Street", "Downtown", "Harbor", "Mill", "Station", "Bridge", "Park", "Square", "Avenue");
    private static final List<String> STREETS =
            List.of("Main St", "Oak Ave", "Park Blvd", "First St", "Broadway", "Market St");
    private static final List<String> CITIES =
            List.of("Springfield", "Riverside", "Franklin", "Georgetown", "Salem", "Madison");
    private static final List<String> STATES = List.of("CA", "NY", "TX", "FL", "IL", "PA");

    private final Clock clock;
    private final Random random;

    public RestaurantProfileFactory(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public RestaurantProfile generateRestaurantProfile(RestaurantType type) {
        RestaurantProfile.RestaurantProfileBuilder builder = RestaurantProfile.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .address(randomAddress())
                .phone(randomPhone())
                .email("info@" + type.name().toLowerCase() + "restaurant.com")
                .hoursOfOperation(operatingHours(type));

        String prefix = pick(NAMES);
        switch (type) {
            case FAST_CASUAL -> builder.name(prefix + " Burger Co.")
                    .capacity(80)
                    .staffCount(12)
                    .avgOrderTime(8)
                    .specialties(List.of("Burgers", "Fries", "Shakes"))
                    .peakHours(List.of("12:00", "13:00", "18:00", "19:00"));
            case FINE_DINING -> builder.name(prefix + " Restaurant")
                    .capacity(60)
                    .staffCount(20)
                    .avgOrderTime(45)
                    .specialties(List.of("French Cuisine", "Wine Pairing", "Tasting Menu"))
                    .peakHours(List.of("19:00", "20:00", "21:00"));
            case CAFE -> builder.name(prefix + " Coffee House")
                    .capacity(40)
                    .staffCount(6)
                    .avgOrderTime(5)
                    .specialties(List.of("Coffee", "Pastries", "Light Meals"))
                    .peakHours(List.of("07:00", "08:00", "12:00", "15:00"));
            case BAR -> builder.name(prefix + " Tavern")
                    .capacity(100)
                    .staffCount(8)
                    .avgOrderTime(12)
                    .specialties(List.of("Craft Beer", "Wings", "Sports Viewing"))
                    .peakHours(List.of("17:00", "18:00", "19:00", "20:00", "21:00"));
            case FOOD_TRUCK -> builder.name(prefix + " Mobile Kitchen")
                    .capacity(20)
                    .staffCount(3)
                    .avgOrderTime(10)
                    .specialties(List.of("Street Food", "Quick Service"))
                    .peakHours(List.of("12:00", "13:00", "17:00", "18:00"));
            case CATERING -> builder.name(prefix + " Catering")
                    .capacity(200)
                    .staffCount(15)
                    .avgOrderTime(60)
                    .specialties(List.of("Event Catering", "Corporate Meals"))
                    .peakHours(List.of("11:00", "12:00", "17:00", "18:00"));
        }
        return builder.build();
    }

    /**
     * Snapshot for the current moment: 30% of seats as a base, 40% more near a peak hour,
     * up to 20% random variation, capped at capacity.
     */
    public RestaurantContext generateRestaurantContext(RestaurantProfile profile) {
        LocalDateTime now = LocalDateTime.now(clock);
        int seats = profile.getCapacity();

        int base = (int) Math.floor(seats * 0.3);
        int peakBonus = profile.isNearPeakHour(now.getHour()) ? (int) Math.floor(seats * 0.4) : 0;
        int variation = (int) Math.floor(random.nextDouble() * seats * 0.2);

        return RestaurantContext.builder()
                .profile(profile)
                .currentTime(now)
                .dayOfWeek(now.getDayOfWeek())
                .open(isWithinOperatingHours(profile, now))
                .currentCapacity(Math.min(seats, base + peakBonus + variation))
                .activeOrders(random.nextInt(15) + 5)
                .staffOnDuty((int) Math.floor(profile.getStaffCount() * (random.nextDouble() * 0.3 + 0.7)))
                .averageAlertFrequency(baseAlertFrequency(profile.getType()))
                .demoMode(true)
                .simulationSpeed(1.0)
                .build();
    }

    /**
     * Whether the restaurant is open at {@code dateTime} according to that weekday's hours.
     * A closing time before the opening time runs past midnight, so 01:00 counts as open
     * for a bar open 15:00 to 02:00.
     */
    public boolean isWithinOperatingHours(RestaurantProfile profile, LocalDateTime dateTime) {
        OperatingHours hours = profile.getHoursOfOperation().get(dateTime.getDayOfWeek());
        if (hours == null || hours.isClosed()) {
            return false;
        }

        int current = dateTime.getHour() * 60 + dateTime.getMinute();
        int open = hours.getOpen().getHour() * 60 + hours.getOpen().getMinute();
        int close = hours.getClose().getHour() * 60 + hours.getClose().getMinute();

        if (close < open) {
            close += 24 * 60;
            if (current < open) {
                return current + 24 * 60 <= close;
            }
        }
        return current >= open && current <= close;
    }

    /** Average alerts per hour for a restaurant type. */
    public static double baseAlertFrequency(RestaurantType type) {
        return switch (type) {
            case FAST_CASUAL -> 2.0;
            case FINE_DINING -> 1.5;
            case CAFE -> 1.0;
            case BAR -> 1.8;
            case FOOD_TRUCK -> 2.5;
            case CATERING -> 1.2;
        };
    }

    static Map<DayOfWeek, OperatingHours> operatingHours(RestaurantType type) {
        LocalTime open;
        LocalTime close;
        switch (type) {
            case FAST_CASUAL -> {
                open = LocalTime.of(11, 0);
                close = LocalTime.of(22, 0);
            }
            case FINE_DINING -> {
                open = LocalTime.of(17, 0);
                close = LocalTime.of(23, 0);
            }
            case CAFE -> {
                open = LocalTime.of(6, 0);
                close = LocalTime.of(20, 0);
            }
            case BAR -> {
                open = LocalTime.of(15, 0);
                close = LocalTime.of(2, 0);
            }
            case FOOD_TRUCK -> {
                open = LocalTime.of(11, 0);
                close = LocalTime.of(21, 0);
            }
            default -> {
                open = LocalTime.of(8, 0);
                close = LocalTime.of(18, 0);
            }
        }

        Map<DayOfWeek, OperatingHours> hours = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean closed = day == DayOfWeek.SUNDAY && type == RestaurantType.CATERING;
            hours.put(day, new OperatingHours(open, close, closed));
        }
        return hours;
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private String randomAddress() {
        int number = random.nextInt(9999) + 1;
        int zip = random.nextInt(90000) + 10000;
        return number + " " + pick(STREETS) + ", " + pick(CITIES) + ", " + pick(STATES) + " " + zip;
    }

    private String randomPhone() {
        int area = random.nextInt(800) + 200;
        int exchange = random.nextInt(800) + 200;
        int line = random.nextInt(9000) + 1000;
        return "(" + area + ") " + exchange + "-" + line;
    }
}
