package com.servealert.synthesis;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertStatus;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.model.Alert;
import com.servealert.domain.model.AlertGenerationOptions;
import com.servealert.domain.model.AlertTemplate;
import com.servealert.domain.model.RestaurantContext;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces candidate alerts from the template catalog.
 *
 * <p>Two modes:
 * <ul>
 *   <li><b>Demo scenario</b>: every template of the scenario is instantiated, no randomness.</li>
 *   <li><b>Context-weighted</b>: for each alert a type is drawn with weights derived from the
 *       hour and the capacity fraction, then a template of that type is drawn with weights
 *       that favour urgent templates as the restaurant fills up.</li>
 * </ul>
 *
 * <p>Both the clock and the random source are injected so a test can pin every draw.
 */
@Service
public class AlertSynthesisEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertSynthesisEngine.class);

    public static final String SOURCE = "AlertSynthesisEngine";

    static final String DEFAULT_TITLE = "Restaurant Alert";
    static final String DEFAULT_MESSAGE = "Alert message";
    static final int DEFAULT_RESOLUTION_MINUTES = 30;

    /** Per-minute probability never goes above this, even at peak. */
    public static final double MAX_ALERT_PROBABILITY = 0.1;

    private static final List<DemoScenario> FALLBACK_SCENARIOS = List.of(
            DemoScenario.EQUIPMENT_FAILURE,
            DemoScenario.STAFF_SHORTAGE,
            DemoScenario.INVENTORY_CRISIS,
            DemoScenario.CUSTOMER_COMPLAINTS);

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm");

    private final AlertTemplateCatalog alertTemplateCatalog;
    private final Clock clock;
    private final Random random;

    public AlertSynthesisEngine(AlertTemplateCatalog alertTemplateCatalog, Clock clock, Random random) {
        this.alertTemplateCatalog = alertTemplateCatalog;
        this.clock = clock;
        this.random = random;
    }

    public List<Alert> generateDemoScenario(DemoScenario scenario, RestaurantContext context) {
        List<Alert> alerts = alertTemplateCatalog.forScenario(scenario).stream()
                .map(template -> createAlertFromTemplate(template, context))
                .toList();
        log.debug("Generated {} alerts for scenario {}", alerts.size(), scenario);
        return alerts;
    }

    public List<Alert> generateRealisticAlerts(RestaurantContext context, int count) {
        return generateRealisticAlerts(context, count, AlertGenerationOptions.none());
    }

    /**
     * Context-weighted generation. A type or priority distribution in {@code options}
     * replaces the derived weights; entries missing from a supplied distribution weigh zero.
     */
    public List<Alert> generateRealisticAlerts(RestaurantContext context, int count, AlertGenerationOptions options) {
        List<Alert> alerts = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            alerts.add(generateOne(context, options));
        }
        return alerts;
    }

    public Alert generateSingleAlert(RestaurantContext context) {
        return generateOne(context, AlertGenerationOptions.none());
    }

    /**
     * Picks the curated scenario that fits the moment: lunch rush when busy between 11 and
     * 14, morning prep from 6 to 10, evening service from 17 to 22, a quiet period below 20%
     * capacity, otherwise one of the incident scenarios at random.
     */
    public DemoScenario selectDemoScenario(RestaurantContext context) {
        int hour = LocalDateTime.now(clock).getHour();
        double capacity = context.capacityFraction();

        if (hour >= 11 && hour <= 14 && capacity > 0.7) {
            return DemoScenario.BUSY_LUNCH_RUSH;
        } else if (hour >= 6 && hour <= 10) {
            return DemoScenario.MORNING_PREP;
        } else if (hour >= 17 && hour <= 22) {
            return DemoScenario.EVENING_SERVICE;
        } else if (capacity < 0.2) {
            return DemoScenario.QUIET_PERIOD;
        }
        return FALLBACK_SCENARIOS.get(random.nextInt(FALLBACK_SCENARIOS.size()));
    }

    /** floor(3 × capacity fraction × 1.5 when the current HH:mm is exactly a peak hour). */
    public int defaultAlertCount(RestaurantContext context) {
        String now = LocalDateTime.now(clock).format(HOUR_MINUTE);
        double timeMultiplier =
                context.getProfile().getPeakHours().contains(now) ? 1.5 : 1.0;
        return (int) Math.floor(3 * context.capacityFraction() * timeMultiplier);
    }

    /**
     * Per-minute chance that a new alert appears.
     *
     * <p>(alerts per hour / 60) × (0.5 + capacity fraction), doubled within an hour of a peak
     * hour, cut to a tenth before 06:00, and capped at {@link #MAX_ALERT_PROBABILITY}.
     */
    public double calculateAlertProbability(LocalDateTime now, RestaurantContext context) {
        double probability = context.getAverageAlertFrequency() / 60.0;
        probability *= 0.5 + context.capacityFraction();

        int hour = now.getHour();
        if (context.getProfile().isNearPeakHour(hour)) {
            probability *= 2.0;
        } else if (hour < 6 || hour > 23) {
            probability *= 0.1;
        }
        return Math.min(probability, MAX_ALERT_PROBABILITY);
    }

    public static double typeWeight(AlertType type, int hour, double capacity) {
        return switch (type) {
            case ORDER -> hour >= 11 && hour <= 22 ? (capacity > 0.7 ? 3 : 1) : 0.1;
            case INVENTORY -> hour >= 6 && hour <= 10 ? 2 : 1;
            case STAFF -> capacity > 0.8 ? 2 : 1;
            case CUSTOMER -> capacity > 0.6 ? 2 : 0.5;
            case FINANCIAL -> hour >= 9 && hour <= 21 ? 1 : 0.5;
            case SECURITY -> hour >= 22 || hour <= 6 ? 2 : 0.5;
            case EQUIPMENT, SAFETY, HEALTH -> 1;
        };
    }

    public static double templateWeight(AlertPriority priority, double capacity) {
        return switch (priority) {
            case CRITICAL -> capacity > 0.9 ? 3 : 0.5;
            case HIGH -> capacity > 0.7 ? 2 : 1;
            case MEDIUM -> capacity > 0.5 ? 1.5 : 1;
            case LOW -> capacity < 0.3 ? 2 : 1;
        };
    }

    /** Tag for the service period an hour falls in. */
    public static String timeBucketTag(int hour) {
        if (hour >= 6 && hour < 11) {
            return "morning";
        }
        if (hour >= 11 && hour < 16) {
            return "lunch";
        }
        if (hour >= 16 && hour < 22) {
            return "dinner";
        }
        return "late-night";
    }

    public Alert createAlertFromTemplate(AlertTemplate template, RestaurantContext context) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> tags = new ArrayList<>();
        tags.add(context.getProfile().getType().name());
        tags.add(timeBucketTag(now.getHour()));

        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .type(template.getType() != null ? template.getType() : AlertType.ORDER)
                .priority(template.getPriority() != null ? template.getPriority() : AlertPriority.MEDIUM)
                .status(AlertStatus.ACTIVE)
                .title(template.getTitle() != null ? template.getTitle() : DEFAULT_TITLE)
                .message(personalizeMessage(
                        template.getMessage() != null ? template.getMessage() : DEFAULT_MESSAGE, context))
                .details(template.getDetails())
                .timestamp(now)
                .shouldNotify(true)
                .actionRequired(template.isActionRequired())
                .estimatedResolutionTime(
                        template.getEstimatedResolutionTime() != null
                                ? template.getEstimatedResolutionTime()
                                : DEFAULT_RESOLUTION_MINUTES)
                .source(SOURCE)
                .tags(tags)
                .build();
    }

    public String personalizeMessage(String message, RestaurantContext context) {
        return message.replace("{restaurantName}", String.valueOf(context.getProfile().getName()))
                .replace("{capacity}", Integer.toString(context.getCurrentCapacity()))
                .replace("{maxCapacity}", Integer.toString(context.getProfile().getCapacity()))
                .replace("{activeOrders}", Integer.toString(context.getActiveOrders()))
                .replace("{staffCount}", Integer.toString(context.getStaffOnDuty()));
    }

    private Alert generateOne(RestaurantContext context, AlertGenerationOptions options) {
        int hour = LocalDateTime.now(clock).getHour();
        double capacity = context.capacityFraction();

        Map<AlertType, Double> typeDistribution = options.getTypeDistribution();
        AlertType type = WeightedSelector.select(
                Arrays.asList(AlertType.values()),
                candidate -> typeDistribution != null
                        ? typeDistribution.getOrDefault(candidate, 0.0)
                        : typeWeight(candidate, hour, capacity),
                random);

        Map<AlertPriority, Double> priorityDistribution = options.getPriorityDistribution();
        AlertTemplate template = WeightedSelector.select(
                alertTemplateCatalog.forType(type),
                candidate -> priorityDistribution != null
                        ? priorityDistribution.getOrDefault(candidate.getPriority(), 0.0)
                        : templateWeight(candidate.getPriority(), capacity),
                random);

        return createAlertFromTemplate(template, context);
    }
}
