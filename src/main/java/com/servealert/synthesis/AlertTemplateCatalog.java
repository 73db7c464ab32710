package com.servealert.synthesis;

import com.servealert.domain.enums.AlertPriority;
import com.servealert.domain.enums.AlertType;
import com.servealert.domain.enums.DemoScenario;
import com.servealert.domain.model.AlertTemplate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Curated alert content: a fixed template list per demo scenario and a pool of
 * templates per alert type for context-weighted generation.
 *
 * <p>Type templates carry no details or resolution estimate; instantiation fills in
 * the defaults.
 */
@Component
public class AlertTemplateCatalog {

    private final Map<DemoScenario, List<AlertTemplate>> scenarioTemplates = new EnumMap<>(DemoScenario.class);
    private final Map<AlertType, List<AlertTemplate>> typeTemplates = new EnumMap<>(AlertType.class);

    public AlertTemplateCatalog() {
        registerScenarios();
        registerTypeTemplates();
    }

    public List<AlertTemplate> forScenario(DemoScenario scenario) {
        return scenarioTemplates.getOrDefault(scenario, Collections.emptyList());
    }

    public List<AlertTemplate> forType(AlertType type) {
        return typeTemplates.getOrDefault(type, Collections.emptyList());
    }

    private void registerScenarios() {
        scenarioTemplates.put(
                DemoScenario.BUSY_LUNCH_RUSH,
                List.of(
                        scenario(
                                AlertType.ORDER,
                                AlertPriority.HIGH,
                                "Order Queue Overloaded",
                                "15 orders in queue - Customer wait time exceeding 20 minutes",
                                "Current queue: 15 orders. Average prep time: 8 minutes. Estimated wait: 22 minutes.",
                                true,
                                15),
                        scenario(
                                AlertType.EQUIPMENT,
                                AlertPriority.CRITICAL,
                                "Freezer Temperature Alert",
                                "Walk-in freezer temperature: 45°F - Food safety risk",
                                "Temperature has been above safe threshold for 12 minutes. Immediate action required.",
                                true,
                                30),
                        scenario(
                                AlertType.INVENTORY,
                                AlertPriority.HIGH,
                                "Low Stock Warning",
                                "Chicken breast inventory critically low",
                                "Current stock: 2 lbs remaining. Daily usage: 15 lbs. Next delivery: Tomorrow 8 AM.",
                                true,
                                60)));

        scenarioTemplates.put(
                DemoScenario.MORNING_PREP,
                List.of(
                        scenario(
                                AlertType.INVENTORY,
                                AlertPriority.MEDIUM,
                                "Delivery Delay",
                                "Fresh vegetables delivery delayed by 2 hours",
                                "Sysco delivery originally scheduled for 7 AM now arriving at 9 AM. May impact lunch "
                                        + "prep.",
                                false,
                                120),
                        scenario(
                                AlertType.STAFF,
                                AlertPriority.HIGH,
                                "Staff Shortage",
                                "Head chef called in sick - Kitchen understaffed",
                                "Mike called in with flu. Only 2 kitchen staff scheduled for lunch rush. Consider "
                                        + "calling backup.",
                                true,
                                180),
                        scenario(
                                AlertType.EQUIPMENT,
                                AlertPriority.LOW,
                                "Maintenance Due",
                                "Commercial dishwasher maintenance overdue",
                                "Last maintenance: 45 days ago. Recommended interval: 30 days. Schedule maintenance "
                                        + "soon.",
                                false,
                                1440)));

        scenarioTemplates.put(
                DemoScenario.EVENING_SERVICE,
                List.of(
                        scenario(
                                AlertType.CUSTOMER,
                                AlertPriority.HIGH,
                                "Negative Review Alert",
                                "New 1-star review received on Google",
                                "\"Food was cold and service was terrible. Waited 45 minutes for burnt steak.\" - "
                                        + "Sarah M.",
                                true,
                                60),
                        scenario(
                                AlertType.FINANCIAL,
                                AlertPriority.MEDIUM,
                                "Payment System Issue",
                                "Card reader #2 offline - Cash only at register 2",
                                "Credit card processing down for register 2. Customers directed to register 1 or "
                                        + "cash payment.",
                                true,
                                45)));

        scenarioTemplates.put(
                DemoScenario.EQUIPMENT_FAILURE,
                List.of(
                        scenario(
                                AlertType.EQUIPMENT,
                                AlertPriority.CRITICAL,
                                "Ice Machine Failure",
                                "Primary ice machine completely down",
                                "Compressor failure detected. No ice production. Backup ice supply needed immediately.",
                                true,
                                240),
                        scenario(
                                AlertType.EQUIPMENT,
                                AlertPriority.HIGH,
                                "Oven Temperature Inconsistent",
                                "Main oven running 50°F below set temperature",
                                "Oven #1 set to 450°F but maintaining only 400°F. Food quality and cook times "
                                        + "affected.",
                                true,
                                90)));

        scenarioTemplates.put(
                DemoScenario.STAFF_SHORTAGE,
                List.of(
                        scenario(
                                AlertType.STAFF,
                                AlertPriority.CRITICAL,
                                "Critical Understaffing",
                                "Only 1 server for dinner service - 4 scheduled",
                                "3 servers called out sick. 40 covers booked for tonight. Emergency staffing needed.",
                                true,
                                120),
                        scenario(
                                AlertType.STAFF,
                                AlertPriority.HIGH,
                                "No Dishwasher on Duty",
                                "Dishwasher no-show - Dishes backing up",
                                "Evening dishwasher did not arrive. Dish pit filling up fast. Kitchen staff having "
                                        + "to wash.",
                                true,
                                180)));

        scenarioTemplates.put(
                DemoScenario.INVENTORY_CRISIS,
                List.of(
                        scenario(
                                AlertType.INVENTORY,
                                AlertPriority.CRITICAL,
                                "Multiple Items Out of Stock",
                                "Salmon, risotto, and chocolate cake unavailable",
                                "3 signature dishes unavailable. Represents 30% of typical evening sales. Need "
                                        + "alternatives.",
                                true,
                                60),
                        scenario(
                                AlertType.INVENTORY,
                                AlertPriority.HIGH,
                                "Alcohol License Issue",
                                "Liquor delivery rejected - License renewal pending",
                                "Alcohol distributor cannot deliver until license renewed. Wine list limited to "
                                        + "current stock.",
                                true,
                                2880)));

        scenarioTemplates.put(
                DemoScenario.CUSTOMER_COMPLAINTS,
                List.of(
                        scenario(
                                AlertType.CUSTOMER,
                                AlertPriority.HIGH,
                                "Food Allergy Incident",
                                "Customer allergic reaction - Nuts in supposedly nut-free dish",
                                "Table 12 customer had reaction to walnut traces in salad marked as nut-free. EMS "
                                        + "called.",
                                true,
                                30),
                        scenario(
                                AlertType.CUSTOMER,
                                AlertPriority.MEDIUM,
                                "Large Party Complaint",
                                "Table of 8 waiting 90 minutes for entrees",
                                "Anniversary party increasingly frustrated. Kitchen backed up. Consider comping "
                                        + "desserts.",
                                true,
                                45)));

        scenarioTemplates.put(
                DemoScenario.HEALTH_INSPECTION,
                List.of(
                        scenario(
                                AlertType.HEALTH,
                                AlertPriority.CRITICAL,
                                "Health Inspector On-Site",
                                "Surprise health inspection in progress",
                                "Inspector arrived 10 minutes ago. Checking food storage temperatures and cleanliness.",
                                true,
                                120),
                        scenario(
                                AlertType.SAFETY,
                                AlertPriority.HIGH,
                                "Food Temperature Violation",
                                "Chicken stored at unsafe temperature",
                                "Raw chicken in walk-in cooler measuring 45°F. Safe storage requires 40°F or below.",
                                true,
                                15)));

        scenarioTemplates.put(
                DemoScenario.QUIET_PERIOD,
                List.of(
                        scenario(
                                AlertType.EQUIPMENT,
                                AlertPriority.LOW,
                                "Routine Maintenance Reminder",
                                "Monthly deep clean scheduled for tonight",
                                "Comprehensive cleaning of kitchen equipment scheduled. All prep should be completed "
                                        + "early.",
                                false,
                                240),
                        scenario(
                                AlertType.INVENTORY,
                                AlertPriority.LOW,
                                "Reorder Suggestion",
                                "Office supplies running low",
                                "Receipt paper, napkins, and cleaning supplies below reorder threshold.",
                                false,
                                1440)));
    }

    private void registerTypeTemplates() {
        putTyped(
                AlertType.ORDER,
                List.of(
                        typed(AlertPriority.HIGH, "Order Queue Overloaded", "Kitchen queue exceeding capacity"),
                        typed(AlertPriority.MEDIUM, "Large Order Incoming", "Party of 12 order submitted"),
                        typed(AlertPriority.LOW, "Order Modification", "Customer requested menu substitution")));
        putTyped(
                AlertType.EQUIPMENT,
                List.of(
                        typed(AlertPriority.CRITICAL, "Equipment Failure", "Critical kitchen equipment down"),
                        typed(AlertPriority.HIGH, "Equipment Malfunction", "Equipment running suboptimally"),
                        typed(AlertPriority.MEDIUM, "Maintenance Required", "Scheduled maintenance due"),
                        typed(AlertPriority.LOW, "Maintenance Reminder", "Routine maintenance scheduled")));
        putTyped(
                AlertType.INVENTORY,
                List.of(
                        typed(AlertPriority.CRITICAL, "Out of Stock", "Key menu item unavailable"),
                        typed(AlertPriority.HIGH, "Low Stock Warning", "Inventory below minimum threshold"),
                        typed(AlertPriority.MEDIUM, "Delivery Delay", "Supplier delivery postponed"),
                        typed(AlertPriority.LOW, "Reorder Reminder", "Items approaching reorder point")));
        putTyped(
                AlertType.STAFF,
                List.of(
                        typed(AlertPriority.CRITICAL, "Critical Understaffing", "Severe staff shortage"),
                        typed(AlertPriority.HIGH, "Staff No-Show", "Scheduled staff member absent"),
                        typed(AlertPriority.MEDIUM, "Overtime Alert", "Staff approaching overtime limits"),
                        typed(AlertPriority.LOW, "Schedule Reminder", "Upcoming shift changes")));
        putTyped(
                AlertType.CUSTOMER,
                List.of(
                        typed(AlertPriority.HIGH, "Customer Complaint", "Serious customer dissatisfaction"),
                        typed(AlertPriority.MEDIUM, "Service Issue", "Minor service problem reported"),
                        typed(AlertPriority.LOW, "Customer Feedback", "General customer comment received")));
        putTyped(
                AlertType.FINANCIAL,
                List.of(
                        typed(AlertPriority.HIGH, "Payment System Down", "POS system experiencing issues"),
                        typed(AlertPriority.MEDIUM, "Daily Sales Alert", "Sales tracking notification"),
                        typed(AlertPriority.LOW, "Financial Report", "Routine financial update")));
        putTyped(
                AlertType.SAFETY,
                List.of(
                        typed(AlertPriority.CRITICAL, "Safety Hazard", "Immediate safety concern identified"),
                        typed(AlertPriority.HIGH, "Safety Protocol Breach", "Safety procedure not followed"),
                        typed(AlertPriority.MEDIUM, "Safety Reminder", "Routine safety check due")));
        putTyped(
                AlertType.HEALTH,
                List.of(
                        typed(AlertPriority.CRITICAL, "Health Code Violation", "Serious health concern detected"),
                        typed(AlertPriority.HIGH, "Temperature Alert", "Food storage temperature issue"),
                        typed(AlertPriority.MEDIUM, "Health Inspection", "Scheduled health inspection")));
        putTyped(
                AlertType.SECURITY,
                List.of(
                        typed(AlertPriority.HIGH, "Security Breach", "Unauthorized access detected"),
                        typed(AlertPriority.MEDIUM, "Security Alert", "Unusual activity observed"),
                        typed(AlertPriority.LOW, "Security Update", "Routine security check")));
    }

    private static AlertTemplate scenario(
            AlertType type,
            AlertPriority priority,
            String title,
            String message,
            String details,
            boolean actionRequired,
            int estimatedResolutionTime) {
        return AlertTemplate.builder()
                .type(type)
                .priority(priority)
                .title(title)
                .message(message)
                .details(details)
                .actionRequired(actionRequired)
                .estimatedResolutionTime(estimatedResolutionTime)
                .build();
    }

    private void putTyped(AlertType type, List<AlertTemplate> templates) {
        typeTemplates.put(type, templates.stream().map(t -> t.toBuilder().type(type).build()).toList());
    }

    private static AlertTemplate typed(AlertPriority priority, String title, String message) {
        return AlertTemplate.builder()
                .priority(priority)
                .title(title)
                .message(message)
                .build();
    }
}
