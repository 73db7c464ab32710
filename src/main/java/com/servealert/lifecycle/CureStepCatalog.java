package com.servealert.lifecycle;

import com.servealert.domain.enums.AlertType;
import com.servealert.domain.model.CureStep;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default remediation checklists, attached to an alert the first time it is assigned.
 * Types without a dedicated checklist get the generic one.
 */
public final class CureStepCatalog {

    private static final Map<AlertType, List<String>> STEPS = new EnumMap<>(AlertType.class);

    private static final List<String> GENERIC = List.of(
            "Assess the situation",
            "Identify root cause",
            "Implement immediate fix",
            "Monitor for recurrence",
            "Document resolution",
            "Update procedures if needed");

    static {
        STEPS.put(AlertType.EQUIPMENT, List.of(
                "Identify the faulty equipment",
                "Power cycle the device",
                "Check all connections and cables",
                "Run diagnostic tests",
                "Contact maintenance if issue persists",
                "Document the resolution"));
        STEPS.put(AlertType.INVENTORY, List.of(
                "Verify current stock levels",
                "Check for discrepancies in counts",
                "Review recent deliveries",
                "Update inventory system",
                "Place emergency order if needed",
                "Adjust par levels if necessary"));
        STEPS.put(AlertType.STAFF, List.of(
                "Assess current staffing levels",
                "Contact available team members",
                "Adjust break schedules if needed",
                "Redistribute responsibilities",
                "Update scheduling system",
                "Document coverage changes"));
        STEPS.put(AlertType.SAFETY, List.of(
                "Secure the affected area",
                "Ensure staff and customer safety",
                "Document the incident",
                "Contact relevant authorities if needed",
                "Implement corrective measures",
                "Update safety protocols"));
        STEPS.put(AlertType.CUSTOMER, List.of(
                "Contact the customer immediately",
                "Listen to their concerns",
                "Offer appropriate resolution",
                "Document the interaction",
                "Follow up to ensure satisfaction",
                "Update customer records"));
        STEPS.put(AlertType.ORDER, List.of(
                "Review order details",
                "Check order status in system",
                "Contact kitchen/preparation team",
                "Update customer on status",
                "Expedite if necessary",
                "Ensure order completion"));
    }

    private CureStepCatalog() {}

    /** Fresh, uncompleted steps with ids {@code step-1} onwards. */
    public static List<CureStep> defaultSteps(AlertType type) {
        List<String> descriptions = type != null ? STEPS.getOrDefault(type, GENERIC) : GENERIC;
        List<CureStep> steps = new ArrayList<>(descriptions.size());
        for (int i = 0; i < descriptions.size(); i++) {
            steps.add(CureStep.builder()
                    .id("step-" + (i + 1))
                    .description(descriptions.get(i))
                    .completed(false)
                    .build());
        }
        return steps;
    }
}
