package com.servealert.domain.enums;

/**
 * Curated restaurant situations. Each maps to a fixed list of alert templates
 * and, for the first three, to a scheduling policy in the notification scheduler.
 */
public enum DemoScenario {
    BUSY_LUNCH_RUSH,
    MORNING_PREP,
    EVENING_SERVICE,
    EQUIPMENT_FAILURE,
    STAFF_SHORTAGE,
    INVENTORY_CRISIS,
    CUSTOMER_COMPLAINTS,
    HEALTH_INSPECTION,
    QUIET_PERIOD
}
