package com.servealert.domain.enums;

/**
 * Operational area an alert belongs to.
 *
 * <p>The type drives template selection during synthesis, relatedness when
 * batching (see {@code AlertBatcher}) and the per-type notification filter.
 */
public enum AlertType {
    ORDER,
    EQUIPMENT,
    INVENTORY,
    STAFF,
    CUSTOMER,
    FINANCIAL,
    SAFETY,
    HEALTH,
    SECURITY
}
