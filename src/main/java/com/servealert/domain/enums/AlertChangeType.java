package com.servealert.domain.enums;

/**
 * Kind of change announced by an {@code AlertCollectionChangedEvent}.
 */
public enum AlertChangeType {
    CREATED,
    UPDATED,
    RELOADED,
    CLEARED
}
