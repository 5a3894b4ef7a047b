package com.foodtruck.common.dto;

/**
 * Result of a delete request on an entity that may still be referenced.
 * {@code DEACTIVATED} means the row was kept and flagged inactive instead.
 */
public enum DeletionOutcome {
    DELETED,
    DEACTIVATED
}
