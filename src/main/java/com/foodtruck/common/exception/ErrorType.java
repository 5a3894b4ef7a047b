package com.foodtruck.common.exception;

/**
 * Failure category of an {@link ErrorCode}.
 *
 * <p>Every domain failure belongs to exactly one category so callers can tell a
 * malformed request from a missing entity, a denied role or an illegal state
 * move without parsing messages. {@link #INFRASTRUCTURE} is reserved for store
 * and server failures that are not part of the domain.</p>
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    AUTHENTICATION,
    AUTHORIZATION,
    INVALID_STATE,
    INVALID_TRANSITION,
    CONFLICT,
    INFRASTRUCTURE
}
