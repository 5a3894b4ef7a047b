package com.foodtruck.common.security;

public enum AccessAction {
    READ,
    CREATE,
    UPDATE,
    DELETE,
    /** Move an order forward past CREATED. */
    ADVANCE,
    /** Move an order to CANCELLED. */
    CANCEL,
    RATE
}
