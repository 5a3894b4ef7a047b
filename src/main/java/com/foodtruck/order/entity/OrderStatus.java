package com.foodtruck.order.entity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order lifecycle.
 *
 * <pre>
 * CREATED -> CONFIRMED -> PREPARING -> READY -> DELIVERED
 *    |           |            |          |
 *    +-----------+------------+----------+----> CANCELLED
 * </pre>
 *
 * The table below is the complete set of legal edges; anything not listed,
 * including staying in the same status, is rejected.
 */
public enum OrderStatus {
    CREATED,
    CONFIRMED,
    PREPARING,
    READY,
    DELIVERED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(CREATED, EnumSet.of(CONFIRMED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PREPARING, CANCELLED));
        TRANSITIONS.put(PREPARING, EnumSet.of(READY, CANCELLED));
        TRANSITIONS.put(READY, EnumSet.of(DELIVERED, CANCELLED));
        TRANSITIONS.put(DELIVERED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderStatus> nextStatuses() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public static Set<OrderStatus> activeStatuses() {
        EnumSet<OrderStatus> active = EnumSet.noneOf(OrderStatus.class);
        for (OrderStatus status : values()) {
            if (!status.isTerminal()) {
                active.add(status);
            }
        }
        return active;
    }
}
