package com.foodtruck.user.entity;

import java.util.Locale;

/**
 * Account role. Carried in the access token and looked up in
 * {@link com.foodtruck.common.security.AccessPolicy} on every request.
 *
 * <ul>
 *     <li>{@code ADMIN}: manages users and the catalog, full control of orders</li>
 *     <li>{@code STAFF}: works the order queue, reads the catalog</li>
 *     <li>{@code CUSTOMER}: places and follows their own orders</li>
 * </ul>
 */
public enum Role {
    ADMIN,
    STAFF,
    CUSTOMER;

    /**
     * Parses a role claim. Unknown or missing values are rejected with
     * {@link IllegalArgumentException}.
     */
    public static Role from(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role must not be null");
        }
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
