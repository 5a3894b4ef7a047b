package com.foodtruck.common.security;

import com.foodtruck.user.entity.Role;

/**
 * Identity resolved from a verified access token. Services receive only this
 * pair and never see credentials.
 */
public record AuthenticatedUser(Long userId, Role role) {

    public boolean owns(Long ownerId) {
        return userId != null && userId.equals(ownerId);
    }
}
