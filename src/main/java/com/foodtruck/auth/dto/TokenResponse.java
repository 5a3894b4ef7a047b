package com.foodtruck.auth.dto;

import com.foodtruck.user.entity.Role;
import com.foodtruck.user.entity.User;

public record TokenResponse(String accessToken, String tokenType, long expiresIn, UserSummary user) {

    public record UserSummary(Long id, String username, String email, Role role) {

        public static UserSummary from(User user) {
            return new UserSummary(user.getId(), user.getUsername(), user.getEmail(), user.getRole());
        }
    }
}
