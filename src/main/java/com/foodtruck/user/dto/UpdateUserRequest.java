package com.foodtruck.user.dto;

import com.foodtruck.user.entity.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateUserRequest(
        @Email(message = "email must be a valid address")
        String email,

        @Size(max = 100, message = "fullName must be at most 100 characters")
        String fullName,

        @Size(min = 6, message = "password must be at least 6 characters")
        String password,

        Role role,

        Boolean active
) {}
