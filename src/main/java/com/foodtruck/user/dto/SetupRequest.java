package com.foodtruck.user.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * First-admin registration. The role is always ADMIN and not accepted from the client.
 */
public record SetupRequest(
        @NotBlank(message = "username is required")
        @Size(min = 3, max = 20, message = "username must be 3 to 20 characters")
        String username,

        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        String email,

        @NotBlank(message = "password is required")
        @Size(min = 6, message = "password must be at least 6 characters")
        String password,

        @Size(max = 100, message = "fullName must be at most 100 characters")
        String fullName
) {}
