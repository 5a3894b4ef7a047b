package com.foodtruck.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record TokenRequest(
        @NotBlank(message = "username cannot be empty")
        String username,

        @NotBlank(message = "password cannot be empty")
        String password
) {}
