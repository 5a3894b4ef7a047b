package com.foodtruck.order.dto;

import com.foodtruck.order.entity.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record TransitionRequest(
        @NotNull(message = "status is required")
        OrderStatus status
) {}
