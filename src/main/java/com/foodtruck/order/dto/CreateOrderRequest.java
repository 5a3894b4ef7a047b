package com.foodtruck.order.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * {@code userId} is only honoured for staff and admin placing an order on
 * someone's behalf; when absent the order belongs to the caller.
 */
public record CreateOrderRequest(
        Long userId,

        @NotEmpty(message = "order must contain at least one item")
        List<@Valid OrderItemRequest> items,

        @Size(max = 255, message = "notes must be at most 255 characters")
        String notes
) {}
