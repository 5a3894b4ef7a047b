package com.foodtruck.order.dto;

import com.foodtruck.order.entity.Order;
import com.foodtruck.order.entity.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderResponse(
        Long id,
        String locator,
        Long userId,
        OrderStatus status,
        List<OrderItemResponse> items,
        BigDecimal totalAmount,
        String notes,
        Integer rating,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        LocalDateTime confirmedAt,
        LocalDateTime preparingAt,
        LocalDateTime readyAt,
        LocalDateTime deliveredAt,
        LocalDateTime cancelledAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getLocator(),
                order.getUserId(),
                order.getStatus(),
                order.getItems().stream().map(OrderItemResponse::from).toList(),
                order.getTotalAmount(),
                order.getNotes(),
                order.getRating(),
                order.getCreatedAt(),
                order.getUpdatedAt(),
                order.getConfirmedAt(),
                order.getPreparingAt(),
                order.getReadyAt(),
                order.getDeliveredAt(),
                order.getCancelledAt());
    }
}
