package com.foodtruck.order.controller;

import com.foodtruck.common.dto.ApiResponse;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.common.security.AuthenticationFilter;
import com.foodtruck.order.dto.*;
import com.foodtruck.order.entity.OrderStatus;
import com.foodtruck.order.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * All endpoints need a token. Ownership and role rules are applied in
 * {@link OrderService}.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @GetMapping
    public ApiResponse<PageResponse<OrderResponse>> listOrders(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + PageQuery.DEFAULT_LIMIT) int limit,
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) Long userId) {
        return ApiResponse.ok(orderService.listOrders(actor, PageQuery.of(offset, limit), status, userId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> createOrder(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @Valid @RequestBody CreateOrderRequest request) {
        return ApiResponse.ok(orderService.createOrder(actor, request), "Order created");
    }

    @GetMapping("/{id}")
    public ApiResponse<OrderResponse> getOrder(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrder(actor, id));
    }

    @GetMapping("/{id}/items")
    public ApiResponse<List<OrderItemResponse>> getOrderItems(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(orderService.getOrderItems(actor, id));
    }

    @PatchMapping("/{id}/status")
    public ApiResponse<OrderResponse> changeStatus(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody TransitionRequest request) {
        return ApiResponse.ok(orderService.transition(actor, id, request.status()));
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<OrderResponse> cancelOrder(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(orderService.cancel(actor, id), "Order cancelled");
    }

    @PostMapping("/{id}/items")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<OrderResponse> addItem(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody OrderItemRequest request) {
        return ApiResponse.ok(orderService.addItem(actor, id, request));
    }

    @PatchMapping("/{id}/items/{itemId}")
    public ApiResponse<OrderResponse> updateItemQuantity(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @PathVariable Long itemId,
            @Valid @RequestBody UpdateQuantityRequest request) {
        return ApiResponse.ok(orderService.updateItemQuantity(actor, id, itemId, request.quantity()));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ApiResponse<OrderResponse> removeItem(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @PathVariable Long itemId) {
        return ApiResponse.ok(orderService.removeItem(actor, id, itemId));
    }

    @PatchMapping("/{id}/notes")
    public ApiResponse<OrderResponse> updateNotes(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody UpdateNotesRequest request) {
        return ApiResponse.ok(orderService.updateNotes(actor, id, request.notes()));
    }

    @PutMapping("/{id}/rating")
    public ApiResponse<OrderResponse> rateOrder(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody RatingRequest request) {
        return ApiResponse.ok(orderService.rateOrder(actor, id, request.rating()));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<DeletionResponse> deleteOrder(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(orderService.deleteOrder(actor, id));
    }
}
