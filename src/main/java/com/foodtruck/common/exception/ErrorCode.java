package com.foodtruck.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Invalid input value"),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, ErrorType.AUTHENTICATION, "Authentication required"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, ErrorType.AUTHORIZATION, "You are not allowed to perform this action"),
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Resource was modified concurrently, retry the request"),
    DATABASE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, ErrorType.INFRASTRUCTURE, "Data store unavailable"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, ErrorType.INFRASTRUCTURE, "Internal server error"),

    // Auth / setup
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, ErrorType.AUTHENTICATION, "Incorrect username or password"),
    SETUP_ALREADY_COMPLETED(HttpStatus.FORBIDDEN, ErrorType.AUTHORIZATION, "The system already has users, setup is disabled"),

    // User
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "User not found"),
    USER_INACTIVE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "User is inactive"),
    DUPLICATE_USERNAME(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Username already exists"),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Email already exists"),
    CANNOT_DELETE_SELF(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "Users cannot delete their own account"),

    // Product
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Product not found"),
    PRODUCT_UNAVAILABLE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Product is not available"),
    DUPLICATE_PRODUCT_NAME(HttpStatus.CONFLICT, ErrorType.CONFLICT, "Product already exists"),
    INVALID_PRICE(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Price must not be negative"),

    // Order
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Order not found"),
    ORDER_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorType.NOT_FOUND, "Order item not found"),
    EMPTY_ORDER(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Order must have at least one item"),
    INVALID_QUANTITY(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Quantity must be at least 1"),
    INVALID_RATING(HttpStatus.BAD_REQUEST, ErrorType.VALIDATION, "Rating must be between 1 and 5"),
    INVALID_ORDER_TRANSITION(HttpStatus.CONFLICT, ErrorType.INVALID_TRANSITION, "Invalid order status transition"),
    ORDER_NOT_MODIFIABLE(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "Order items can only change while the order is CREATED"),
    ORDER_NOT_RATEABLE(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "Only delivered orders can be rated"),
    ORDER_NOT_DELETABLE(HttpStatus.CONFLICT, ErrorType.INVALID_STATE, "Only delivered or cancelled orders can be deleted");

    private final HttpStatus status;
    private final ErrorType type;
    private final String message;
}
