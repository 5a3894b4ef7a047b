package com.foodtruck.common.exception;

import lombok.Getter;

/**
 * Domain failure backed by an {@link ErrorCode}.
 *
 * <p>The code fixes the HTTP status and the {@link ErrorType}; the optional
 * detail replaces the default message, e.g. "Order 12 not found" instead of
 * "Order not found".</p>
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public ErrorType getErrorType() {
        return errorCode.getType();
    }
}
