package com.foodtruck.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Maps every failure to an RFC 9457 {@link ProblemDetail}.
 *
 * <p>Responses carry the error code as {@code type}
 * ({@code https://foodtruck.dev/errors/order_not_found}) and two extension
 * members, {@code code} and {@code category}, so clients can branch on the
 * failure kind:</p>
 * <pre>{@code
 * {
 *   "type": "https://foodtruck.dev/errors/invalid_order_transition",
 *   "title": "Invalid order status transition",
 *   "status": 409,
 *   "detail": "Cannot move order 7 from CREATED to DELIVERED",
 *   "code": "INVALID_ORDER_TRANSITION",
 *   "category": "INVALID_TRANSITION"
 * }
 * }</pre>
 *
 * <p>Store failures surface as {@link ErrorType#INFRASTRUCTURE}; their cause is
 * logged but never sent to the client.</p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://foodtruck.dev/errors/";

    public static ProblemDetail toProblemDetail(ErrorCode errorCode, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(errorCode.getStatus(), detail);
        problem.setType(URI.create(ERROR_TYPE_BASE + errorCode.name().toLowerCase()));
        problem.setTitle(errorCode.getMessage());
        problem.setProperty("code", errorCode.name());
        problem.setProperty("category", errorCode.getType().name());
        return problem;
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        log.warn("Business exception: code={}, message={}", e.getErrorCode(), e.getMessage());
        return respond(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + ": " + e.getBindingResult().getFieldError(field).getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Request validation failed: {}", detail);
        return respond(ErrorCode.INVALID_INPUT, detail.isEmpty() ? ErrorCode.INVALID_INPUT.getMessage() : detail);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ProblemDetail> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(ErrorCode.INVALID_INPUT, ErrorCode.INVALID_INPUT.getMessage());
    }

    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ProblemDetail> handleFrameworkError(Exception e) {
        ErrorResponse errorResponse = (ErrorResponse) e;
        return ResponseEntity.status(errorResponse.getStatusCode()).body(errorResponse.getBody());
    }

    @ExceptionHandler({OptimisticLockingFailureException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<ProblemDetail> handleConcurrentModification(DataAccessException e) {
        log.warn("Concurrent modification detected: {}", e.getMessage());
        return respond(ErrorCode.CONCURRENT_MODIFICATION, ErrorCode.CONCURRENT_MODIFICATION.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException e) {
        log.error("Data store failure", e);
        return respond(ErrorCode.DATABASE_ERROR, ErrorCode.DATABASE_ERROR.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleException(Exception e) {
        log.error("Unexpected error", e);
        return respond(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getMessage());
    }

    private ResponseEntity<ProblemDetail> respond(ErrorCode errorCode, String detail) {
        return ResponseEntity.status(errorCode.getStatus()).body(toProblemDetail(errorCode, detail));
    }
}
