package com.example.kitcheneta.controller;

import com.example.kitcheneta.controller.dto.ApiError;
import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EtaBusinessException.class)
    public ResponseEntity<ApiError> handleBusinessException(EtaBusinessException e) {
        EtaErrorCode errorCode = e.getErrorCode();
        log.warn("Business exception [{}]: {}", errorCode, e.getMessage());
        return toResponse(errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Request validation failed: {}", errors);
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ApiError.validation(status.value(), errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .body(ApiError.of("malformed_request", "Malformed request body", status.value(),
                        "Request body could not be parsed"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Bad path or query parameter {}: {}", e.getName(), e.getValue());
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
                .body(ApiError.of("malformed_request", "Malformed request", status.value(),
                        "Invalid value for " + e.getName()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        HttpStatus status = HttpStatus.METHOD_NOT_ALLOWED;
        return ResponseEntity.status(status)
                .body(ApiError.of("method_not_allowed", "Method not allowed", status.value(), e.getMessage()));
    }

    // @Version 冲突：另一个请求先改了同一订单
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleOptimisticLock(OptimisticLockingFailureException e) {
        log.warn("Concurrent order modification: {}", e.getMessage());
        return toResponse(EtaErrorCode.ORDER_CONFLICT, EtaErrorCode.ORDER_CONFLICT.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleException(Exception e) {
        log.error("Unexpected error", e);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status)
                .body(ApiError.of("internal_error", "Internal server error", status.value(), "Internal server error"));
    }

    private static ResponseEntity<ApiError> toResponse(EtaErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ApiError body = ApiError.of(errorCode.name().toLowerCase(Locale.ROOT), errorCode.getMessage(),
                status.value(), detail);
        return ResponseEntity.status(status).body(body);
    }
}
