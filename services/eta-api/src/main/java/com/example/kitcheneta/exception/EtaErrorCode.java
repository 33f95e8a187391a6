package com.example.kitcheneta.exception;

import org.springframework.http.HttpStatus;

public enum EtaErrorCode {
    INVALID_OFFERINGS(HttpStatus.UNPROCESSABLE_ENTITY, "One or more products are not available at this location"),
    COMPANY_NOT_FOUND(HttpStatus.NOT_FOUND, "Company not found"),
    LOCATION_NOT_FOUND(HttpStatus.NOT_FOUND, "Location not found"),
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND, "Order not found"),
    ORDER_CONFLICT(HttpStatus.CONFLICT, "Order was modified concurrently, please retry");

    private final HttpStatus status;
    private final String message;

    EtaErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
