package com.example.kitcheneta.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * RFC 7807 风格的错误响应体。
 *
 * @param errors field-level messages, only for validation failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String type, String title, int status, String detail, Map<String, String> errors) {

    private static final String TYPE_PREFIX = "urn:kitchen-eta:error:";

    public static ApiError of(String code, String title, int status, String detail) {
        return new ApiError(TYPE_PREFIX + code, title, status, detail, null);
    }

    public static ApiError validation(int status, Map<String, String> errors) {
        return new ApiError(TYPE_PREFIX + "validation", "Request validation failed", status,
                "One or more fields are invalid", errors);
    }
}
