package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.model.OrderStatus;

import javax.validation.constraints.NotNull;

public record UpdateStatusRequest(
        @NotNull(message = "status is required")
        OrderStatus status
) {}
