package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.model.OrderSource;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.util.List;

public record CreateOrderRequest(
        @NotNull(message = "locationId is required")
        Long locationId,

        @NotNull(message = "source is required")
        OrderSource source,

        @NotEmpty(message = "at least one product must be ordered")
        List<@NotNull(message = "line must not be null") @Valid LineItemRequest> lines
) {}
