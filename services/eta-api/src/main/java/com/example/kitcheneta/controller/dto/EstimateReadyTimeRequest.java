package com.example.kitcheneta.controller.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.util.List;

public record EstimateReadyTimeRequest(
        @NotEmpty(message = "at least one product must be ordered")
        List<@NotNull(message = "line must not be null") @Valid LineItemRequest> lines
) {}
