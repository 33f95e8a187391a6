package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.service.dto.LoadInfo;
import com.example.kitcheneta.service.dto.ReadyTimeEstimate;

import java.time.Instant;

public record ReadyTimeResponse(Instant estimatedReadyAt, long prepTimeSeconds, LoadInfo loadInfo) {

    public static ReadyTimeResponse of(ReadyTimeEstimate estimate) {
        return new ReadyTimeResponse(estimate.readyAt(), estimate.prepDuration().toSeconds(), estimate.loadInfo());
    }
}
