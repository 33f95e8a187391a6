package com.example.kitcheneta.service.dto;

import java.time.Duration;
import java.time.Instant;

public record ReadyTimeEstimate(Instant readyAt, Duration prepDuration, LoadInfo loadInfo) {
}
