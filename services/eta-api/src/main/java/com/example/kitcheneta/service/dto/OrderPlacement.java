package com.example.kitcheneta.service.dto;

import com.example.kitcheneta.model.Order;

public record OrderPlacement(Order order, LoadInfo loadInfo) {
}
