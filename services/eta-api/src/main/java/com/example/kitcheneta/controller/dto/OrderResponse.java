package com.example.kitcheneta.controller.dto;

import com.example.kitcheneta.model.Order;
import com.example.kitcheneta.model.OrderSource;
import com.example.kitcheneta.model.OrderStatus;
import com.example.kitcheneta.service.dto.LoadInfo;

import java.time.Instant;
import java.util.List;

/**
 * @param loadInfo present only on the response of a freshly placed order
 */
public record OrderResponse(Long id,
                            Long locationId,
                            OrderSource source,
                            OrderStatus status,
                            Instant estimatedReadyAt,
                            Instant createdAt,
                            List<Line> lines,
                            LoadInfo loadInfo) {

    public record Line(Long offeringId, int quantity) {
    }

    public static OrderResponse of(Order order) {
        return of(order, null);
    }

    public static OrderResponse of(Order order, LoadInfo loadInfo) {
        List<Line> lines = order.getLines().stream()
                .map(line -> new Line(line.getOfferingId(), line.getQuantity()))
                .toList();
        return new OrderResponse(order.getId(), order.getLocationId(), order.getSource(), order.getStatus(),
                order.getEstimatedReadyAt(), order.getCreatedAt(), lines, loadInfo);
    }
}
