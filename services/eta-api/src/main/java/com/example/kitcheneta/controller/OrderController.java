package com.example.kitcheneta.controller;

import com.example.kitcheneta.controller.dto.CreateOrderRequest;
import com.example.kitcheneta.controller.dto.LineItemRequest;
import com.example.kitcheneta.controller.dto.OrderResponse;
import com.example.kitcheneta.controller.dto.UpdateStatusRequest;
import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import com.example.kitcheneta.service.OrderService;
import com.example.kitcheneta.service.dto.LineItem;
import com.example.kitcheneta.service.dto.OrderPlacement;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public OrderResponse createOrder(@Valid @RequestBody CreateOrderRequest request) {
        OrderPlacement placement = orderService.placeOrder(request.locationId(), request.source(),
                toLineItems(request.lines()));
        return OrderResponse.of(placement.order(), placement.loadInfo());
    }

    @GetMapping("/{id}")
    public OrderResponse getOrder(@PathVariable Long id) {
        return OrderResponse.of(orderService.getOrder(id));
    }

    @PatchMapping("/{id}/status")
    public OrderResponse updateStatus(@PathVariable Long id, @Valid @RequestBody UpdateStatusRequest request) {
        return OrderResponse.of(orderService.updateStatus(id, request.status()));
    }

    // 软删除，重复删除同样返回 204
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteOrder(@PathVariable Long id) {
        orderService.deleteOrder(id);
    }

    @PostMapping("/{id}/restore")
    public OrderResponse restoreOrder(@PathVariable Long id) {
        return OrderResponse.of(orderService.restoreOrder(id));
    }

    private static List<LineItem> toLineItems(List<LineItemRequest> lines) {
        return lines.stream()
                .map(line -> {
                    if (line.offeringId() == null) {
                        throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS, "offeringId is required for every line");
                    }
                    return new LineItem(line.offeringId(), line.quantity());
                })
                .toList();
    }
}
