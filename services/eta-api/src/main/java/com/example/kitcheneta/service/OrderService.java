package com.example.kitcheneta.service;

import com.example.kitcheneta.event.OrderLifecycleEvent;
import com.example.kitcheneta.exception.EtaBusinessException;
import com.example.kitcheneta.exception.EtaErrorCode;
import com.example.kitcheneta.model.Order;
import com.example.kitcheneta.model.OrderSource;
import com.example.kitcheneta.model.OrderStatus;
import com.example.kitcheneta.repository.LocationRepository;
import com.example.kitcheneta.repository.OrderRepository;
import com.example.kitcheneta.service.dto.LineItem;
import com.example.kitcheneta.service.dto.OrderPlacement;
import com.example.kitcheneta.service.dto.ReadyTimeEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * 订单写路径。每次改变订单状态或删除标记都发布一个 {@link OrderLifecycleEvent}，
 * 负载计数由提交后的监听器维护，这里不直接碰计数缓存。
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final LocationRepository locationRepository;
    private final OrderRepository orderRepository;
    private final PrepTimeEstimator prepTimeEstimator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public OrderService(LocationRepository locationRepository,
                        OrderRepository orderRepository,
                        PrepTimeEstimator prepTimeEstimator,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock) {
        this.locationRepository = locationRepository;
        this.orderRepository = orderRepository;
        this.prepTimeEstimator = prepTimeEstimator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 1. 校验门店与菜品  2. 按当前负载估算出餐时间  3. 落库并发布 CREATED 事件
     *
     * <p>The estimate reads the counter before this order is counted, so the new order
     * never inflates its own ready time.
     */
    @Transactional
    public OrderPlacement placeOrder(Long locationId, OrderSource source, List<LineItem> lineItems) {
        if (!locationRepository.existsById(locationId)) {
            throw new EtaBusinessException(EtaErrorCode.LOCATION_NOT_FOUND, "Location " + locationId + " not found");
        }
        if (!prepTimeEstimator.validateOfferings(lineItems, locationId)) {
            throw new EtaBusinessException(EtaErrorCode.INVALID_OFFERINGS);
        }

        ReadyTimeEstimate estimate = prepTimeEstimator.estimate(locationId, lineItems);

        Order order = new Order(locationId, source, estimate.readyAt(), clock.instant());
        for (LineItem item : lineItems) {
            order.addLine(item.offeringId(), item.quantity());
        }
        Order saved = orderRepository.save(order);

        eventPublisher.publishEvent(OrderLifecycleEvent.created(saved.getId(), locationId, saved.getStatus()));
        log.info("Order {} placed at location {} via {}, ready at {}",
                saved.getId(), locationId, source, saved.getEstimatedReadyAt());
        return new OrderPlacement(saved, estimate.loadInfo());
    }

    @Transactional(readOnly = true)
    public Order getOrder(Long orderId) {
        return findLiveOrder(orderId);
    }

    /**
     * 并发修改同一订单时，后提交者因 @Version 冲突回滚，不会发布事件。
     */
    @Transactional
    public Order updateStatus(Long orderId, OrderStatus newStatus) {
        Order order = findLiveOrder(orderId);
        OrderStatus oldStatus = order.getStatus();
        if (oldStatus == newStatus) {
            log.debug("Order {} already {}, nothing to do", orderId, newStatus);
            return order;
        }

        order.setStatus(newStatus);
        Order saved = orderRepository.saveAndFlush(order);

        eventPublisher.publishEvent(
                OrderLifecycleEvent.statusChanged(orderId, order.getLocationId(), oldStatus, newStatus));
        log.info("Order {} status {} -> {}", orderId, oldStatus, newStatus);
        return saved;
    }

    @Transactional
    public void deleteOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> orderNotFound(orderId));
        if (order.isDeleted()) {
            log.debug("Order {} already deleted", orderId);
            return;
        }

        order.setDeleted(true);
        orderRepository.saveAndFlush(order);

        eventPublisher.publishEvent(OrderLifecycleEvent.deleted(orderId, order.getLocationId(), order.getStatus()));
        log.info("Order {} soft-deleted", orderId);
    }

    @Transactional
    public Order restoreOrder(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> orderNotFound(orderId));
        if (!order.isDeleted()) {
            log.debug("Order {} is not deleted, nothing to restore", orderId);
            return order;
        }

        order.setDeleted(false);
        Order saved = orderRepository.saveAndFlush(order);

        eventPublisher.publishEvent(OrderLifecycleEvent.restored(orderId, order.getLocationId(), order.getStatus()));
        log.info("Order {} restored with status {}", orderId, order.getStatus());
        return saved;
    }

    private Order findLiveOrder(Long orderId) {
        return orderRepository.findByIdAndDeletedFalse(orderId)
                .orElseThrow(() -> orderNotFound(orderId));
    }

    private static EtaBusinessException orderNotFound(Long orderId) {
        return new EtaBusinessException(EtaErrorCode.ORDER_NOT_FOUND, "Order " + orderId + " not found");
    }
}
