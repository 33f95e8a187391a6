package com.example.kitcheneta.service.load;

import com.example.kitcheneta.model.OrderStatus;
import com.example.kitcheneta.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 基于订单表的权威计数实现。
 */
@Component
public class JpaActiveOrderCounter implements ActiveOrderCounter {

    private static final Logger log = LoggerFactory.getLogger(JpaActiveOrderCounter.class);

    private final OrderRepository orderRepository;

    public JpaActiveOrderCounter(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public long countActive(Long locationId) {
        long count = orderRepository.countByLocationIdAndStatusInAndDeletedFalse(
                locationId, OrderStatus.activeStatuses());
        log.debug("Counted active orders from database: locationId={}, count={}", locationId, count);
        return count;
    }
}
