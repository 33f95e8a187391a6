package com.example.kitcheneta.event;

import com.example.kitcheneta.service.load.LoadCacheService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 订单变更与门店负载计数之间的桥。
 *
 * <p>Only a change of active-set membership touches the counter: entering the set increments,
 * leaving it decrements, moving inside or outside of it does nothing. Runs after commit so a
 * rolled-back order never reaches the counter.
 */
@Component
public class OrderLoadSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(OrderLoadSynchronizer.class);

    private final LoadCacheService loadCacheService;

    public OrderLoadSynchronizer(LoadCacheService loadCacheService) {
        this.loadCacheService = loadCacheService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOrderLifecycle(OrderLifecycleEvent event) {
        boolean wasActive = event.wasActive();
        boolean isActive = event.isActive();

        if (!wasActive && isActive) {
            long count = loadCacheService.incrementActiveOrders(event.locationId());
            log.info("Order {} {} at location {}: {} -> {}, active orders now {}",
                    event.orderId(), event.type(), event.locationId(),
                    event.oldStatus(), event.newStatus(), count);
        } else if (wasActive && !isActive) {
            long count = loadCacheService.decrementActiveOrders(event.locationId());
            log.info("Order {} {} at location {}: {} -> {}, active orders now {}",
                    event.orderId(), event.type(), event.locationId(),
                    event.oldStatus(), event.newStatus(), count);
        } else {
            log.debug("Order {} {} at location {}: {} -> {}, load unchanged",
                    event.orderId(), event.type(), event.locationId(),
                    event.oldStatus(), event.newStatus());
        }
    }
}
