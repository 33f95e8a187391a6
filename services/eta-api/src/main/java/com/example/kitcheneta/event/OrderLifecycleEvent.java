package com.example.kitcheneta.event;

import com.example.kitcheneta.model.OrderStatus;

/**
 * 订单生命周期事件，在事务内发布、提交后处理。
 *
 * @param oldStatus null for a newly created or restored order
 * @param newStatus null for a soft-deleted order
 */
public record OrderLifecycleEvent(Long orderId,
                                  Long locationId,
                                  Type type,
                                  OrderStatus oldStatus,
                                  OrderStatus newStatus) {

    public enum Type {
        CREATED,
        STATUS_CHANGED,
        DELETED,
        RESTORED
    }

    public static OrderLifecycleEvent created(Long orderId, Long locationId, OrderStatus status) {
        return new OrderLifecycleEvent(orderId, locationId, Type.CREATED, null, status);
    }

    public static OrderLifecycleEvent statusChanged(Long orderId, Long locationId,
                                                    OrderStatus oldStatus, OrderStatus newStatus) {
        return new OrderLifecycleEvent(orderId, locationId, Type.STATUS_CHANGED, oldStatus, newStatus);
    }

    public static OrderLifecycleEvent deleted(Long orderId, Long locationId, OrderStatus status) {
        return new OrderLifecycleEvent(orderId, locationId, Type.DELETED, status, null);
    }

    public static OrderLifecycleEvent restored(Long orderId, Long locationId, OrderStatus status) {
        return new OrderLifecycleEvent(orderId, locationId, Type.RESTORED, null, status);
    }

    public boolean wasActive() {
        return OrderStatus.isActive(oldStatus);
    }

    public boolean isActive() {
        return OrderStatus.isActive(newStatus);
    }
}
