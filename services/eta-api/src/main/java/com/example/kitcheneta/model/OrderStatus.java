package com.example.kitcheneta.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 订单状态。RECEIVED / PREPARING / READY 计入后厨负载，COMPLETED 是唯一的终态。
 */
public enum OrderStatus {
    RECEIVED,
    PREPARING,
    READY,
    COMPLETED;

    private static final Set<OrderStatus> ACTIVE = EnumSet.of(RECEIVED, PREPARING, READY);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * Null-safe membership test: a missing status (brand-new or deleted order) is never active.
     */
    public static boolean isActive(OrderStatus status) {
        return status != null && status.isActive();
    }

    public static Set<OrderStatus> activeStatuses() {
        return EnumSet.copyOf(ACTIVE);
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 线上是小写（received），也兼容大写。未知值交给 Jackson 报 400。
     */
    @JsonCreator
    public static OrderStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
