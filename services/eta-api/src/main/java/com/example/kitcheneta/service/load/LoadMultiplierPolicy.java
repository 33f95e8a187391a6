package com.example.kitcheneta.service.load;

import java.math.BigDecimal;

/**
 * Kitchen load → prep time scaling.
 *
 * <pre>
 *  0-4   active orders: 1.0x
 *  5-9   active orders: 1.2x
 *  10-14 active orders: 1.4x
 *  ...
 *  50+   active orders: 3.0x (cap)
 * </pre>
 *
 * Computed in {@link BigDecimal} so each band is exactly 1.2, 1.4, ... rather than 1.2000000000000002.
 */
public final class LoadMultiplierPolicy {

    public static final int LOAD_SCALING_THRESHOLD = 5;
    public static final BigDecimal LOAD_SCALING_STEP = new BigDecimal("1.2");
    public static final BigDecimal MAX_MULTIPLIER = new BigDecimal("3.0");
    public static final BigDecimal HIGH_LOAD_MULTIPLIER = new BigDecimal("2.0");

    private static final BigDecimal INCREMENT = LOAD_SCALING_STEP.subtract(BigDecimal.ONE);

    private LoadMultiplierPolicy() {
    }

    public static BigDecimal multiplier(long activeOrdersCount) {
        long bands = Math.max(0, activeOrdersCount) / LOAD_SCALING_THRESHOLD;
        BigDecimal multiplier = BigDecimal.ONE.add(INCREMENT.multiply(BigDecimal.valueOf(bands)));
        return multiplier.min(MAX_MULTIPLIER);
    }

    public static boolean isHighLoad(BigDecimal multiplier) {
        return multiplier.compareTo(HIGH_LOAD_MULTIPLIER) > 0;
    }
}
