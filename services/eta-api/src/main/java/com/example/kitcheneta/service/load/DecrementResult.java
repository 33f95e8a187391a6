package com.example.kitcheneta.service.load;

/**
 * @param count   counter value after the decrement, never negative
 * @param clamped true when the raw result went below zero and was reset to zero
 */
public record DecrementResult(long count, boolean clamped) {

    public static DecrementResult of(long count) {
        return new DecrementResult(count, false);
    }

    public static DecrementResult clampedToZero() {
        return new DecrementResult(0, true);
    }
}
