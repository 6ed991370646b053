package com.whatifplatform.common.model;

/**
 * A {@code (min, max)} multiplier pair applied bound-by-bound to a {@link RangeValue},
 * so uncertainty compounds through the chain instead of collapsing.
 */
public record Multiplier(double min, double max) {

    public static Multiplier of(double min, double max) {
        return new Multiplier(min, max);
    }
}
