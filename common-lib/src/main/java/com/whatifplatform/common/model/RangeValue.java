package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A {@code [min, max]} uncertainty band. Never collapsed to a point estimate.
 *
 * <p>Invariant: both bounds are finite and {@code min <= max}. The compact constructor
 * rejects anything else, so every producer has to clamp or order its bounds first.
 */
public record RangeValue(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max
) {

    public RangeValue {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Range bounds must be finite: [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " exceeds max " + max);
        }
    }

    public static RangeValue of(double min, double max) {
        return new RangeValue(min, max);
    }

    /** Builds a range from two bounds given in either order. */
    public static RangeValue ordered(double a, double b) {
        return new RangeValue(Math.min(a, b), Math.max(a, b));
    }

    /**
     * Clamps each bound into its own window, then restores ordering.
     * Used where the lower and upper bounds have different caps.
     */
    public static RangeValue clamped(double min, double max,
                                     double minFloor, double minCeiling,
                                     double maxFloor, double maxCeiling) {
        return ordered(clamp(min, minFloor, minCeiling), clamp(max, maxFloor, maxCeiling));
    }

    public double width() {
        return max - min;
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }

    /** Multiplies the lower bound by {@code minMultiplier} and the upper by {@code maxMultiplier}. */
    public RangeValue multiply(Multiplier multiplier) {
        return ordered(min * multiplier.min(), max * multiplier.max());
    }

    /**
     * Scales the half-width around the midpoint. Factors at or below 1.0 leave the range unchanged.
     */
    public RangeValue widen(double factor) {
        if (factor <= 1.0) return this;
        double mid = midpoint();
        double halfWidth = width() / 2.0 * factor;
        return new RangeValue(mid - halfWidth, mid + halfWidth);
    }

    /** Replaces the upper bound only; a value below {@code min} is rejected. */
    public RangeValue withMax(double newMax) {
        return new RangeValue(min, newMax);
    }

    public RangeValue clamp(double floor, double ceiling) {
        return ordered(clamp(min, floor, ceiling), clamp(max, floor, ceiling));
    }

    public static double clamp(double value, double floor, double ceiling) {
        return Math.max(floor, Math.min(ceiling, value));
    }
}
