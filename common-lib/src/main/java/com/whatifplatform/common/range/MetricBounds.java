package com.whatifplatform.common.range;

import com.whatifplatform.common.model.RangeValue;

/**
 * Clamp windows for one projected metric. Lower and upper bounds have separate caps.
 */
public record MetricBounds(double minFloor, double minCeiling, double maxFloor, double maxCeiling) {

    public static final MetricBounds ENGAGEMENT_GROWTH     = new MetricBounds(0, 200, 0, 300);
    public static final MetricBounds REACH_GROWTH          = new MetricBounds(0, 200, 0, 250);
    public static final MetricBounds CREATOR_PARTICIPATION = new MetricBounds(-50, 100, -50, 150);
    public static final MetricBounds RISK_SCORE            = new MetricBounds(0, 100, 0, 100);

    public RangeValue apply(double min, double max) {
        return RangeValue.clamped(min, max, minFloor, minCeiling, maxFloor, maxCeiling);
    }

    public RangeValue apply(RangeValue range) {
        return apply(range.min(), range.max());
    }
}
