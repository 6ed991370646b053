package com.whatifplatform.common.range;

import com.whatifplatform.common.model.RangeValue;

/**
 * The four ranges produced by one pass of {@link RangeComputation}.
 */
public record ProjectedRanges(
    RangeValue engagementGrowth,
    RangeValue reachGrowth,
    RangeValue creatorParticipationChange,
    RangeValue projectedRisk
) {

    /**
     * Widens all four ranges by the same factor and re-clamps each one to its metric bounds.
     */
    public ProjectedRanges widenAll(double factor) {
        if (factor <= 1.0) return this;
        return new ProjectedRanges(
            MetricBounds.ENGAGEMENT_GROWTH.apply(engagementGrowth.widen(factor)),
            MetricBounds.REACH_GROWTH.apply(reachGrowth.widen(factor)),
            MetricBounds.CREATOR_PARTICIPATION.apply(creatorParticipationChange.widen(factor)),
            MetricBounds.RISK_SCORE.apply(projectedRisk.widen(factor)));
    }
}
