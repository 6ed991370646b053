package com.whatifplatform.common.external;

import com.whatifplatform.common.model.RangeValue;
import reactor.core.publisher.Mono;

/**
 * Query contract for the ROI-attribution system.
 */
@FunctionalInterface
public interface RoiAttribution {

    /**
     * @param engagementGrowth projected engagement growth range, percent
     * @param reachGrowth      projected reach growth range, percent
     * @param campaignBudget   upper bound of the campaign budget
     * @param durationDays     campaign duration
     * @return the ROI projection, or an empty Mono when unavailable
     */
    Mono<RoiAttributionSnapshot> query(RangeValue engagementGrowth, RangeValue reachGrowth,
                                       double campaignBudget, int durationDays);
}
