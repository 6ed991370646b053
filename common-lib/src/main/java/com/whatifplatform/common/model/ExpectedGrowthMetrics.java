package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Range-based growth projections, all in percent.
 */
public record ExpectedGrowthMetrics(
    @JsonProperty("engagement_growth_percent")            RangeValue engagementGrowthPercent,
    @JsonProperty("reach_growth_percent")                 RangeValue reachGrowthPercent,
    @JsonProperty("creator_participation_change_percent") RangeValue creatorParticipationChangePercent
) {}
