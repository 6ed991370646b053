package com.whatifplatform.simulator.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whatifplatform.common.model.RangeValue;

/**
 * Request body for {@code POST /api/v1/roi/projection}.
 */
public record RoiProjectionRequest(
    @JsonProperty("engagement_growth_range") RangeValue engagementGrowthRange,
    @JsonProperty("reach_growth_range")      RangeValue reachGrowthRange,
    @JsonProperty("campaign_budget")         double campaignBudget,
    @JsonProperty("campaign_duration_days")  int campaignDurationDays
) {}
