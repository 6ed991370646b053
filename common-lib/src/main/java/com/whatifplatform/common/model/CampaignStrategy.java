package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-specified campaign parameters.
 */
public record CampaignStrategy(
    @JsonProperty("campaign_type")          String campaignType,
    @JsonProperty("budget_range")           BudgetRange budgetRange,
    @JsonProperty("campaign_duration_days") int campaignDurationDays,
    @JsonProperty("creator_tier")           String creatorTier,
    @JsonProperty("content_intensity")      String contentIntensity
) {

    @JsonIgnore
    public CampaignType type() {
        return CampaignType.fromValue(campaignType);
    }

    @JsonIgnore
    public CreatorTier tier() {
        return CreatorTier.fromValue(creatorTier);
    }

    @JsonIgnore
    public ContentIntensity intensity() {
        return ContentIntensity.fromValue(contentIntensity);
    }

    /** Budget figure used by the ROI and guardrail rules: the upper bound of the range. */
    @JsonIgnore
    public double budget() {
        return budgetRange.max();
    }
}
