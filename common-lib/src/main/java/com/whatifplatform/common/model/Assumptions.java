package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-provided beliefs about market conditions. Any field may be {@code null}
 * until defaults are applied.
 *
 * <p>The {@code with*} factories return a new instance.
 */
public record Assumptions(
    @JsonProperty("engagement_trend")      String engagementTrend,
    @JsonProperty("creator_participation") String creatorParticipation,
    @JsonProperty("market_noise")          String marketNoise
) {

    public static Assumptions unset() {
        return new Assumptions(null, null, null);
    }

    public Assumptions withEngagementTrend(EngagementTrend value) {
        return new Assumptions(value.value(), creatorParticipation, marketNoise);
    }

    public Assumptions withCreatorParticipation(CreatorParticipation value) {
        return new Assumptions(engagementTrend, value.value(), marketNoise);
    }

    public Assumptions withMarketNoise(MarketNoise value) {
        return new Assumptions(engagementTrend, creatorParticipation, value.value());
    }

    @JsonIgnore
    public EngagementTrend engagement() {
        return EngagementTrend.fromValue(engagementTrend);
    }

    @JsonIgnore
    public CreatorParticipation participation() {
        return CreatorParticipation.fromValue(creatorParticipation);
    }

    @JsonIgnore
    public MarketNoise noise() {
        return MarketNoise.fromValue(marketNoise);
    }
}
