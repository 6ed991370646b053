package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Complete scenario submitted for simulation.
 *
 * <p>Created once by the caller and never mutated by the pipeline. Every stage that
 * needs a variant (assigned id, defaulted assumptions, sensitivity flips) works on a
 * copy produced by the {@code with*} factories.
 */
public record ScenarioInput(
    @JsonProperty("trend_context")     TrendContext trendContext,
    @JsonProperty("campaign_strategy") CampaignStrategy campaignStrategy,
    @JsonProperty("assumptions")       Assumptions assumptions,
    @JsonProperty("constraints")       Constraints constraints,
    @JsonProperty("scenario_id")       String scenarioId
) {

    public ScenarioInput withScenarioId(String scenarioId) {
        return new ScenarioInput(trendContext, campaignStrategy, assumptions, constraints, scenarioId);
    }

    public ScenarioInput withAssumptions(Assumptions assumptions) {
        return new ScenarioInput(trendContext, campaignStrategy, assumptions, constraints, scenarioId);
    }
}
