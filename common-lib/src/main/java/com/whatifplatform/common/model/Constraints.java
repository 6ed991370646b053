package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-specified boundaries for the simulation.
 */
public record Constraints(
    @JsonProperty("risk_tolerance") String riskTolerance,
    @JsonProperty("max_budget_cap") double maxBudgetCap
) {

    @JsonIgnore
    public RiskTolerance tolerance() {
        return RiskTolerance.fromValue(riskTolerance);
    }
}
