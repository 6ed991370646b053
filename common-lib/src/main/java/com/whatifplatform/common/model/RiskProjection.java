package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskProjection(
    @JsonProperty("current_risk_score")   double currentRiskScore,
    @JsonProperty("projected_risk_score") RangeValue projectedRiskScore,
    @JsonProperty("risk_trend")           RiskTrend riskTrend
) {}
