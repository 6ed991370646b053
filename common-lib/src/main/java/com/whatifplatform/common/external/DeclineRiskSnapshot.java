package com.whatifplatform.common.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Risk metrics reported by the early-decline detection system.
 * {@code riskTrajectory} is one of increasing, stable, decreasing. A score the system omits
 * or sends as null stays null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DeclineRiskSnapshot(
    @JsonProperty("current_risk_score") Double currentRiskScore,
    @JsonProperty("risk_indicators")    List<String> riskIndicators,
    @JsonProperty("risk_trajectory")    String riskTrajectory
) {

    public DeclineRiskSnapshot {
        riskIndicators = riskIndicators == null ? List.of() : List.copyOf(riskIndicators);
    }
}
