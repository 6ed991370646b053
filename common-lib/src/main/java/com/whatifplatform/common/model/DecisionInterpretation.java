package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Strategic recommendation derived from the numeric ranges.
 * Both lists are always non-empty.
 */
public record DecisionInterpretation(
    @JsonProperty("recommended_posture")   RecommendedPosture recommendedPosture,
    @JsonProperty("primary_opportunities") List<String> primaryOpportunities,
    @JsonProperty("primary_risks")         List<String> primaryRisks
) {

    public DecisionInterpretation {
        primaryOpportunities = List.copyOf(primaryOpportunities);
        primaryRisks = List.copyOf(primaryRisks);
    }
}
