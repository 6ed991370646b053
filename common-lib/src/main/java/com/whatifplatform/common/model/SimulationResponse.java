package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Complete simulation output. Produced once per call and never persisted here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SimulationResponse(
    @JsonProperty("scenario_id")             String scenarioId,
    @JsonProperty("trend_id")                String trendId,
    @JsonProperty("trend_name")              String trendName,
    @JsonProperty("simulation_summary")      SimulationSummary simulationSummary,
    @JsonProperty("expected_growth_metrics") ExpectedGrowthMetrics expectedGrowthMetrics,
    @JsonProperty("expected_roi_metrics")    ExpectedRoiMetrics expectedRoiMetrics,
    @JsonProperty("risk_projection")         RiskProjection riskProjection,
    @JsonProperty("decision_interpretation") DecisionInterpretation decisionInterpretation,
    @JsonProperty("assumption_sensitivity")  AssumptionSensitivity assumptionSensitivity,
    @JsonProperty("guardrails")              Guardrails guardrails,
    @JsonProperty("executive_summary")       ExecutiveSummary executiveSummary
) {

    /**
     * Returns a copy with the executive summary attached.
     */
    public SimulationResponse withExecutiveSummary(ExecutiveSummary summary) {
        return new SimulationResponse(scenarioId, trendId, trendName, simulationSummary,
            expectedGrowthMetrics, expectedRoiMetrics, riskProjection, decisionInterpretation,
            assumptionSensitivity, guardrails, summary);
    }
}
