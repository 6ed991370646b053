package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coverage-aware baseline assembled from the upstream trend and risk systems.
 *
 * <p>Nullable fields are the ones that can go missing: when a field is absent its
 * name appears in {@code missingDataPoints} and it has no entry in {@code sources}.
 * {@code currentRiskScore} is the exception. It is never null; without upstream data it
 * carries the scenario's own score, attributed to {@code scenario_input}.
 *
 * @param dataCoverage percentage of the five tracked fields that were retrieved [0–100]
 */
public record Baseline(
    @JsonProperty("engagement_trend")      Double engagementTrend,
    @JsonProperty("roi_trend")             Double roiTrend,
    @JsonProperty("historical_volatility") Double historicalVolatility,
    @JsonProperty("current_risk_score")    double currentRiskScore,
    @JsonProperty("risk_trajectory")       RiskTrajectory riskTrajectory,
    @JsonProperty("data_coverage")         double dataCoverage,
    @JsonProperty("missing_data_points")   List<String> missingDataPoints,
    @JsonProperty("sources")               Map<String, String> sources
) {

    /** Number of fields tracked for coverage. */
    public static final int TRACKED_FIELDS = 5;

    /** Seed used by range computation when engagement data is missing. */
    public static final double NEUTRAL_ENGAGEMENT = 50.0;

    public Baseline {
        missingDataPoints = List.copyOf(missingDataPoints);
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public double engagementSeed() {
        return engagementTrend != null ? engagementTrend : NEUTRAL_ENGAGEMENT;
    }

    public boolean isComplete() {
        return missingDataPoints.isEmpty();
    }
}
