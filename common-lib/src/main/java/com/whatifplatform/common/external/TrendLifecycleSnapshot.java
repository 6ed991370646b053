package com.whatifplatform.common.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trend metrics reported by the trend-lifecycle engine. Metrics are nominally in [0, 100];
 * the baseline extractor clamps them. A metric the engine omits or sends as null stays null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrendLifecycleSnapshot(
    @JsonProperty("lifecycle_stage")       String lifecycleStage,
    @JsonProperty("engagement_trend")      Double engagementTrend,
    @JsonProperty("roi_trend")             Double roiTrend,
    @JsonProperty("historical_volatility") Double historicalVolatility
) {}
