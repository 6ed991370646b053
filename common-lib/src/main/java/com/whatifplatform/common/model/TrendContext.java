package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metadata about the trend being analysed.
 *
 * <p>Enumerated fields stay raw strings so that validation can report every
 * out-of-domain value at once; the typed accessors are only safe after validation.
 */
public record TrendContext(
    @JsonProperty("trend_id")           String trendId,
    @JsonProperty("trend_name")         String trendName,
    @JsonProperty("platform")           String platform,
    @JsonProperty("lifecycle_stage")    String lifecycleStage,
    @JsonProperty("current_risk_score") double currentRiskScore,
    @JsonProperty("confidence")         String confidence
) {

    @JsonIgnore
    public LifecycleStage stage() {
        return LifecycleStage.fromValue(lifecycleStage);
    }

    @JsonIgnore
    public ConfidenceLevel confidenceLevel() {
        return ConfidenceLevel.fromValue(confidence);
    }
}
