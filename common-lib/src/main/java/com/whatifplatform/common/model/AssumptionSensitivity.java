package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AssumptionSensitivity(
    @JsonProperty("most_sensitive_factor") AssumptionFactor mostSensitiveFactor,
    @JsonProperty("impact_if_wrong")       ImpactLevel impactIfWrong
) {}
