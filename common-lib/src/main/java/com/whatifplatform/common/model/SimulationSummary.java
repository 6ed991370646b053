package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SimulationSummary(
    @JsonProperty("scenario_label")  String scenarioLabel,
    @JsonProperty("overall_outlook") OverallOutlook overallOutlook,
    @JsonProperty("confidence")      ConfidenceLevel confidence
) {}
