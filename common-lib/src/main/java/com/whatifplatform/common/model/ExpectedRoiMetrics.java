package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ROI range with its break-even and loss probabilities.
 * Probabilities are percentages and must lie in [0, 100].
 */
public record ExpectedRoiMetrics(
    @JsonProperty("roi_percent")            RangeValue roiPercent,
    @JsonProperty("break_even_probability") double breakEvenProbability,
    @JsonProperty("loss_probability")       double lossProbability
) {

    public ExpectedRoiMetrics {
        requireProbability("break_even_probability", breakEvenProbability);
        requireProbability("loss_probability", lossProbability);
    }

    static void requireProbability(String name, double value) {
        if (!(value >= 0.0 && value <= 100.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 100] but was " + value);
        }
    }
}
