package com.whatifplatform.common.sensitivity;

import com.whatifplatform.common.model.AssumptionFactor;
import com.whatifplatform.common.model.AssumptionSensitivity;
import com.whatifplatform.common.model.ImpactLevel;

import java.util.Map;

/**
 * Winning factor, its impact band, and the raw per-factor scores (percent change in
 * engagement-range width).
 */
public record SensitivityResult(
    AssumptionFactor mostSensitiveFactor,
    ImpactLevel impactIfWrong,
    double magnitude,
    Map<AssumptionFactor, Double> scores
) {

    public SensitivityResult {
        scores = Map.copyOf(scores);
    }

    public AssumptionSensitivity toAssumptionSensitivity() {
        return new AssumptionSensitivity(mostSensitiveFactor, impactIfWrong);
    }
}
