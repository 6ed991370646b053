package com.whatifplatform.common.guardrails;

import com.whatifplatform.common.model.ConfidenceLevel;
import com.whatifplatform.common.model.Guardrails;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.RiskTolerance;
import com.whatifplatform.common.model.ScenarioInput;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the transparency note attached to every simulation.
 *
 * <p>Clauses are appended in a fixed order, space separated:
 * <ol>
 *   <li>base disclaimer (always)</li>
 *   <li>low coverage (&lt; 50%) with the missing fields</li>
 *   <li>emerging or dormant stage: limited precedent</li>
 *   <li>budget outside [1,000, 100,000]</li>
 *   <li>low risk tolerance</li>
 *   <li>defaulted assumptions</li>
 *   <li>high confidence with coverage ≥ 80%</li>
 * </ol>
 */
public final class GuardrailsGenerator {

    static final String BASE_DISCLAIMER = "This is a conditional simulation, not a guaranteed outcome.";

    static final double LOW_COVERAGE       = 50.0;
    static final double ENDORSED_COVERAGE  = 80.0;
    static final double TYPICAL_BUDGET_MIN = 1_000.0;
    static final double TYPICAL_BUDGET_MAX = 100_000.0;

    private GuardrailsGenerator() {}

    public static Guardrails generate(double dataCoverage, ScenarioInput scenario,
                                      List<String> missingDataPoints, List<String> defaultsApplied) {
        return new Guardrails(dataCoverage,
            generateSystemNote(dataCoverage, scenario, missingDataPoints, defaultsApplied));
    }

    public static String generateSystemNote(double dataCoverage, ScenarioInput scenario,
                                            List<String> missingDataPoints, List<String> defaultsApplied) {
        List<String> notes = new ArrayList<>();
        notes.add(BASE_DISCLAIMER);

        if (dataCoverage < LOW_COVERAGE) {
            notes.add(String.format("Results are based on partial data (%.0f%% coverage). "
                + "Ranges are widened to reflect increased uncertainty.", dataCoverage));
            if (!missingDataPoints.isEmpty()) {
                notes.add("Missing data points: " + String.join(", ", missingDataPoints));
            }
        }

        LifecycleStage stage = scenario.trendContext().stage();
        if (stage == LifecycleStage.EMERGING || stage == LifecycleStage.DORMANT) {
            notes.add("Trend is in " + stage.value() + " stage with limited historical precedent. "
                + "Projections are based on limited comparable data.");
        }

        double budget = scenario.campaignStrategy().budget();
        if (budget < TYPICAL_BUDGET_MIN || budget > TYPICAL_BUDGET_MAX) {
            notes.add(String.format("Campaign budget (%.0f) is outside typical range. "
                + "Extrapolation limits apply.", budget));
        }

        if (scenario.constraints().tolerance() == RiskTolerance.LOW) {
            notes.add("Risk tolerance is set to 'low'. Review projected risk scores carefully.");
        }

        if (!defaultsApplied.isEmpty()) {
            notes.add("Default assumptions applied for: " + String.join(", ", defaultsApplied));
        }

        if (scenario.trendContext().confidenceLevel() == ConfidenceLevel.HIGH
                && dataCoverage >= ENDORSED_COVERAGE) {
            notes.add("High confidence in baseline data supports these projections.");
        }

        return String.join(" ", notes);
    }
}
