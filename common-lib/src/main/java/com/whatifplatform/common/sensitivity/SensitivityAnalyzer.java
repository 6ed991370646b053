package com.whatifplatform.common.sensitivity;

import com.whatifplatform.common.model.AssumptionFactor;
import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.CreatorParticipation;
import com.whatifplatform.common.model.EngagementTrend;
import com.whatifplatform.common.model.ImpactLevel;
import com.whatifplatform.common.model.MarketNoise;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.range.RangeComputation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Measures which assumption, if wrong, moves the engagement-growth range the most.
 *
 * <p>Each pass flips exactly one assumption on a copy of the scenario and recomputes the
 * engagement range. The caller's scenario is never modified, so concurrent simulations
 * may share one input safely.
 *
 * <pre>
 *   engagement_trend       optimistic ↔ pessimistic, neutral → optimistic
 *   creator_participation  increasing ↔ declining,   stable  → increasing
 *   market_noise           low ↔ high,               medium  → high
 *
 *   score  = |width(flipped) − width(current)| / width(current) × 100   (0 when width is 0)
 *   impact = high &gt; 30, medium &gt; 15, else low
 * </pre>
 *
 * Ties go to the earlier factor in declaration order. Pure logic class. No WebClient. No logging.
 */
public final class SensitivityAnalyzer {

    static final double HIGH_IMPACT_THRESHOLD   = 30.0;
    static final double MEDIUM_IMPACT_THRESHOLD = 15.0;

    private SensitivityAnalyzer() {}

    public static SensitivityResult analyze(double baselineEngagement, ScenarioInput scenario) {
        double currentWidth = RangeComputation.engagementGrowth(baselineEngagement, scenario).width();
        Assumptions assumptions = scenario.assumptions();

        // EnumMap iterates in declaration order, which is the flip order.
        Map<AssumptionFactor, Double> scores = new EnumMap<>(AssumptionFactor.class);
        for (AssumptionFactor factor : AssumptionFactor.values()) {
            ScenarioInput flipped = scenario.withAssumptions(flip(factor, assumptions));
            double flippedWidth = RangeComputation.engagementGrowth(baselineEngagement, flipped).width();
            scores.put(factor, impact(currentWidth, flippedWidth));
        }

        AssumptionFactor winner = AssumptionFactor.ENGAGEMENT_TREND;
        double magnitude = scores.get(winner);
        for (Map.Entry<AssumptionFactor, Double> entry : scores.entrySet()) {
            if (entry.getValue() > magnitude) {
                winner = entry.getKey();
                magnitude = entry.getValue();
            }
        }

        return new SensitivityResult(winner, impactLevel(magnitude), magnitude, scores);
    }

    static Assumptions flip(AssumptionFactor factor, Assumptions assumptions) {
        return switch (factor) {
            case ENGAGEMENT_TREND      -> assumptions.withEngagementTrend(opposite(assumptions.engagement()));
            case CREATOR_PARTICIPATION -> assumptions.withCreatorParticipation(opposite(assumptions.participation()));
            case MARKET_NOISE          -> assumptions.withMarketNoise(opposite(assumptions.noise()));
        };
    }

    static EngagementTrend opposite(EngagementTrend trend) {
        return switch (trend) {
            case OPTIMISTIC  -> EngagementTrend.PESSIMISTIC;
            case PESSIMISTIC -> EngagementTrend.OPTIMISTIC;
            case NEUTRAL     -> EngagementTrend.OPTIMISTIC;
        };
    }

    static CreatorParticipation opposite(CreatorParticipation participation) {
        return switch (participation) {
            case INCREASING -> CreatorParticipation.DECLINING;
            case DECLINING  -> CreatorParticipation.INCREASING;
            case STABLE     -> CreatorParticipation.INCREASING;
        };
    }

    static MarketNoise opposite(MarketNoise noise) {
        return switch (noise) {
            case LOW    -> MarketNoise.HIGH;
            case HIGH   -> MarketNoise.LOW;
            case MEDIUM -> MarketNoise.HIGH;
        };
    }

    static double impact(double currentWidth, double flippedWidth) {
        if (currentWidth <= 0.0) return 0.0;
        return Math.abs(flippedWidth - currentWidth) / currentWidth * 100.0;
    }

    static ImpactLevel impactLevel(double magnitude) {
        if (magnitude > HIGH_IMPACT_THRESHOLD)   return ImpactLevel.HIGH;
        if (magnitude > MEDIUM_IMPACT_THRESHOLD) return ImpactLevel.MEDIUM;
        return ImpactLevel.LOW;
    }
}
