package com.whatifplatform.common.range;

import com.whatifplatform.common.constants.MultiplierTables;
import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.CampaignStrategy;
import com.whatifplatform.common.model.CampaignType;
import com.whatifplatform.common.model.ContentIntensity;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;

/**
 * Multiplier-chain math producing growth and risk ranges.
 *
 * <p>Every step multiplies the lower bound by the lower multiplier and the upper bound by
 * the upper multiplier, so uncertainty compounds instead of collapsing to a point.
 *
 * <h3>Chains</h3>
 * <pre>
 *   engagement  = seed×[0.8,1.2] × budget tier × content intensity × engagement trend
 *                 × creator participation, widened by market noise
 *   reach       = seed×[0.6,1.4] × creator tier, upper bound alone reduced for campaigns
 *                 over 90 days (at most −30%, never below the lower bound), × [0.7,0.85] at peak
 *   creator     = [10,30] × creator participation × content intensity
 *   risk        = [c+adj−5, c+adj+10]
 * </pre>
 *
 * <p>Expects a validated scenario whose assumptions have been defaulted.
 * Pure logic class. No WebClient. No logging.
 */
public final class RangeComputation {

    static final double RISK_BAND_BELOW = 5.0;
    static final double RISK_BAND_ABOVE = 10.0;
    static final double RISK_TREND_STABLE_BAND = 2.0;

    private RangeComputation() {}

    public static ProjectedRanges computeAll(double baselineEngagement, double currentRiskScore,
                                             ScenarioInput scenario) {
        return new ProjectedRanges(
            engagementGrowth(baselineEngagement, scenario),
            reachGrowth(baselineEngagement, scenario),
            creatorParticipationChange(scenario),
            projectedRiskScore(currentRiskScore, scenario));
    }

    public static RangeValue engagementGrowth(double baselineEngagement, ScenarioInput scenario) {
        CampaignStrategy strategy = scenario.campaignStrategy();
        Assumptions assumptions = scenario.assumptions();

        RangeValue range = RangeValue.of(baselineEngagement, baselineEngagement)
            .multiply(MultiplierTables.ENGAGEMENT_SEED)
            .multiply(MultiplierTables.budget(MultiplierTables.budgetTier(strategy.budget())))
            .multiply(MultiplierTables.contentIntensity(strategy.intensity()))
            .multiply(MultiplierTables.engagementTrend(assumptions.engagement()))
            .multiply(MultiplierTables.creatorParticipation(assumptions.participation()))
            .widen(MultiplierTables.marketNoiseWidening(assumptions.noise()));

        return MetricBounds.ENGAGEMENT_GROWTH.apply(range);
    }

    public static RangeValue reachGrowth(double baselineEngagement, ScenarioInput scenario) {
        CampaignStrategy strategy = scenario.campaignStrategy();

        RangeValue range = RangeValue.of(baselineEngagement, baselineEngagement)
            .multiply(MultiplierTables.REACH_SEED)
            .multiply(MultiplierTables.creatorTierReach(strategy.tier()));

        int duration = strategy.campaignDurationDays();
        if (duration > MultiplierTables.DIMINISHING_RETURNS_THRESHOLD_DAYS) {
            range = range.withMax(Math.max(range.min(), range.max() * diminishingReturnsFactor(duration)));
        }

        if (scenario.trendContext().stage() == LifecycleStage.PEAK) {
            range = range.multiply(MultiplierTables.PEAK_SATURATION);
        }

        return MetricBounds.REACH_GROWTH.apply(range);
    }

    /**
     * Upper-bound reduction for long campaigns: 1.0 up to 90 days, then linear down to 0.7 at
     * 455 days and held there.
     */
    static double diminishingReturnsFactor(int durationDays) {
        if (durationDays <= MultiplierTables.DIMINISHING_RETURNS_THRESHOLD_DAYS) return 1.0;
        double excess = durationDays - MultiplierTables.DIMINISHING_RETURNS_THRESHOLD_DAYS;
        return Math.max(1.0 - MultiplierTables.DIMINISHING_RETURNS_MAX_REDUCTION,
                        1.0 - (excess / 365.0) * MultiplierTables.DIMINISHING_RETURNS_MAX_REDUCTION);
    }

    /** Independent of the engagement seed. */
    public static RangeValue creatorParticipationChange(ScenarioInput scenario) {
        var participation = MultiplierTables.creatorParticipation(scenario.assumptions().participation());
        var intensity = MultiplierTables.contentIntensity(scenario.campaignStrategy().intensity());

        double min = MultiplierTables.CREATOR_CHANGE_BASE_MIN * participation.min() * intensity.min();
        double max = MultiplierTables.CREATOR_CHANGE_BASE_MAX * participation.max() * intensity.max();
        return MetricBounds.CREATOR_PARTICIPATION.apply(min, max);
    }

    public static RangeValue projectedRiskScore(double currentRiskScore, ScenarioInput scenario) {
        double center = currentRiskScore + riskAdjustment(scenario);
        return MetricBounds.RISK_SCORE.apply(center - RISK_BAND_BELOW, center + RISK_BAND_ABOVE);
    }

    /**
     * Sum of the discrete risk rules:
     * +15 short_term_influencer at peak, −10 organic_only in growth (mutually exclusive),
     * +20 decline/dormant, +5 high / −5 low content intensity.
     */
    public static double riskAdjustment(ScenarioInput scenario) {
        LifecycleStage stage = scenario.trendContext().stage();
        CampaignType type = scenario.campaignStrategy().type();

        double adjustment = 0.0;
        if (type == CampaignType.SHORT_TERM_INFLUENCER && stage == LifecycleStage.PEAK) {
            adjustment = 15.0;
        } else if (type == CampaignType.ORGANIC_ONLY && stage == LifecycleStage.GROWTH) {
            adjustment = -10.0;
        }

        if (stage.isLate()) adjustment += 20.0;

        ContentIntensity intensity = scenario.campaignStrategy().intensity();
        if (intensity == ContentIntensity.HIGH)     adjustment += 5.0;
        else if (intensity == ContentIntensity.LOW) adjustment -= 5.0;

        return adjustment;
    }

    public static RiskTrend riskTrend(double currentRiskScore, RangeValue projectedRisk) {
        double midpoint = projectedRisk.midpoint();
        if (midpoint > currentRiskScore + RISK_TREND_STABLE_BAND) return RiskTrend.WORSENING;
        if (midpoint < currentRiskScore - RISK_TREND_STABLE_BAND) return RiskTrend.IMPROVING;
        return RiskTrend.STABLE;
    }
}
