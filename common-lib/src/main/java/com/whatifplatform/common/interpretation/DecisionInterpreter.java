package com.whatifplatform.common.interpretation;

import com.whatifplatform.common.model.CreatorTier;
import com.whatifplatform.common.model.DecisionInterpretation;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RecommendedPosture;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.range.ProjectedRanges;
import com.whatifplatform.common.roi.RoiProbabilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates numeric ranges into a posture, opportunity and risk call-outs, and an outlook.
 *
 * <h3>Posture (first match wins)</h3>
 * <pre>
 *   AVOID       stage ∈ {decline, dormant} AND loss &gt; 60
 *   SCALE       breakEven ≥ 70 AND trend ∈ {stable, improving}
 *   MONITOR     40 ≤ breakEven ≤ 70 AND trend == stable
 *   TEST_SMALL  breakEven &lt; 40 OR trend == worsening
 *   MONITOR     otherwise
 * </pre>
 *
 * Pure logic class. No WebClient. No logging.
 */
public final class DecisionInterpreter {

    static final double BREAK_EVEN_AGGRESSIVE = 70.0;
    static final double BREAK_EVEN_MODERATE   = 40.0;
    static final double LOSS_AVOID            = 60.0;

    static final String FALLBACK_OPPORTUNITY = "Baseline growth opportunity";
    static final String FALLBACK_RISK        = "Baseline execution risk";

    private DecisionInterpreter() {}

    public static DecisionInterpretation interpret(ProjectedRanges ranges, RoiProbabilities probabilities,
                                                   RiskTrend riskTrend, ScenarioInput scenario) {
        return new DecisionInterpretation(
            recommendedPosture(probabilities.breakEven(), probabilities.loss(), riskTrend,
                scenario.trendContext().stage()),
            opportunities(ranges, scenario),
            risks(ranges, probabilities.loss(), riskTrend, scenario));
    }

    public static RecommendedPosture recommendedPosture(double breakEven, double loss,
                                                        RiskTrend riskTrend, LifecycleStage stage) {
        boolean settled = riskTrend == RiskTrend.STABLE || riskTrend == RiskTrend.IMPROVING;

        if (stage.isLate() && loss > LOSS_AVOID) {
            return RecommendedPosture.AVOID;
        }
        if (breakEven >= BREAK_EVEN_AGGRESSIVE && settled) {
            return RecommendedPosture.SCALE;
        }
        if (breakEven >= BREAK_EVEN_MODERATE && breakEven <= BREAK_EVEN_AGGRESSIVE
                && riskTrend == RiskTrend.STABLE) {
            return RecommendedPosture.MONITOR;
        }
        if (breakEven < BREAK_EVEN_MODERATE || riskTrend == RiskTrend.WORSENING) {
            return RecommendedPosture.TEST_SMALL;
        }
        return RecommendedPosture.MONITOR;
    }

    public static List<String> opportunities(ProjectedRanges ranges, ScenarioInput scenario) {
        List<String> opportunities = new ArrayList<>();
        LifecycleStage stage = scenario.trendContext().stage();

        if (ranges.engagementGrowth().max() > 50)           opportunities.add("High engagement growth potential");
        if (ranges.reachGrowth().max() > 40)                opportunities.add("Significant audience expansion opportunity");
        if (ranges.creatorParticipationChange().max() > 20) opportunities.add("Strong creator participation growth potential");
        if (stage == LifecycleStage.EMERGING)               opportunities.add("Early-stage trend positioning advantage");
        if (stage == LifecycleStage.GROWTH)                 opportunities.add("Momentum in growth phase");
        if (scenario.trendContext().currentRiskScore() < 30) opportunities.add("Low volatility environment");
        if (scenario.campaignStrategy().tier() == CreatorTier.MACRO) {
            opportunities.add("High-reach creator network available");
        }

        if (opportunities.isEmpty()) opportunities.add(FALLBACK_OPPORTUNITY);
        return opportunities;
    }

    public static List<String> risks(ProjectedRanges ranges, double loss, RiskTrend riskTrend,
                                     ScenarioInput scenario) {
        List<String> risks = new ArrayList<>();
        CreatorTier tier = scenario.campaignStrategy().tier();

        if (ranges.engagementGrowth().max() < 20)       risks.add("Limited engagement growth potential");
        if (ranges.reachGrowth().max() < 15)            risks.add("Constrained audience expansion");
        if (loss > LOSS_AVOID)                          risks.add("High probability of financial loss");
        if (riskTrend == RiskTrend.WORSENING)           risks.add("Risk trajectory deteriorating");
        if (scenario.trendContext().stage().isLate())   risks.add("Trend in late lifecycle stage");
        if (scenario.trendContext().currentRiskScore() > 70) risks.add("High trend volatility");
        if (tier == CreatorTier.NANO || tier == CreatorTier.MICRO) risks.add("Limited creator reach capacity");
        if (scenario.campaignStrategy().campaignDurationDays() > 180) {
            risks.add("Extended campaign duration increases uncertainty");
        }

        if (risks.isEmpty()) risks.add(FALLBACK_RISK);
        return risks;
    }

    public static OverallOutlook overallOutlook(double breakEven, double loss, RiskTrend riskTrend) {
        if (breakEven >= BREAK_EVEN_AGGRESSIVE
                && (riskTrend == RiskTrend.STABLE || riskTrend == RiskTrend.IMPROVING)) {
            return OverallOutlook.FAVORABLE;
        }
        if (loss > LOSS_AVOID || riskTrend == RiskTrend.WORSENING) {
            return OverallOutlook.UNFAVORABLE;
        }
        return OverallOutlook.RISKY;
    }
}
