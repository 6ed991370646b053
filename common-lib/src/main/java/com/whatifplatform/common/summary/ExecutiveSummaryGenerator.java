package com.whatifplatform.common.summary;

import com.whatifplatform.common.model.AssumptionSensitivity;
import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.ExecutiveSummary;
import com.whatifplatform.common.model.ExecutiveSummary.ActionItem;
import com.whatifplatform.common.model.ExecutiveSummary.CriticalAssumptions;
import com.whatifplatform.common.model.ExecutiveSummary.FinancialOutlook;
import com.whatifplatform.common.model.ExecutiveSummary.KeyDrivers;
import com.whatifplatform.common.model.ExecutiveSummary.Priority;
import com.whatifplatform.common.model.ExecutiveSummary.RiskAssessment;
import com.whatifplatform.common.model.ExecutiveSummary.StrategicRecommendation;
import com.whatifplatform.common.model.ExecutiveSummary.SuccessProbability;
import com.whatifplatform.common.model.ExecutiveSummary.TrendAnalysis;
import com.whatifplatform.common.model.ImpactLevel;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RecommendedPosture;
import com.whatifplatform.common.model.RiskTolerance;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.SimulationResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Templates an {@link ExecutiveSummary} from a finished response.
 *
 * <p>Expects the scenario with defaults applied, i.e. the one the response was computed from.
 * Pure logic class. No WebClient. No logging.
 */
public final class ExecutiveSummaryGenerator {

    private ExecutiveSummaryGenerator() {}

    public static ExecutiveSummary generate(SimulationResponse response, ScenarioInput scenario) {
        return new ExecutiveSummary(
            trendAnalysis(response, scenario),
            successProbability(response),
            financialOutlook(response),
            riskAssessment(response, scenario),
            strategicRecommendation(response, scenario),
            keyDrivers(response),
            criticalAssumptions(response, scenario),
            actionItems(response));
    }

    // ── Sections ──────────────────────────────────────────────────────────────

    static TrendAnalysis trendAnalysis(SimulationResponse response, ScenarioInput scenario) {
        LifecycleStage stage = scenario.trendContext().stage();
        double currentRisk = response.riskProjection().currentRiskScore();
        RiskTrend trend = response.riskProjection().riskTrend();

        return new TrendAnalysis(stage, describeStage(stage), currentRisk, riskLevel(currentRisk),
            trend, describeRiskTrend(trend), interpretStage(stage, currentRisk, trend));
    }

    static SuccessProbability successProbability(SimulationResponse response) {
        double breakEven = response.expectedRoiMetrics().breakEvenProbability();
        RangeValue roi = response.expectedRoiMetrics().roiPercent();
        String level = successLevel(breakEven);

        return new SuccessProbability(breakEven, response.expectedRoiMetrics().lossProbability(),
            level, roi, roi.midpoint(), interpretSuccess(level, breakEven, roi));
    }

    static FinancialOutlook financialOutlook(SimulationResponse response) {
        RangeValue roi = response.expectedRoiMetrics().roiPercent();
        double breakEven = response.expectedRoiMetrics().breakEvenProbability();

        String outlook;
        String interpretation;
        if (breakEven >= 70) {
            outlook = "positive";
            interpretation = String.format("Strong financial case with best-case ROI of %.0f%% and worst-case of %.0f%%. "
                + "High probability of positive returns justifies investment.", roi.max(), roi.min());
        } else if (breakEven >= 40) {
            outlook = "moderate";
            interpretation = String.format("Moderate financial case with best-case ROI of %.0f%% and worst-case of %.0f%%. "
                + "Requires risk mitigation strategies.", roi.max(), roi.min());
        } else {
            outlook = "negative";
            interpretation = String.format("Weak financial case with best-case ROI of %.0f%% and worst-case of %.0f%%. "
                + "High risk of losses suggests reconsidering investment.", roi.max(), roi.min());
        }
        return new FinancialOutlook(outlook, roi.max(), roi.min(), roi.midpoint(), breakEven, interpretation);
    }

    static RiskAssessment riskAssessment(SimulationResponse response, ScenarioInput scenario) {
        double currentRisk = response.riskProjection().currentRiskScore();
        RangeValue projected = response.riskProjection().projectedRiskScore();
        RiskTrend trend = response.riskProjection().riskTrend();
        RiskTolerance tolerance = scenario.constraints().tolerance();

        String interpretation = switch (trend) {
            case IMPROVING -> String.format("Risk is improving from %.0f to %.0f. "
                + "Campaign execution is expected to stabilize the trend.", currentRisk, projected.max());
            case STABLE    -> String.format("Risk remains stable at approximately %.0f. "
                + "Conditions are predictable and manageable.", projected.max());
            case WORSENING -> String.format("Risk is worsening from %.0f to %.0f. "
                + "Campaign execution may increase volatility. %s risk tolerance may be insufficient.",
                currentRisk, projected.max(), tolerance.value());
        };

        return new RiskAssessment(currentRisk, riskLevel(currentRisk), projected,
            projected.max() - currentRisk, trend, tolerance,
            toleranceAlignment(tolerance, projected.max()), interpretation);
    }

    static StrategicRecommendation strategicRecommendation(SimulationResponse response, ScenarioInput scenario) {
        RecommendedPosture posture = response.decisionInterpretation().recommendedPosture();
        OverallOutlook outlook = response.simulationSummary().overallOutlook();

        String postureDescription = switch (posture) {
            case SCALE      -> "Aggressively scale investment - conditions are favorable";
            case MONITOR    -> "Monitor closely and maintain current investment level";
            case TEST_SMALL -> "Test with limited budget before scaling";
            case AVOID      -> "Avoid this scenario - risk is too high";
        };
        String outlookDescription = switch (outlook) {
            case FAVORABLE   -> "Strong conditions support investment";
            case RISKY       -> "Moderate conditions with uncertainty";
            case UNFAVORABLE -> "Weak conditions suggest caution";
        };

        return new StrategicRecommendation(posture, postureDescription, outlook, outlookDescription,
            response.simulationSummary().confidence(), postureRationale(response, scenario));
    }

    static KeyDrivers keyDrivers(SimulationResponse response) {
        List<String> opportunities = response.decisionInterpretation().primaryOpportunities();
        List<String> risks = response.decisionInterpretation().primaryRisks();
        AssumptionSensitivity sensitivity = response.assumptionSensitivity();

        String interpretation = "Key opportunities include " + String.join(", ", head(opportunities, 2))
            + ". Main risks are " + String.join(", ", head(risks, 2))
            + ". Success depends on capitalizing on opportunities while mitigating risks.";

        return new KeyDrivers(opportunities, risks,
            sensitivity.mostSensitiveFactor(), sensitivity.impactIfWrong(),
            response.expectedGrowthMetrics().engagementGrowthPercent(),
            response.expectedGrowthMetrics().reachGrowthPercent(),
            interpretation);
    }

    static CriticalAssumptions criticalAssumptions(SimulationResponse response, ScenarioInput scenario) {
        Assumptions assumptions = scenario.assumptions();
        AssumptionSensitivity sensitivity = response.assumptionSensitivity();
        double coverage = response.guardrails().dataCoverage();

        String interpretation = String.format("Assumptions are based on %.0f%% data coverage. "
            + "The %s assumption has %s impact on outcomes. Validate this assumption before committing resources.",
            coverage, sensitivity.mostSensitiveFactor().value(), sensitivity.impactIfWrong().value());

        return new CriticalAssumptions(assumptions.engagement(), assumptions.participation(), assumptions.noise(),
            sensitivity.mostSensitiveFactor(), sensitivity.impactIfWrong(), coverage,
            dataQuality(coverage), interpretation);
    }

    static List<ActionItem> actionItems(SimulationResponse response) {
        List<ActionItem> actions = new ArrayList<>();

        switch (response.decisionInterpretation().recommendedPosture()) {
            case SCALE -> {
                actions.add(new ActionItem(Priority.HIGH,
                    "Increase budget allocation and expand creator network",
                    "Favorable conditions support aggressive scaling"));
                actions.add(new ActionItem(Priority.HIGH,
                    "Accelerate campaign timeline to capitalize on momentum",
                    "Trend is in growth phase with strong engagement potential"));
            }
            case MONITOR -> {
                actions.add(new ActionItem(Priority.MEDIUM,
                    "Maintain current investment level and monitor metrics weekly",
                    "Conditions are stable but uncertain"));
                actions.add(new ActionItem(Priority.MEDIUM,
                    "Prepare contingency plans for risk escalation",
                    "Risk trend may change"));
            }
            case TEST_SMALL -> {
                actions.add(new ActionItem(Priority.HIGH,
                    "Start with limited budget pilot program",
                    "Low confidence requires validation before scaling"));
                actions.add(new ActionItem(Priority.HIGH,
                    "Establish clear success metrics and decision gates",
                    "Need to validate assumptions before committing resources"));
            }
            case AVOID -> {
                actions.add(new ActionItem(Priority.HIGH,
                    "Avoid this scenario or significantly reduce scope",
                    "Risk is too high relative to potential returns"));
                actions.add(new ActionItem(Priority.MEDIUM,
                    "Explore alternative trends or strategies",
                    "Better opportunities likely exist"));
            }
        }

        AssumptionSensitivity sensitivity = response.assumptionSensitivity();
        if (sensitivity.impactIfWrong() == ImpactLevel.HIGH) {
            actions.add(new ActionItem(Priority.HIGH,
                "Validate " + sensitivity.mostSensitiveFactor().value() + " assumption with market research",
                "This assumption has high impact on outcomes"));
        }

        double coverage = response.guardrails().dataCoverage();
        if (coverage < 75) {
            actions.add(new ActionItem(Priority.MEDIUM,
                "Collect additional data to improve confidence",
                String.format("Current data coverage is %.0f%%", coverage)));
        }
        return actions;
    }

    // ── Classification helpers ────────────────────────────────────────────────

    static String riskLevel(double riskScore) {
        if (riskScore < 25) return "low";
        if (riskScore < 50) return "moderate";
        if (riskScore < 75) return "high";
        return "critical";
    }

    static String successLevel(double breakEven) {
        if (breakEven >= 80) return "very_high";
        if (breakEven >= 60) return "high";
        if (breakEven >= 40) return "moderate";
        if (breakEven >= 20) return "low";
        return "very_low";
    }

    static String toleranceAlignment(RiskTolerance tolerance, double projectedRiskMax) {
        if (tolerance == RiskTolerance.LOW && projectedRiskMax > 60) {
            return "misaligned - projected risk exceeds tolerance";
        }
        if (tolerance == RiskTolerance.MEDIUM && projectedRiskMax > 75) {
            return "misaligned - projected risk exceeds tolerance";
        }
        if (tolerance == RiskTolerance.HIGH) {
            return "aligned - high tolerance accommodates projected risk";
        }
        return "aligned - projected risk within tolerance";
    }

    static String dataQuality(double coverage) {
        if (coverage >= 90) return "Excellent - high confidence in data";
        if (coverage >= 75) return "Good - sufficient data for analysis";
        if (coverage >= 50) return "Fair - limited data, ranges widened";
        return "Poor - significant data gaps, use with caution";
    }

    private static String describeStage(LifecycleStage stage) {
        return switch (stage) {
            case EMERGING -> "early-stage trend with growth potential but limited historical data";
            case GROWTH   -> "rapidly expanding trend with strong momentum and creator participation";
            case PEAK     -> "at maximum adoption with high saturation and potential volatility";
            case DECLINE  -> "losing momentum with decreasing engagement and creator interest";
            case DORMANT  -> "inactive trend with minimal engagement and high risk of failure";
        };
    }

    private static String describeRiskTrend(RiskTrend trend) {
        return switch (trend) {
            case IMPROVING -> "risk is decreasing, indicating stabilization";
            case STABLE    -> "risk is stable, indicating predictable conditions";
            case WORSENING -> "risk is increasing, indicating deteriorating conditions";
        };
    }

    private static String interpretStage(LifecycleStage stage, double riskScore, RiskTrend trend) {
        String level = riskLevel(riskScore);
        return switch (stage) {
            case EMERGING -> "This is an early-stage trend with " + level + " risk. "
                + "Early adoption could provide competitive advantage but requires careful monitoring.";
            case GROWTH   -> "This trend is in growth phase with " + level + " risk and " + trend.value()
                + " trajectory. Strong momentum presents significant opportunity.";
            case PEAK     -> "This trend is at peak adoption with " + level + " risk. "
                + "Market saturation is high, limiting growth potential.";
            case DECLINE  -> "This trend is declining with " + level + " risk. "
                + "Engagement is decreasing, making investment risky.";
            case DORMANT  -> "This trend is dormant with " + level + " risk. "
                + "Minimal engagement makes investment unlikely to succeed.";
        };
    }

    private static String interpretSuccess(String level, double breakEven, RangeValue roi) {
        String lead = switch (level) {
            case "very_high" -> "Excellent";
            case "high"      -> "Strong";
            case "moderate"  -> "Moderate";
            case "low"       -> "Weak";
            default          -> "Very weak";
        };
        String verdict = switch (level) {
            case "very_high" -> "is very attractive";
            case "high"      -> "is favorable";
            case "moderate"  -> "requires careful consideration";
            case "low"       -> "is concerning";
            default          -> "suggests avoiding this scenario";
        };
        return String.format("%s financial outlook with %.0f%% probability of breaking even. "
            + "Expected ROI range of %.0f%% to %.0f%% %s.", lead, breakEven, roi.min(), roi.max(), verdict);
    }

    private static String postureRationale(SimulationResponse response, ScenarioInput scenario) {
        double breakEven = response.expectedRoiMetrics().breakEvenProbability();
        String trend = response.riskProjection().riskTrend().value();
        String stage = scenario.trendContext().stage().value();

        return switch (response.decisionInterpretation().recommendedPosture()) {
            case SCALE      -> String.format("Break-even probability of %.0f%% with %s risk trend supports aggressive "
                + "scaling. %s stage trend has strong growth potential.", breakEven, trend, stage);
            case MONITOR    -> String.format("Break-even probability of %.0f%% with %s risk trend suggests maintaining "
                + "current investment. Monitor for changes in conditions.", breakEven, trend);
            case TEST_SMALL -> String.format("Break-even probability of %.0f%% with %s risk trend requires validation. "
                + "Start with limited budget to test assumptions.", breakEven, trend);
            case AVOID      -> String.format("Break-even probability of %.0f%% with %s risk trend and %s stage trend "
                + "makes this scenario too risky.", breakEven, trend, stage);
        };
    }

    private static List<String> head(List<String> items, int count) {
        return items.subList(0, Math.min(count, items.size()));
    }
}
