package com.whatifplatform.common.summary;

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
import com.whatifplatform.common.model.WireEnum;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an {@link ExecutiveSummary} as a plain-text report.
 */
public final class ExecutiveSummaryFormatter {

    static final String RULE     = "=".repeat(80);
    static final String SUB_RULE = "-".repeat(80);

    private ExecutiveSummaryFormatter() {}

    public static String format(ExecutiveSummary summary) {
        List<String> lines = new ArrayList<>();
        lines.add("\n" + RULE);
        lines.add("EXECUTIVE SUMMARY - TREND ADOPTION ANALYSIS");
        lines.add(RULE);

        TrendAnalysis ta = summary.trendAnalysis();
        section(lines, "TREND ANALYSIS");
        lines.add("Lifecycle Stage: " + upper(ta.stage()));
        lines.add("Stage Description: " + ta.stageDescription());
        lines.add(String.format("Current Risk Score: %.0f/100 (%s)", ta.currentRiskScore(), ta.riskLevel().toUpperCase()));
        lines.add("Risk Trend: " + upper(ta.riskTrend()));
        lines.add("Analysis: " + ta.interpretation());

        SuccessProbability sp = summary.successProbability();
        section(lines, "SUCCESS PROBABILITY");
        lines.add(String.format("Break-Even Probability: %.0f%%", sp.breakEvenProbability()));
        lines.add("Success Level: " + sp.successLevel().toUpperCase());
        lines.add(String.format("Expected ROI: %.0f%% (Range: %.0f%% to %.0f%%)",
            sp.roiMidpoint(), sp.roiRange().min(), sp.roiRange().max()));
        lines.add("Analysis: " + sp.interpretation());

        FinancialOutlook fo = summary.financialOutlook();
        section(lines, "FINANCIAL OUTLOOK");
        lines.add("Outlook: " + fo.outlook().toUpperCase());
        lines.add(String.format("Best Case ROI: %.0f%%", fo.bestCaseRoi()));
        lines.add(String.format("Worst Case ROI: %.0f%%", fo.worstCaseRoi()));
        lines.add(String.format("Expected ROI: %.0f%%", fo.expectedRoi()));
        lines.add("Analysis: " + fo.interpretation());

        RiskAssessment ra = summary.riskAssessment();
        section(lines, "RISK ASSESSMENT");
        lines.add(String.format("Current Risk: %.0f/100 (%s)", ra.currentRiskScore(), ra.currentRiskLevel().toUpperCase()));
        lines.add(String.format("Projected Risk: %.0f to %.0f",
            ra.projectedRiskRange().min(), ra.projectedRiskRange().max()));
        lines.add("Risk Trend: " + upper(ra.riskTrend()));
        lines.add("Risk Tolerance: " + upper(ra.riskTolerance()));
        lines.add("Alignment: " + ra.toleranceAlignment().toUpperCase());
        lines.add("Analysis: " + ra.interpretation());

        StrategicRecommendation sr = summary.strategicRecommendation();
        section(lines, "STRATEGIC RECOMMENDATION");
        lines.add("Recommended Posture: " + upper(sr.recommendedPosture()));
        lines.add("Description: " + sr.postureDescription());
        lines.add("Overall Outlook: " + upper(sr.overallOutlook()));
        lines.add("Confidence: " + upper(sr.confidence()));
        lines.add("Rationale: " + sr.rationale());

        KeyDrivers kd = summary.keyDrivers();
        section(lines, "KEY DRIVERS");
        lines.add(String.format("Engagement Growth: %.0f%% to %.0f%%",
            kd.engagementGrowthRange().min(), kd.engagementGrowthRange().max()));
        lines.add(String.format("Reach Growth: %.0f%% to %.0f%%",
            kd.reachGrowthRange().min(), kd.reachGrowthRange().max()));
        lines.add("Primary Opportunities:");
        kd.primaryOpportunities().stream().limit(3).forEach(o -> lines.add("  + " + o));
        lines.add("Primary Risks:");
        kd.primaryRisks().stream().limit(3).forEach(r -> lines.add("  - " + r));
        lines.add("Most Sensitive Factor: " + kd.mostSensitiveAssumption().value()
            + " (" + upper(kd.sensitivityImpact()) + " impact)");

        CriticalAssumptions ca = summary.criticalAssumptions();
        section(lines, "CRITICAL ASSUMPTIONS");
        lines.add("Engagement Trend: " + upper(ca.engagementTrend()));
        lines.add("Creator Participation: " + upper(ca.creatorParticipation()));
        lines.add("Market Noise: " + upper(ca.marketNoise()));
        lines.add(String.format("Data Coverage: %.0f%%", ca.dataCoverage()));
        lines.add("Data Quality: " + ca.dataQualityNote());
        lines.add("Analysis: " + ca.interpretation());

        section(lines, "ACTION ITEMS");
        for (ActionItem action : summary.actionItems()) {
            lines.add((action.priority() == Priority.HIGH ? "[HIGH] " : "[MED] ") + action.action());
            lines.add("   Rationale: " + action.rationale());
        }

        lines.add("\n" + RULE);
        return String.join("\n", lines);
    }

    private static void section(List<String> lines, String title) {
        lines.add("\n[" + title + "]");
        lines.add(SUB_RULE);
    }

    private static String upper(WireEnum value) {
        return value.value().toUpperCase();
    }
}
