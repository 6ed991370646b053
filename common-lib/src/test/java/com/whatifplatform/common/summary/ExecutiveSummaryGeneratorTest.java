package com.whatifplatform.common.summary;

import com.whatifplatform.common.TestScenarios;
import com.whatifplatform.common.model.AssumptionFactor;
import com.whatifplatform.common.model.AssumptionSensitivity;
import com.whatifplatform.common.model.ConfidenceLevel;
import com.whatifplatform.common.model.DecisionInterpretation;
import com.whatifplatform.common.model.ExecutiveSummary;
import com.whatifplatform.common.model.ExecutiveSummary.ActionItem;
import com.whatifplatform.common.model.ExecutiveSummary.Priority;
import com.whatifplatform.common.model.ExpectedGrowthMetrics;
import com.whatifplatform.common.model.ExpectedRoiMetrics;
import com.whatifplatform.common.model.Guardrails;
import com.whatifplatform.common.model.ImpactLevel;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RecommendedPosture;
import com.whatifplatform.common.model.RiskProjection;
import com.whatifplatform.common.model.RiskTolerance;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.SimulationResponse;
import com.whatifplatform.common.model.SimulationSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutiveSummaryGeneratorTest {

    private static final ScenarioInput SCENARIO = TestScenarios.growth().intensity("low").build();

    private static SimulationResponse response(RecommendedPosture posture, double coverage) {
        return new SimulationResponse("scn-1", "trend-123", "Dance Challenge",
            new SimulationSummary("Dance Challenge - short_term_influencer", OverallOutlook.FAVORABLE,
                ConfidenceLevel.HIGH),
            new ExpectedGrowthMetrics(RangeValue.of(60, 120), RangeValue.of(30, 90), RangeValue.of(10, 40)),
            new ExpectedRoiMetrics(RangeValue.of(20, 80), 100, 0),
            new RiskProjection(35, RangeValue.of(25, 40), RiskTrend.IMPROVING),
            new DecisionInterpretation(posture,
                List.of("High engagement growth potential", "Momentum in growth phase"),
                List.of("Baseline execution risk")),
            new AssumptionSensitivity(AssumptionFactor.MARKET_NOISE, ImpactLevel.HIGH),
            new Guardrails(coverage, "note"),
            null);
    }

    @Nested
    @DisplayName("generate()")
    class Generate {

        private final ExecutiveSummary summary =
            ExecutiveSummaryGenerator.generate(response(RecommendedPosture.SCALE, 100), SCENARIO);

        @Test
        @DisplayName("success probability and financial outlook")
        void financials() {
            assertEquals("very_high", summary.successProbability().successLevel());
            assertEquals(50.0, summary.successProbability().roiMidpoint());
            assertEquals("positive", summary.financialOutlook().outlook());
            assertEquals(80.0, summary.financialOutlook().bestCaseRoi());
            assertEquals(20.0, summary.financialOutlook().worstCaseRoi());
        }

        @Test
        @DisplayName("trend analysis and risk assessment")
        void risk() {
            assertEquals("moderate", summary.trendAnalysis().riskLevel());
            assertTrue(summary.trendAnalysis().interpretation().startsWith("This trend is in growth phase"));
            assertEquals(5.0, summary.riskAssessment().riskChange());
            assertEquals("aligned - projected risk within tolerance", summary.riskAssessment().toleranceAlignment());
            assertTrue(summary.riskAssessment().interpretation().startsWith("Risk is improving from 35 to 40."));
        }

        @Test
        @DisplayName("key drivers summarize the first two call-outs of each kind")
        void keyDrivers() {
            assertEquals("Key opportunities include High engagement growth potential, Momentum in growth phase. "
                + "Main risks are Baseline execution risk. "
                + "Success depends on capitalizing on opportunities while mitigating risks.",
                summary.keyDrivers().interpretation());
            assertEquals(AssumptionFactor.MARKET_NOISE, summary.keyDrivers().mostSensitiveAssumption());
        }

        @Test
        @DisplayName("scale posture with a high-impact assumption yields three high-priority actions")
        void actionItems() {
            List<ActionItem> actions = summary.actionItems();
            assertEquals(3, actions.size());
            assertTrue(actions.stream().allMatch(a -> a.priority() == Priority.HIGH));
            assertEquals("Validate market_noise assumption with market research", actions.get(2).action());
            assertEquals("Aggressively scale investment - conditions are favorable",
                summary.strategicRecommendation().postureDescription());
        }

        @Test
        @DisplayName("critical assumptions read the defaulted scenario")
        void criticalAssumptions() {
            assertEquals("Excellent - high confidence in data", summary.criticalAssumptions().dataQualityNote());
            assertEquals("optimistic", summary.criticalAssumptions().engagementTrend().value());
        }
    }

    @Test
    @DisplayName("low coverage adds a data-collection action")
    void lowCoverage_addsAction() {
        ExecutiveSummary summary =
            ExecutiveSummaryGenerator.generate(response(RecommendedPosture.AVOID, 40), SCENARIO);

        ActionItem last = summary.actionItems().get(summary.actionItems().size() - 1);
        assertEquals(Priority.MEDIUM, last.priority());
        assertEquals("Collect additional data to improve confidence", last.action());
        assertEquals("Current data coverage is 40%", last.rationale());
        assertEquals("Poor - significant data gaps, use with caution",
            summary.criticalAssumptions().dataQualityNote());
    }

    @Test
    @DisplayName("classification bands")
    void bands() {
        assertEquals("low", ExecutiveSummaryGenerator.riskLevel(24.9));
        assertEquals("critical", ExecutiveSummaryGenerator.riskLevel(75));
        assertEquals("very_low", ExecutiveSummaryGenerator.successLevel(19));
        assertEquals("moderate", ExecutiveSummaryGenerator.successLevel(40));
        assertEquals("misaligned - projected risk exceeds tolerance",
            ExecutiveSummaryGenerator.toleranceAlignment(RiskTolerance.LOW, 61));
    }

    @Test
    @DisplayName("formatter renders every section")
    void formatter() {
        ExecutiveSummary summary =
            ExecutiveSummaryGenerator.generate(response(RecommendedPosture.SCALE, 100), SCENARIO);

        String text = ExecutiveSummaryFormatter.format(summary);

        assertTrue(text.startsWith("\n" + "=".repeat(80) + "\nEXECUTIVE SUMMARY - TREND ADOPTION ANALYSIS"));
        for (String section : List.of("[TREND ANALYSIS]", "[SUCCESS PROBABILITY]", "[FINANCIAL OUTLOOK]",
                "[RISK ASSESSMENT]", "[STRATEGIC RECOMMENDATION]", "[KEY DRIVERS]", "[CRITICAL ASSUMPTIONS]",
                "[ACTION ITEMS]")) {
            assertTrue(text.contains(section), section);
        }
        assertTrue(text.contains("Lifecycle Stage: GROWTH"));
        assertTrue(text.contains("Break-Even Probability: 100%"));
        assertTrue(text.contains("Most Sensitive Factor: market_noise (HIGH impact)"));
        assertTrue(text.contains("[HIGH] Increase budget allocation and expand creator network"));
        assertTrue(text.contains("  + Momentum in growth phase"));
    }
}
