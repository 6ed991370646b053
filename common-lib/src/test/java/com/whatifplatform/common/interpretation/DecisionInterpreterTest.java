package com.whatifplatform.common.interpretation;

import com.whatifplatform.common.TestScenarios;
import com.whatifplatform.common.model.DecisionInterpretation;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RecommendedPosture;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.range.ProjectedRanges;
import com.whatifplatform.common.range.RangeComputation;
import com.whatifplatform.common.roi.RoiProbabilities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionInterpreterTest {

    @Nested
    @DisplayName("recommendedPosture()")
    class Posture {

        private RecommendedPosture posture(double breakEven, double loss, RiskTrend trend, LifecycleStage stage) {
            return DecisionInterpreter.recommendedPosture(breakEven, loss, trend, stage);
        }

        @Test
        @DisplayName("late stage with loss over 60 is avoid, whatever else holds")
        void avoid() {
            assertEquals(RecommendedPosture.AVOID, posture(90, 61, RiskTrend.IMPROVING, LifecycleStage.DECLINE));
            assertEquals(RecommendedPosture.AVOID, posture(10, 90, RiskTrend.WORSENING, LifecycleStage.DORMANT));
        }

        @Test
        @DisplayName("loss of exactly 60 in a late stage is not avoid")
        void avoidThresholdIsStrict() {
            assertEquals(RecommendedPosture.MONITOR, posture(40, 60, RiskTrend.STABLE, LifecycleStage.DECLINE));
        }

        @Test
        @DisplayName("break-even >= 70 with stable or improving risk is scale")
        void scale() {
            assertEquals(RecommendedPosture.SCALE, posture(70, 30, RiskTrend.STABLE, LifecycleStage.GROWTH));
            assertEquals(RecommendedPosture.SCALE, posture(95, 5, RiskTrend.IMPROVING, LifecycleStage.PEAK));
        }

        @Test
        @DisplayName("break-even 40..70 with stable risk is monitor")
        void monitor() {
            assertEquals(RecommendedPosture.MONITOR, posture(50, 50, RiskTrend.STABLE, LifecycleStage.GROWTH));
        }

        @Test
        @DisplayName("low break-even or worsening risk is test_small")
        void testSmall() {
            assertEquals(RecommendedPosture.TEST_SMALL, posture(30, 70, RiskTrend.STABLE, LifecycleStage.GROWTH));
            assertEquals(RecommendedPosture.TEST_SMALL, posture(100, 0, RiskTrend.WORSENING, LifecycleStage.GROWTH));
        }

        @Test
        @DisplayName("moderate break-even with improving risk falls through to monitor")
        void fallthrough() {
            assertEquals(RecommendedPosture.MONITOR, posture(55, 45, RiskTrend.IMPROVING, LifecycleStage.GROWTH));
        }
    }

    @Nested
    @DisplayName("overallOutlook()")
    class Outlook {

        @Test
        @DisplayName("favorable, unfavorable, risky")
        void outlooks() {
            assertEquals(OverallOutlook.FAVORABLE, DecisionInterpreter.overallOutlook(70, 30, RiskTrend.STABLE));
            assertEquals(OverallOutlook.UNFAVORABLE, DecisionInterpreter.overallOutlook(80, 20, RiskTrend.WORSENING));
            assertEquals(OverallOutlook.UNFAVORABLE, DecisionInterpreter.overallOutlook(35, 65, RiskTrend.STABLE));
            assertEquals(OverallOutlook.RISKY, DecisionInterpreter.overallOutlook(50, 50, RiskTrend.IMPROVING));
        }
    }

    @Nested
    @DisplayName("call-outs")
    class CallOuts {

        @Test
        @DisplayName("reference scenario opportunities and risks, in rule order")
        void referenceScenario() {
            ScenarioInput scenario = TestScenarios.reference();
            ProjectedRanges ranges = RangeComputation.computeAll(60.0, 35.0, scenario);

            DecisionInterpretation interpretation = DecisionInterpreter.interpret(
                ranges, new RoiProbabilities(100, 0), RiskTrend.WORSENING, scenario);

            assertEquals(RecommendedPosture.TEST_SMALL, interpretation.recommendedPosture());
            assertEquals(List.of(
                "High engagement growth potential",
                "Significant audience expansion opportunity",
                "Strong creator participation growth potential",
                "Momentum in growth phase",
                "High-reach creator network available"), interpretation.primaryOpportunities());
            assertEquals(List.of("Risk trajectory deteriorating"), interpretation.primaryRisks());
        }

        @Test
        @DisplayName("late-stage, long, small-creator campaign collects every risk")
        void lateStageRisks() {
            ScenarioInput scenario = TestScenarios.growth()
                .stage("decline").campaignType("organic_only").riskScore(80).creatorTier("nano").duration(200)
                .build();
            ProjectedRanges ranges = new ProjectedRanges(
                RangeValue.of(2, 10), RangeValue.of(1, 8), RangeValue.of(0, 5), RangeValue.of(90, 100));

            List<String> risks = DecisionInterpreter.risks(ranges, 85, RiskTrend.WORSENING, scenario);

            assertEquals(List.of(
                "Limited engagement growth potential",
                "Constrained audience expansion",
                "High probability of financial loss",
                "Risk trajectory deteriorating",
                "Trend in late lifecycle stage",
                "High trend volatility",
                "Limited creator reach capacity",
                "Extended campaign duration increases uncertainty"), risks);
        }

        @Test
        @DisplayName("empty rule matches fall back to baseline texts")
        void fallbacks() {
            ScenarioInput scenario = TestScenarios.growth()
                .stage("peak").campaignType("organic_only").riskScore(50).creatorTier("mixed").build();

            ProjectedRanges quiet = new ProjectedRanges(
                RangeValue.of(0, 10), RangeValue.of(0, 10), RangeValue.of(0, 10), RangeValue.of(40, 50));
            assertEquals(List.of("Baseline growth opportunity"), DecisionInterpreter.opportunities(quiet, scenario));

            ProjectedRanges healthy = new ProjectedRanges(
                RangeValue.of(30, 60), RangeValue.of(20, 50), RangeValue.of(5, 25), RangeValue.of(40, 50));
            assertEquals(List.of("Baseline execution risk"),
                DecisionInterpreter.risks(healthy, 10, RiskTrend.STABLE, scenario));
        }
    }
}
