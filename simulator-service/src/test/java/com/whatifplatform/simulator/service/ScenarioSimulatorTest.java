package com.whatifplatform.simulator.service;

import com.whatifplatform.common.external.DeclineRiskSnapshot;
import com.whatifplatform.common.external.EarlyDeclineDetection;
import com.whatifplatform.common.external.RoiAttribution;
import com.whatifplatform.common.external.RoiAttributionSnapshot;
import com.whatifplatform.common.external.TrendLifecycleEngine;
import com.whatifplatform.common.external.TrendLifecycleSnapshot;
import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.Baseline;
import com.whatifplatform.common.model.BudgetRange;
import com.whatifplatform.common.model.ConfidenceLevel;
import com.whatifplatform.common.model.ErrorResponse;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RecommendedPosture;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.SimulationOutcome;
import com.whatifplatform.common.model.SimulationResponse;
import com.whatifplatform.common.model.ValidationFailure;
import com.whatifplatform.common.trace.TraceContextUtil;
import com.whatifplatform.simulator.SimulatorFixtures;
import com.whatifplatform.simulator.baseline.BaselineExtractor;
import com.whatifplatform.simulator.logger.SimulationFlowLogger;
import com.whatifplatform.simulator.roi.RoiComputationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioSimulatorTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);
    private static final double EPS = 1e-9;

    private static final RoiAttribution POSITIVE_ROI =
        (engagement, reach, budget, days) -> Mono.just(new RoiAttributionSnapshot(RangeValue.of(20, 80), 75));

    private static ScenarioSimulator simulator(TrendLifecycleEngine trend, EarlyDeclineDetection risk,
                                               RoiAttribution roi) {
        return new ScenarioSimulator(
            new BaselineExtractor(trend, risk, TIMEOUT),
            new RoiComputationService(roi, TIMEOUT),
            new SimulationFlowLogger());
    }

    private static ScenarioSimulator fullData(RoiAttribution roi) {
        return simulator(
            id -> Mono.just(SimulatorFixtures.GROWTH_TREND),
            id -> Mono.just(SimulatorFixtures.GROWTH_RISK),
            roi);
    }

    private static SimulationResponse success(Mono<SimulationOutcome> outcome) {
        SimulationOutcome result = outcome.block();
        assertNotNull(result);
        assertTrue(result.isSuccess(), () -> "expected success but got " + result.error());
        return result.response();
    }

    private static ErrorResponse failure(Mono<SimulationOutcome> outcome) {
        SimulationOutcome result = outcome.block();
        assertNotNull(result);
        assertFalse(result.isSuccess(), "expected a failure outcome");
        return result.error();
    }

    @Nested
    @DisplayName("growth scenario with full upstream data")
    class FullData {

        @Test
        @DisplayName("high intensity pushes projected risk up: test_small, unfavorable")
        void highIntensity_worsening() {
            ScenarioInput scenario = SimulatorFixtures.growth("high");
            SimulationResponse response = success(fullData(POSITIVE_ROI).simulate(scenario, true));

            assertEquals(100.0, response.guardrails().dataCoverage());
            assertEquals(ConfidenceLevel.HIGH, response.simulationSummary().confidence());
            assertEquals(35.0, response.riskProjection().currentRiskScore());
            assertEquals(RangeValue.of(35, 50), response.riskProjection().projectedRiskScore());
            assertEquals(RiskTrend.WORSENING, response.riskProjection().riskTrend());
            assertEquals(100.0, response.expectedRoiMetrics().breakEvenProbability());
            assertEquals(RecommendedPosture.TEST_SMALL, response.decisionInterpretation().recommendedPosture());
            assertEquals(OverallOutlook.UNFAVORABLE, response.simulationSummary().overallOutlook());
            assertEquals("Dance Challenge - short_term_influencer", response.simulationSummary().scenarioLabel());
            assertEquals(69.696, response.expectedGrowthMetrics().engagementGrowthPercent().min(), EPS);
            assertEquals(283.0464, response.expectedGrowthMetrics().engagementGrowthPercent().max(), EPS);
            assertNotNull(response.executiveSummary());
        }

        @Test
        @DisplayName("low intensity keeps risk improving: scale, favorable")
        void lowIntensity_scale() {
            SimulationResponse response = success(fullData(POSITIVE_ROI).simulate(SimulatorFixtures.growth("low"), true));

            assertEquals(100.0, response.guardrails().dataCoverage());
            assertEquals(RiskTrend.IMPROVING, response.riskProjection().riskTrend());
            assertEquals(RecommendedPosture.SCALE, response.decisionInterpretation().recommendedPosture());
            assertEquals(OverallOutlook.FAVORABLE, response.simulationSummary().overallOutlook());
            assertTrue(response.guardrails().systemNote()
                .endsWith("High confidence in baseline data supports these projections."));
        }

        @Test
        @DisplayName("scenario id is assigned on a copy and used as the trace id")
        void scenarioIdAssigned() {
            AtomicReference<String> traceId = new AtomicReference<>();
            RoiAttribution roi = (engagement, reach, budget, days) -> Mono.deferContextual(ctx -> {
                traceId.set(TraceContextUtil.getTraceId(ctx));
                return Mono.just(new RoiAttributionSnapshot(RangeValue.of(20, 80), 75));
            });
            ScenarioInput scenario = SimulatorFixtures.growth("low");

            SimulationResponse response = success(fullData(roi).simulate(scenario, false));

            assertNotNull(response.scenarioId());
            assertFalse(response.scenarioId().isBlank());
            assertNull(scenario.scenarioId(), "caller's scenario must not be modified");
            assertEquals(response.scenarioId(), traceId.get());
            assertNull(response.executiveSummary());
        }

        @Test
        @DisplayName("a caller-supplied scenario id is kept")
        void scenarioIdKept() {
            ScenarioInput scenario = SimulatorFixtures.growth("low").withScenarioId("scn-fixed");
            assertEquals("scn-fixed", success(fullData(POSITIVE_ROI).simulate(scenario, false)).scenarioId());
        }
    }

    @Test
    @DisplayName("no upstream data: coverage 0, confidence low, every range widened by 1.95")
    void degradedData_maximalWidening() {
        ScenarioInput scenario = SimulatorFixtures.scenario("growth", "mixed", 35.0,
            new BudgetRange(5_000, 10_000), 50_000, "medium", Assumptions.unset());
        ScenarioSimulator simulator = simulator(id -> Mono.empty(), id -> Mono.empty(),
            (engagement, reach, budget, days) -> Mono.empty());

        SimulationResponse response = success(simulator.simulate(scenario, true));

        assertEquals(0.0, response.guardrails().dataCoverage());
        assertEquals(ConfidenceLevel.LOW, response.simulationSummary().confidence());
        // creator [7.2, 36.3] and risk [30, 45] widened around their midpoints
        RangeValue creator = response.expectedGrowthMetrics().creatorParticipationChangePercent();
        assertEquals(21.75 - 14.55 * 1.95, creator.min(), EPS);
        assertEquals(21.75 + 14.55 * 1.95, creator.max(), EPS);
        RangeValue risk = response.riskProjection().projectedRiskScore();
        assertEquals(37.5 - 7.5 * 1.95, risk.min(), EPS);
        assertEquals(37.5 + 7.5 * 1.95, risk.max(), EPS);
        assertEquals(0.0, response.expectedGrowthMetrics().engagementGrowthPercent().min(), "re-clamped at 0");

        String note = response.guardrails().systemNote();
        assertTrue(note.contains("Results are based on partial data (0% coverage)."));
        assertTrue(note.contains("Missing data points: engagement_trend, roi_trend, historical_volatility, "
            + "current_risk_score, risk_trajectory"));
        assertTrue(note.contains("Default assumptions applied for: engagement_trend, creator_participation, market_noise"));
    }

    @Test
    @DisplayName("declining trend with losing ROI: avoid")
    void declineScenario_avoid() {
        ScenarioInput scenario = SimulatorFixtures.scenario("decline", "organic_only", 72.0,
            new BudgetRange(10_000, 25_000), 50_000, "high", new Assumptions("optimistic", "increasing", "low"));
        ScenarioSimulator simulator = simulator(
            id -> Mono.just(new TrendLifecycleSnapshot("decline", 8.0, 10.0, 60.0)),
            id -> Mono.just(new DeclineRiskSnapshot(72.0, List.of("engagement_drop"), "increasing")),
            (engagement, reach, budget, days) -> Mono.just(new RoiAttributionSnapshot(RangeValue.of(-40, 5), 60)));

        SimulationResponse response = success(simulator.simulate(scenario, true));

        assertEquals(RangeValue.of(92, 100), response.riskProjection().projectedRiskScore());
        assertEquals(RiskTrend.WORSENING, response.riskProjection().riskTrend());
        assertTrue(response.expectedRoiMetrics().lossProbability() > response.expectedRoiMetrics().breakEvenProbability());
        assertTrue(response.expectedRoiMetrics().lossProbability() > 60);
        assertEquals(RecommendedPosture.AVOID, response.decisionInterpretation().recommendedPosture());
        assertEquals(OverallOutlook.UNFAVORABLE, response.simulationSummary().overallOutlook());
        assertTrue(response.decisionInterpretation().primaryRisks().contains("Trend in late lifecycle stage"));
    }

    @Nested
    @DisplayName("failure outcomes")
    class Failures {

        @Test
        @DisplayName("validation failure skips every upstream call")
        void validationError() {
            AtomicInteger calls = new AtomicInteger();
            ScenarioSimulator simulator = simulator(
                id -> { calls.incrementAndGet(); return Mono.empty(); },
                id -> { calls.incrementAndGet(); return Mono.empty(); },
                (e, r, b, d) -> { calls.incrementAndGet(); return Mono.empty(); });
            ScenarioInput overBudget = SimulatorFixtures.scenario("growth", "mixed", 35.0,
                new BudgetRange(10_000, 60_000), 50_000, "medium", Assumptions.unset());

            ErrorResponse error = failure(simulator.simulate(overBudget, true));

            assertEquals(ErrorResponse.VALIDATION_ERROR, error.errorCode());
            assertEquals(List.of("budget_constraint"),
                error.validationFailures().stream().map(ValidationFailure::field).toList());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("null scenario is a validation failure")
        void nullScenario() {
            ErrorResponse error = failure(fullData(POSITIVE_ROI).simulate(null, true));
            assertEquals(ErrorResponse.VALIDATION_ERROR, error.errorCode());
            assertEquals("scenario", error.validationFailures().get(0).field());
        }

        @Test
        @DisplayName("unusable ROI fallback yields ROI_COMPUTATION_ERROR")
        void roiComputationError() {
            ScenarioInput unbounded = SimulatorFixtures.scenario("growth", "mixed", 35.0,
                new BudgetRange(1_000, Double.POSITIVE_INFINITY), Double.POSITIVE_INFINITY, "medium",
                Assumptions.unset());
            ScenarioSimulator simulator = fullData((e, r, b, d) -> Mono.empty());

            ErrorResponse error = failure(simulator.simulate(unbounded, true));

            assertEquals(ErrorResponse.ROI_COMPUTATION_ERROR, error.errorCode());
            assertEquals("Failed to compute ROI projections", error.errorMessage());
        }

        @Test
        @DisplayName("unexpected pipeline error yields SIMULATION_ERROR")
        void unexpectedError() {
            BaselineExtractor broken = new BaselineExtractor(id -> Mono.empty(), id -> Mono.empty(), TIMEOUT) {
                @Override
                public Mono<Baseline> extractBaseline(ScenarioInput scenario) {
                    return Mono.error(new IllegalStateException("boom"));
                }
            };
            ScenarioSimulator simulator = new ScenarioSimulator(broken,
                new RoiComputationService(POSITIVE_ROI, TIMEOUT), new SimulationFlowLogger());

            ErrorResponse error = failure(simulator.simulate(SimulatorFixtures.growth("low"), true));

            assertEquals(ErrorResponse.SIMULATION_ERROR, error.errorCode());
            assertTrue(error.validationFailures().isEmpty());
        }
    }
}
