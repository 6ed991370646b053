package com.whatifplatform.common.baseline;

import com.whatifplatform.common.external.DeclineRiskSnapshot;
import com.whatifplatform.common.external.TrendLifecycleSnapshot;
import com.whatifplatform.common.model.Baseline;
import com.whatifplatform.common.model.RiskTrajectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BaselineAssemblerTest {

    private static final TrendLifecycleSnapshot TREND =
        new TrendLifecycleSnapshot("growth", 60.0, 45.0, 20.0);
    private static final DeclineRiskSnapshot RISK =
        new DeclineRiskSnapshot(30.0, List.of("saturation"), "stable");

    @Test
    @DisplayName("both systems available: full coverage, every field sourced upstream")
    void fullData() {
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(TREND), Optional.of(RISK));

        assertEquals(100.0, baseline.dataCoverage());
        assertTrue(baseline.isComplete());
        assertEquals(60.0, baseline.engagementTrend());
        assertEquals(45.0, baseline.roiTrend());
        assertEquals(20.0, baseline.historicalVolatility());
        assertEquals(30.0, baseline.currentRiskScore(), "upstream risk wins over the scenario's");
        assertEquals(RiskTrajectory.STABLE, baseline.riskTrajectory());
        assertEquals(Map.of(
            "engagement_trend", "trend_lifecycle_engine",
            "roi_trend", "trend_lifecycle_engine",
            "historical_volatility", "trend_lifecycle_engine",
            "current_risk_score", "early_decline_detection",
            "risk_trajectory", "early_decline_detection"), baseline.sources());
    }

    @Test
    @DisplayName("neither system available: zero coverage, scenario risk kept")
    void noData() {
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.empty(), Optional.empty());

        assertEquals(0.0, baseline.dataCoverage());
        assertEquals(List.of("engagement_trend", "roi_trend", "historical_volatility",
            "current_risk_score", "risk_trajectory"), baseline.missingDataPoints());
        assertNull(baseline.engagementTrend());
        assertNull(baseline.riskTrajectory());
        assertEquals(35.0, baseline.currentRiskScore());
        assertEquals(Map.of("current_risk_score", "scenario_input"), baseline.sources());
        assertEquals(Baseline.NEUTRAL_ENGAGEMENT, baseline.engagementSeed());
    }

    @Test
    @DisplayName("trend data only: 60% coverage")
    void trendOnly() {
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(TREND), Optional.empty());

        assertEquals(60.0, baseline.dataCoverage(), 1e-9);
        assertEquals(List.of("current_risk_score", "risk_trajectory"), baseline.missingDataPoints());
        assertEquals(60.0, baseline.engagementSeed());
    }

    @Test
    @DisplayName("unknown trajectory marks only that field missing")
    void unknownTrajectory() {
        DeclineRiskSnapshot risk = new DeclineRiskSnapshot(30.0, null, "sideways");
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(TREND), Optional.of(risk));

        assertEquals(80.0, baseline.dataCoverage(), 1e-9);
        assertEquals(List.of("risk_trajectory"), baseline.missingDataPoints());
        assertEquals(30.0, baseline.currentRiskScore());
    }

    @Test
    @DisplayName("non-finite engagement is missing and the seed falls back to neutral")
    void nonFiniteMetric() {
        TrendLifecycleSnapshot trend = new TrendLifecycleSnapshot("growth", Double.NaN, 45.0, 20.0);
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(trend), Optional.of(RISK));

        assertEquals(List.of("engagement_trend"), baseline.missingDataPoints());
        assertEquals(50.0, baseline.engagementSeed());
        assertFalse(baseline.sources().containsKey("engagement_trend"));
    }

    @Test
    @DisplayName("null metrics are missing rather than zero")
    void nullMetrics() {
        TrendLifecycleSnapshot trend = new TrendLifecycleSnapshot("growth", null, null, 30.0);
        DeclineRiskSnapshot risk = new DeclineRiskSnapshot(null, List.of(), "stable");
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(trend), Optional.of(risk));

        assertEquals(List.of("engagement_trend", "roi_trend", "current_risk_score"), baseline.missingDataPoints());
        assertEquals(40.0, baseline.dataCoverage(), 1e-9);
        assertNull(baseline.engagementTrend());
        assertEquals(50.0, baseline.engagementSeed());
        assertEquals(35.0, baseline.currentRiskScore());
        assertEquals("scenario_input", baseline.sources().get("current_risk_score"));
    }

    @Test
    @DisplayName("out-of-range metrics are clamped into [0, 100]")
    void clamping() {
        TrendLifecycleSnapshot trend = new TrendLifecycleSnapshot("peak", 150.0, -5.0, 20.0);
        DeclineRiskSnapshot risk = new DeclineRiskSnapshot(120.0, List.of(), "increasing");
        Baseline baseline = BaselineAssembler.assemble(35.0, Optional.of(trend), Optional.of(risk));

        assertEquals(100.0, baseline.engagementTrend());
        assertEquals(0.0, baseline.roiTrend());
        assertEquals(100.0, baseline.currentRiskScore());
        assertEquals(RiskTrajectory.INCREASING, baseline.riskTrajectory());
    }

    @Test
    @DisplayName("coverage is the share of five tracked fields")
    void coverage() {
        assertEquals(100.0, BaselineAssembler.coverage(0));
        assertEquals(40.0, BaselineAssembler.coverage(3), 1e-9);
        assertEquals(0.0, BaselineAssembler.coverage(5));
    }
}
