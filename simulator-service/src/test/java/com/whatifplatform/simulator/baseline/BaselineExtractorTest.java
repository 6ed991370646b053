package com.whatifplatform.simulator.baseline;

import com.whatifplatform.common.external.DeclineRiskSnapshot;
import com.whatifplatform.common.external.EarlyDeclineDetection;
import com.whatifplatform.common.external.TrendLifecycleEngine;
import com.whatifplatform.common.external.TrendLifecycleSnapshot;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.trace.TraceContextUtil;
import com.whatifplatform.simulator.SimulatorFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BaselineExtractorTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);
    private static final ScenarioInput SCENARIO = SimulatorFixtures.growth("high");

    private static BaselineExtractor extractor(TrendLifecycleEngine trend, EarlyDeclineDetection risk) {
        return new BaselineExtractor(trend, risk, TIMEOUT);
    }

    @Test
    @DisplayName("both systems answer: coverage 100")
    void fullData() {
        BaselineExtractor extractor = extractor(
            id -> Mono.just(SimulatorFixtures.GROWTH_TREND),
            id -> Mono.just(SimulatorFixtures.GROWTH_RISK));

        StepVerifier.create(extractor.extractBaseline(SCENARIO))
            .assertNext(baseline -> {
                assertEquals(100.0, baseline.dataCoverage());
                assertEquals(60.0, baseline.engagementSeed());
                assertEquals(35.0, baseline.currentRiskScore());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("both systems empty: coverage 0, scenario risk kept")
    void emptyAnswers() {
        BaselineExtractor extractor = extractor(id -> Mono.empty(), id -> Mono.empty());

        StepVerifier.create(extractor.extractBaseline(SCENARIO))
            .assertNext(baseline -> {
                assertEquals(0.0, baseline.dataCoverage());
                assertEquals(35.0, baseline.currentRiskScore());
                assertEquals("scenario_input", baseline.sources().get("current_risk_score"));
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("errors are absorbed as missing data")
    void errors_absorbed() {
        BaselineExtractor extractor = extractor(
            id -> Mono.error(new IllegalStateException("engine down")),
            id -> { throw new IllegalStateException("thrown before subscription"); });

        StepVerifier.create(extractor.extractBaseline(SCENARIO))
            .assertNext(baseline -> assertEquals(0.0, baseline.dataCoverage()))
            .verifyComplete();
    }

    @Test
    @DisplayName("a hanging system times out and only its fields go missing")
    void timeout_absorbed() {
        BaselineExtractor extractor = extractor(
            id -> Mono.just(SimulatorFixtures.GROWTH_TREND),
            id -> Mono.never());

        StepVerifier.create(extractor.extractBaseline(SCENARIO))
            .assertNext(baseline -> {
                assertEquals(60.0, baseline.dataCoverage(), 1e-9);
                assertEquals(List.of("current_risk_score", "risk_trajectory"), baseline.missingDataPoints());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("queries run with the trend id and see the trace id in the Reactor Context")
    void traceIdPropagated() {
        AtomicReference<String> seenTrendId = new AtomicReference<>();
        AtomicReference<String> seenTraceId = new AtomicReference<>();
        TrendLifecycleEngine trend = id -> Mono.deferContextual(ctx -> {
            seenTrendId.set(id);
            seenTraceId.set(TraceContextUtil.getTraceId(ctx));
            return Mono.just(new TrendLifecycleSnapshot("growth", 40.0, 40.0, 10.0));
        });
        EarlyDeclineDetection risk = id -> Mono.just(new DeclineRiskSnapshot(20.0, List.of(), "decreasing"));

        StepVerifier.create(TraceContextUtil.withTraceId(extractor(trend, risk).extractBaseline(SCENARIO), "scn-42"))
            .assertNext(baseline -> assertEquals(100.0, baseline.dataCoverage()))
            .verifyComplete();

        assertEquals("trend-123", seenTrendId.get());
        assertEquals("scn-42", seenTraceId.get());
    }
}
