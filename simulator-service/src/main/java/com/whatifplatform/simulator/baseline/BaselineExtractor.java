package com.whatifplatform.simulator.baseline;

import com.whatifplatform.common.baseline.BaselineAssembler;
import com.whatifplatform.common.external.EarlyDeclineDetection;
import com.whatifplatform.common.external.TrendLifecycleEngine;
import com.whatifplatform.common.model.Baseline;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Queries the trend-lifecycle and early-decline systems concurrently and folds the answers
 * into a {@link Baseline}.
 *
 * <p>Each query runs under its own timeout. An error, a timeout or an empty answer all mean
 * "unavailable": the failure is logged at WARN and the corresponding fields are marked
 * missing. The returned Mono never signals an error.
 */
public class BaselineExtractor {

    private static final Logger log = LoggerFactory.getLogger(BaselineExtractor.class);

    private final TrendLifecycleEngine trendLifecycleEngine;
    private final EarlyDeclineDetection earlyDeclineDetection;
    private final Duration timeout;

    public BaselineExtractor(TrendLifecycleEngine trendLifecycleEngine,
                             EarlyDeclineDetection earlyDeclineDetection,
                             Duration timeout) {
        this.trendLifecycleEngine  = trendLifecycleEngine;
        this.earlyDeclineDetection = earlyDeclineDetection;
        this.timeout               = timeout;
    }

    public Mono<Baseline> extractBaseline(ScenarioInput scenario) {
        String trendId = scenario.trendContext().trendId();
        double scenarioRisk = scenario.trendContext().currentRiskScore();

        return Mono.zip(
                optional("trend-lifecycle", trendId, () -> trendLifecycleEngine.query(trendId)),
                optional("early-decline", trendId, () -> earlyDeclineDetection.query(trendId)))
            .map(t -> BaselineAssembler.assemble(scenarioRisk, t.getT1(), t.getT2()))
            .doOnEach(signal -> {
                if (!signal.isOnNext()) return;
                Baseline baseline = signal.get();
                String traceId = TraceContextUtil.getTraceId(signal.getContextView());
                TraceContextUtil.withMdc(traceId, () -> {
                    if (baseline.isComplete()) {
                        log.info("[BaselineExtractor] trendId={} dataCoverage={} traceId={}",
                            trendId, baseline.dataCoverage(), traceId);
                    } else {
                        log.warn("[BaselineExtractor] Baseline incomplete. trendId={} dataCoverage={} missing={} traceId={}",
                            trendId, baseline.dataCoverage(), baseline.missingDataPoints(), traceId);
                    }
                });
            });
    }

    private <T> Mono<Optional<T>> optional(String system, String trendId, Supplier<Mono<T>> query) {
        return Mono.defer(query)
            .timeout(timeout)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .doOnNext(result -> {
                if (result.isEmpty()) {
                    log.warn("[BaselineExtractor] {} returned no data (non-critical). trendId={}", system, trendId);
                }
            })
            .onErrorResume(e -> {
                log.warn("[BaselineExtractor] {} query failed (non-critical), treating as unavailable. "
                         + "trendId={} reason={}", system, trendId, e.toString());
                return Mono.just(Optional.empty());
            });
    }
}
