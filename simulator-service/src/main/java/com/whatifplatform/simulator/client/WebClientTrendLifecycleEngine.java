package com.whatifplatform.simulator.client;

import com.whatifplatform.common.external.TrendLifecycleEngine;
import com.whatifplatform.common.external.TrendLifecycleSnapshot;
import com.whatifplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Reads trend metrics from the trend-lifecycle service.
 *
 * <p>A 404 means the engine has no data for the trend and completes empty. Every other
 * failure is propagated; the baseline extractor decides how to degrade.
 */
public class WebClientTrendLifecycleEngine implements TrendLifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(WebClientTrendLifecycleEngine.class);

    private final WebClient trendLifecycleClient;

    public WebClientTrendLifecycleEngine(WebClient trendLifecycleClient) {
        this.trendLifecycleClient = trendLifecycleClient;
    }

    @Override
    public Mono<TrendLifecycleSnapshot> query(String trendId) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return trendLifecycleClient.get()
                .uri("/api/v1/trends/{trendId}/lifecycle", trendId)
                .header(TraceContextUtil.TRACE_HEADER, traceId)
                .retrieve()
                .bodyToMono(TrendLifecycleSnapshot.class)
                .doOnNext(s -> log.debug("Trend lifecycle fetched. trendId={} stage={} traceId={}",
                    trendId, s.lifecycleStage(), traceId))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
        });
    }
}
