package com.whatifplatform.simulator.client;

import com.whatifplatform.common.external.DeclineRiskSnapshot;
import com.whatifplatform.common.external.EarlyDeclineDetection;
import com.whatifplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Reads decline-risk metrics from the early-decline detection service. 404 completes empty.
 */
public class WebClientEarlyDeclineDetection implements EarlyDeclineDetection {

    private static final Logger log = LoggerFactory.getLogger(WebClientEarlyDeclineDetection.class);

    private final WebClient earlyDeclineClient;

    public WebClientEarlyDeclineDetection(WebClient earlyDeclineClient) {
        this.earlyDeclineClient = earlyDeclineClient;
    }

    @Override
    public Mono<DeclineRiskSnapshot> query(String trendId) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return earlyDeclineClient.get()
                .uri("/api/v1/trends/{trendId}/decline-risk", trendId)
                .header(TraceContextUtil.TRACE_HEADER, traceId)
                .retrieve()
                .bodyToMono(DeclineRiskSnapshot.class)
                .doOnNext(s -> log.debug("Decline risk fetched. trendId={} riskScore={} trajectory={} traceId={}",
                    trendId, s.currentRiskScore(), s.riskTrajectory(), traceId))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
        });
    }
}
