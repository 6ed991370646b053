package com.whatifplatform.simulator.client;

import com.whatifplatform.common.external.RoiAttribution;
import com.whatifplatform.common.external.RoiAttributionSnapshot;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Requests an ROI projection from the ROI-attribution service. 404 completes empty.
 */
public class WebClientRoiAttribution implements RoiAttribution {

    private static final Logger log = LoggerFactory.getLogger(WebClientRoiAttribution.class);

    private final WebClient roiAttributionClient;

    public WebClientRoiAttribution(WebClient roiAttributionClient) {
        this.roiAttributionClient = roiAttributionClient;
    }

    @Override
    public Mono<RoiAttributionSnapshot> query(RangeValue engagementGrowth, RangeValue reachGrowth,
                                              double campaignBudget, int durationDays) {
        RoiProjectionRequest request =
            new RoiProjectionRequest(engagementGrowth, reachGrowth, campaignBudget, durationDays);

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return roiAttributionClient.post()
                .uri("/api/v1/roi/projection")
                .header(TraceContextUtil.TRACE_HEADER, traceId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(RoiAttributionSnapshot.class)
                .doOnNext(s -> log.debug("ROI projection fetched. confidence={} traceId={}",
                    s.confidence(), traceId))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
        });
    }
}
