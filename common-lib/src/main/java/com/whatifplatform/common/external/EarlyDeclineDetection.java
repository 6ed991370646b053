package com.whatifplatform.common.external;

import reactor.core.publisher.Mono;

/**
 * Query contract for the early-decline detection system.
 */
@FunctionalInterface
public interface EarlyDeclineDetection {

    /**
     * @return the trend's current risk metrics, or an empty Mono when unavailable
     */
    Mono<DeclineRiskSnapshot> query(String trendId);
}
