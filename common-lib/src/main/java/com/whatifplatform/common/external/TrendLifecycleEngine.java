package com.whatifplatform.common.external;

import reactor.core.publisher.Mono;

/**
 * Query contract for the trend-lifecycle engine.
 */
@FunctionalInterface
public interface TrendLifecycleEngine {

    /**
     * @return the trend's metrics, or an empty Mono when the engine has no data for it.
     *         Implementations may also signal an error; callers treat both as unavailable.
     */
    Mono<TrendLifecycleSnapshot> query(String trendId);
}
