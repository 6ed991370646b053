package com.whatifplatform.simulator.roi;

import com.whatifplatform.common.external.RoiAttribution;
import com.whatifplatform.common.external.RoiAttributionSnapshot;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.roi.RoiCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Produces the ROI range for a scenario.
 *
 * <p>Asks the ROI-attribution system first. An empty answer, an error or a timeout falls
 * back to {@link RoiCalculator#fallbackRoiRange}. Only a failing fallback reaches the
 * caller, as a {@link com.whatifplatform.common.exception.RoiComputationException}.
 */
public class RoiComputationService {

    private static final Logger log = LoggerFactory.getLogger(RoiComputationService.class);

    private final RoiAttribution roiAttribution;
    private final Duration timeout;

    public RoiComputationService(RoiAttribution roiAttribution, Duration timeout) {
        this.roiAttribution = roiAttribution;
        this.timeout        = timeout;
    }

    public Mono<RangeValue> computeRoiRange(RangeValue engagementGrowth, RangeValue reachGrowth,
                                            ScenarioInput scenario) {
        double budget = scenario.campaignStrategy().budget();
        int duration = scenario.campaignStrategy().campaignDurationDays();

        return Mono.defer(() -> roiAttribution.query(engagementGrowth, reachGrowth, budget, duration))
            .timeout(timeout)
            .filter(snapshot -> snapshot.roiPercentRange() != null)
            .map(RoiAttributionSnapshot::roiPercentRange)
            .doOnNext(roi -> log.info("[RoiComputation] Attribution ROI range min={} max={}", roi.min(), roi.max()))
            .onErrorResume(e -> {
                log.warn("[RoiComputation] ROI attribution failed (non-critical), using fallback. reason={}",
                         e.toString());
                return Mono.empty();
            })
            .switchIfEmpty(Mono.fromCallable(() -> {
                RangeValue roi = RoiCalculator.fallbackRoiRange(engagementGrowth, reachGrowth, budget);
                log.warn("[RoiComputation] ROI attribution unavailable, fallback ROI range min={} max={}",
                         roi.min(), roi.max());
                return roi;
            }));
    }
}
