package com.whatifplatform.simulator.logger;

import com.whatifplatform.common.model.SimulationOutcome;
import com.whatifplatform.common.model.SimulationResponse;
import com.whatifplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a simulation as it moves through the reactive pipeline.
 * Side-effects only; never alters the pipeline.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #SIMULATION_RECEIVED}   scenario accepted, id assigned</li>
 *   <li>{@link #SCENARIO_VALIDATED}    validation passed, defaults applied</li>
 *   <li>{@link #BASELINE_EXTRACTED}    upstream metrics folded into a baseline</li>
 *   <li>{@link #ROI_COMPUTED}          ROI range available (attribution or fallback)</li>
 *   <li>{@link #RESPONSE_ASSEMBLED}    interpretation, guardrails and summary attached</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads the trace id from Reactor Context):
 * <pre>
 *     .doOnEach(simulationFlowLogger.stage(SimulationFlowLogger.BASELINE_EXTRACTED))
 * </pre>
 */
@Component
public class SimulationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(SimulationFlowLogger.class);

    public static final String SIMULATION_RECEIVED = "SIMULATION_RECEIVED";
    public static final String SCENARIO_VALIDATED  = "SCENARIO_VALIDATED";
    public static final String BASELINE_EXTRACTED  = "BASELINE_EXTRACTED";
    public static final String ROI_COMPUTED        = "ROI_COMPUTED";
    public static final String RESPONSE_ASSEMBLED  = "RESPONSE_ASSEMBLED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * Bridges Context into MDC just for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[SimulationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /**
     * Logs a stage when the trace id is already at hand, outside a reactive signal.
     */
    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[SimulationFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /**
     * Compact one-line summary of a finished simulation.
     */
    public void logOutcome(SimulationOutcome outcome, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (outcome.isSuccess()) {
                SimulationResponse r = outcome.response();
                log.info("[SimulationFlow] outcome=SUCCESS posture={} outlook={} confidence={} "
                         + "breakEven={} loss={} dataCoverage={} traceId={}",
                         r.decisionInterpretation().recommendedPosture(),
                         r.simulationSummary().overallOutlook(),
                         r.simulationSummary().confidence(),
                         r.expectedRoiMetrics().breakEvenProbability(),
                         r.expectedRoiMetrics().lossProbability(),
                         r.guardrails().dataCoverage(),
                         traceId);
            } else {
                log.info("[SimulationFlow] outcome=FAILURE errorCode={} failures={} traceId={}",
                         outcome.error().errorCode(), outcome.error().validationFailures().size(), traceId);
            }
        });
    }
}
