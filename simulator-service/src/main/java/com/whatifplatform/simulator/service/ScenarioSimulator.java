package com.whatifplatform.simulator.service;

import com.whatifplatform.common.baseline.BaselineQuality;
import com.whatifplatform.common.exception.RoiComputationException;
import com.whatifplatform.common.interpretation.DecisionInterpreter;
import com.whatifplatform.common.model.Baseline;
import com.whatifplatform.common.model.ConfidenceLevel;
import com.whatifplatform.common.model.DecisionInterpretation;
import com.whatifplatform.common.model.ErrorResponse;
import com.whatifplatform.common.model.ExecutiveSummary;
import com.whatifplatform.common.model.ExpectedGrowthMetrics;
import com.whatifplatform.common.model.ExpectedRoiMetrics;
import com.whatifplatform.common.model.Guardrails;
import com.whatifplatform.common.model.OverallOutlook;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RiskProjection;
import com.whatifplatform.common.model.RiskTrend;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.SimulationOutcome;
import com.whatifplatform.common.model.SimulationResponse;
import com.whatifplatform.common.model.SimulationSummary;
import com.whatifplatform.common.guardrails.GuardrailsGenerator;
import com.whatifplatform.common.range.ProjectedRanges;
import com.whatifplatform.common.range.RangeComputation;
import com.whatifplatform.common.roi.RoiCalculator;
import com.whatifplatform.common.roi.RoiProbabilities;
import com.whatifplatform.common.sensitivity.SensitivityAnalyzer;
import com.whatifplatform.common.sensitivity.SensitivityResult;
import com.whatifplatform.common.summary.ExecutiveSummaryFormatter;
import com.whatifplatform.common.summary.ExecutiveSummaryGenerator;
import com.whatifplatform.common.trace.TraceContextUtil;
import com.whatifplatform.common.validation.AssumptionDefaults;
import com.whatifplatform.common.validation.ScenarioValidator;
import com.whatifplatform.common.validation.ValidationResult;
import com.whatifplatform.simulator.baseline.BaselineExtractor;
import com.whatifplatform.simulator.logger.SimulationFlowLogger;
import com.whatifplatform.simulator.roi.RoiComputationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Runs one what-if simulation end to end.
 *
 * <ol>
 *   <li>assign a scenario id when the caller did not supply one</li>
 *   <li>validate; any failure ends the run with {@code VALIDATION_ERROR}</li>
 *   <li>default unset assumptions</li>
 *   <li>extract the baseline and adjust confidence for its coverage</li>
 *   <li>compute the four ranges and widen them together when coverage or confidence is low</li>
 *   <li>ROI range and probabilities; a total ROI failure ends the run with {@code ROI_COMPUTATION_ERROR}</li>
 *   <li>risk trend</li>
 *   <li>assumption sensitivity</li>
 *   <li>interpretation, guardrails, response, optional executive summary</li>
 * </ol>
 *
 * <p>The returned Mono always emits a {@link SimulationOutcome} and never an error signal.
 * The caller's scenario is never modified; every variant is a copy. The scenario id doubles
 * as the trace id and travels in the Reactor Context.
 */
public class ScenarioSimulator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSimulator.class);

    private final BaselineExtractor baselineExtractor;
    private final RoiComputationService roiComputationService;
    private final SimulationFlowLogger simulationFlowLogger;

    public ScenarioSimulator(BaselineExtractor baselineExtractor,
                             RoiComputationService roiComputationService,
                             SimulationFlowLogger simulationFlowLogger) {
        this.baselineExtractor     = baselineExtractor;
        this.roiComputationService = roiComputationService;
        this.simulationFlowLogger  = simulationFlowLogger;
    }

    public Mono<SimulationOutcome> simulate(ScenarioInput input, boolean includeExecutiveSummary) {
        return Mono.defer(() -> {
            ScenarioInput scenario = assignScenarioId(input);
            String traceId = scenario != null ? scenario.scenarioId() : "unknown";
            simulationFlowLogger.logWithTraceId(SimulationFlowLogger.SIMULATION_RECEIVED, traceId);

            ValidationResult validation = ScenarioValidator.validate(scenario);
            if (!validation.valid()) {
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("Scenario validation failed. failures={} traceId={}",
                             validation.failures().size(), traceId));
                return Mono.just(finish(
                    SimulationOutcome.failure(ErrorResponse.validation(validation.failures())), traceId));
            }

            AssumptionDefaults.Applied defaults = AssumptionDefaults.apply(scenario.assumptions());
            ScenarioInput resolved = scenario.withAssumptions(defaults.assumptions());
            if (!defaults.defaulted().isEmpty()) {
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("Default assumptions applied. fields={} traceId={}",
                             defaults.defaultedNames(), traceId));
            }
            simulationFlowLogger.logWithTraceId(SimulationFlowLogger.SCENARIO_VALIDATED, traceId);

            Mono<SimulationOutcome> pipeline = baselineExtractor.extractBaseline(resolved)
                .doOnEach(simulationFlowLogger.stage(SimulationFlowLogger.BASELINE_EXTRACTED))
                .flatMap(baseline -> project(resolved, baseline, defaults.defaultedNames(), includeExecutiveSummary))
                .map(SimulationOutcome::success)
                .doOnEach(simulationFlowLogger.stage(SimulationFlowLogger.RESPONSE_ASSEMBLED))
                .onErrorResume(RoiComputationException.class, e -> {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("ROI computation failed. stage={} traceId={} reason={}",
                                  e.getStage(), traceId, e.getMessage()));
                    return Mono.just(SimulationOutcome.failure(ErrorResponse.roiComputation()));
                })
                .onErrorResume(e -> Mono.just(unexpectedFailure(e, traceId)))
                .map(outcome -> finish(outcome, traceId));

            return TraceContextUtil.withTraceId(pipeline, traceId);
        }).onErrorResume(e -> Mono.just(unexpectedFailure(e, "unknown")));
    }

    /** Steps 4 to 9, once the baseline is known. */
    private Mono<SimulationResponse> project(ScenarioInput scenario, Baseline baseline,
                                             List<String> defaultsApplied, boolean includeExecutiveSummary) {
        ConfidenceLevel confidence = BaselineQuality.adjustConfidence(
            scenario.trendContext().confidenceLevel(), baseline.dataCoverage());

        double seed = baseline.engagementSeed();
        ProjectedRanges computed = RangeComputation.computeAll(seed, baseline.currentRiskScore(), scenario);
        double wideningFactor = BaselineQuality.effectiveWideningFactor(baseline.dataCoverage(), confidence);
        if (wideningFactor > 1.0) {
            log.info("Widening ranges. factor={} dataCoverage={} confidence={} traceId={}",
                     wideningFactor, baseline.dataCoverage(), confidence, scenario.scenarioId());
        }
        ProjectedRanges ranges = computed.widenAll(wideningFactor);

        return roiComputationService.computeRoiRange(ranges.engagementGrowth(), ranges.reachGrowth(), scenario)
            .doOnEach(simulationFlowLogger.stage(SimulationFlowLogger.ROI_COMPUTED))
            .map(roi -> assemble(scenario, baseline, confidence, ranges, roi, seed,
                                 defaultsApplied, includeExecutiveSummary));
    }

    private SimulationResponse assemble(ScenarioInput scenario, Baseline baseline, ConfidenceLevel confidence,
                                        ProjectedRanges ranges, RangeValue roi, double seed,
                                        List<String> defaultsApplied, boolean includeExecutiveSummary) {
        RoiProbabilities probabilities =
            RoiCalculator.adjustForScenario(RoiCalculator.probabilities(roi), scenario);

        RiskTrend riskTrend = RangeComputation.riskTrend(baseline.currentRiskScore(), ranges.projectedRisk());
        SensitivityResult sensitivity = SensitivityAnalyzer.analyze(seed, scenario);
        log.info("Assumption sensitivity. factor={} impact={} magnitude={} traceId={}",
                 sensitivity.mostSensitiveFactor(), sensitivity.impactIfWrong(),
                 String.format("%.1f", sensitivity.magnitude()), scenario.scenarioId());

        DecisionInterpretation interpretation =
            DecisionInterpreter.interpret(ranges, probabilities, riskTrend, scenario);
        OverallOutlook outlook =
            DecisionInterpreter.overallOutlook(probabilities.breakEven(), probabilities.loss(), riskTrend);
        Guardrails guardrails = GuardrailsGenerator.generate(
            baseline.dataCoverage(), scenario, baseline.missingDataPoints(), defaultsApplied);

        SimulationResponse response = new SimulationResponse(
            scenario.scenarioId(),
            scenario.trendContext().trendId(),
            scenario.trendContext().trendName(),
            new SimulationSummary(
                scenario.trendContext().trendName() + " - " + scenario.campaignStrategy().campaignType(),
                outlook, confidence),
            new ExpectedGrowthMetrics(
                ranges.engagementGrowth(), ranges.reachGrowth(), ranges.creatorParticipationChange()),
            new ExpectedRoiMetrics(roi, probabilities.breakEven(), probabilities.loss()),
            new RiskProjection(baseline.currentRiskScore(), ranges.projectedRisk(), riskTrend),
            interpretation,
            sensitivity.toAssumptionSensitivity(),
            guardrails,
            null);

        if (!includeExecutiveSummary) return response;

        ExecutiveSummary summary = ExecutiveSummaryGenerator.generate(response, scenario);
        if (log.isDebugEnabled()) {
            log.debug("Executive summary report. traceId={}{}", scenario.scenarioId(),
                      ExecutiveSummaryFormatter.format(summary));
        }
        return response.withExecutiveSummary(summary);
    }

    private static ScenarioInput assignScenarioId(ScenarioInput input) {
        if (input == null) return null;
        String id = input.scenarioId();
        if (id != null && !id.isBlank()) return input;
        return input.withScenarioId(UUID.randomUUID().toString());
    }

    private SimulationOutcome unexpectedFailure(Throwable e, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.error("Simulation failed unexpectedly. traceId={}", traceId, e));
        return SimulationOutcome.failure(ErrorResponse.simulation());
    }

    private SimulationOutcome finish(SimulationOutcome outcome, String traceId) {
        simulationFlowLogger.logOutcome(outcome, traceId);
        return outcome;
    }
}
