package com.whatifplatform.simulator.controller;

import com.whatifplatform.common.model.ErrorResponse;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.SimulationOutcome;
import com.whatifplatform.common.validation.ScenarioValidator;
import com.whatifplatform.common.validation.ValidationResult;
import com.whatifplatform.simulator.config.SimulatorProperties;
import com.whatifplatform.simulator.service.ScenarioSimulator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/simulations")
public class SimulationController {

    private final ScenarioSimulator scenarioSimulator;
    private final SimulatorProperties properties;

    public SimulationController(ScenarioSimulator scenarioSimulator, SimulatorProperties properties) {
        this.scenarioSimulator = scenarioSimulator;
        this.properties        = properties;
    }

    @PostMapping
    public Mono<ResponseEntity<Object>> simulate(
            @RequestBody(required = false) ScenarioInput scenario,
            @RequestParam(value = "includeExecutiveSummary", required = false) Boolean includeExecutiveSummary) {
        boolean withSummary = includeExecutiveSummary != null
            ? includeExecutiveSummary
            : properties.isIncludeExecutiveSummary();
        return scenarioSimulator.simulate(scenario, withSummary).map(SimulationController::toResponse);
    }

    /** Dry run: validation only, no upstream calls. */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody(required = false) ScenarioInput scenario) {
        return ResponseEntity.ok(ScenarioValidator.validate(scenario));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    static ResponseEntity<Object> toResponse(SimulationOutcome outcome) {
        if (outcome.isSuccess()) {
            return ResponseEntity.ok(outcome.response());
        }
        HttpStatus status = ErrorResponse.VALIDATION_ERROR.equals(outcome.error().errorCode())
            ? HttpStatus.UNPROCESSABLE_ENTITY
            : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(outcome.error());
    }
}
