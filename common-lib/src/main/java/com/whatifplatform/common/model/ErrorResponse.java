package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured error returned instead of a {@link SimulationResponse}.
 */
public record ErrorResponse(
    @JsonProperty("error_code")          String errorCode,
    @JsonProperty("error_message")       String errorMessage,
    @JsonProperty("validation_failures") List<ValidationFailure> validationFailures
) {

    public static final String VALIDATION_ERROR      = "VALIDATION_ERROR";
    public static final String ROI_COMPUTATION_ERROR = "ROI_COMPUTATION_ERROR";
    public static final String SIMULATION_ERROR      = "SIMULATION_ERROR";

    public ErrorResponse {
        validationFailures = validationFailures == null ? List.of() : List.copyOf(validationFailures);
    }

    public static ErrorResponse validation(List<ValidationFailure> failures) {
        return new ErrorResponse(VALIDATION_ERROR, "Scenario validation failed", failures);
    }

    public static ErrorResponse roiComputation() {
        return new ErrorResponse(ROI_COMPUTATION_ERROR, "Failed to compute ROI projections", List.of());
    }

    public static ErrorResponse simulation() {
        return new ErrorResponse(SIMULATION_ERROR, "Simulation failed", List.of());
    }
}
