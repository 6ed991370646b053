package com.whatifplatform.common.model;

/**
 * Result of one simulate call: exactly one of {@code response} or {@code error} is set.
 */
public record SimulationOutcome(
    SimulationResponse response,
    ErrorResponse      error
) {

    public SimulationOutcome {
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of response or error must be present");
        }
    }

    public static SimulationOutcome success(SimulationResponse response) {
        return new SimulationOutcome(response, null);
    }

    public static SimulationOutcome failure(ErrorResponse error) {
        return new SimulationOutcome(null, error);
    }

    public boolean isSuccess() {
        return response != null;
    }
}
