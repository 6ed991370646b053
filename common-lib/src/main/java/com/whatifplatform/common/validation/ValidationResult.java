package com.whatifplatform.common.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.whatifplatform.common.model.ValidationFailure;

import java.util.List;

/**
 * Outcome of one validation pass. {@code valid} is true exactly when {@code failures} is empty.
 */
public record ValidationResult(
    @JsonProperty("valid")    boolean valid,
    @JsonProperty("failures") List<ValidationFailure> failures
) {

    public ValidationResult {
        failures = List.copyOf(failures);
    }

    public static ValidationResult of(List<ValidationFailure> failures) {
        return new ValidationResult(failures.isEmpty(), failures);
    }
}
