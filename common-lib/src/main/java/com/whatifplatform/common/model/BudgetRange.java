package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller-supplied budget bounds. Not ordered at construction; the validator reports
 * {@code min > max} as a failure instead.
 */
public record BudgetRange(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max
) {}
