package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One violated validation rule, with actionable guidance for the caller.
 */
public record ValidationFailure(
    @JsonProperty("field")    String field,
    @JsonProperty("message")  String message,
    @JsonProperty("guidance") String guidance
) {}
