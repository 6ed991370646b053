package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data limitations and transparency notes attached to every response.
 */
public record Guardrails(
    @JsonProperty("data_coverage") double dataCoverage,
    @JsonProperty("system_note")   String systemNote
) {}
