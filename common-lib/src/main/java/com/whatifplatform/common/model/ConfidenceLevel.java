package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence in the trend context, possibly degraded by missing data.
 */
public enum ConfidenceLevel implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static ConfidenceLevel fromValue(String value) {
        return WireEnums.parse(ConfidenceLevel.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(ConfidenceLevel.class, value);
    }
}
