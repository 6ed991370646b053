package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller's appetite for risk.
 */
public enum RiskTolerance implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    RiskTolerance(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static RiskTolerance fromValue(String value) {
        return WireEnums.parse(RiskTolerance.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(RiskTolerance.class, value);
    }
}
