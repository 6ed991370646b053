package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk direction reported by the early-decline detection system.
 */
public enum RiskTrajectory implements WireEnum {
    INCREASING("increasing"),
    STABLE("stable"),
    DECREASING("decreasing");

    private final String value;

    RiskTrajectory(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static RiskTrajectory fromValue(String value) {
        return WireEnums.parse(RiskTrajectory.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(RiskTrajectory.class, value);
    }
}
