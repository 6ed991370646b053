package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of the projected risk score relative to the current one.
 */
public enum RiskTrend implements WireEnum {
    IMPROVING("improving"),
    STABLE("stable"),
    WORSENING("worsening");

    private final String value;

    RiskTrend(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static RiskTrend fromValue(String value) {
        return WireEnums.parse(RiskTrend.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(RiskTrend.class, value);
    }
}
