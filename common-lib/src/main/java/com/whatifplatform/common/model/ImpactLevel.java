package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much an output moves if an assumption is wrong.
 */
public enum ImpactLevel implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    ImpactLevel(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static ImpactLevel fromValue(String value) {
        return WireEnums.parse(ImpactLevel.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(ImpactLevel.class, value);
    }
}
