package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Single-word verdict over the whole simulation.
 */
public enum OverallOutlook implements WireEnum {
    FAVORABLE("favorable"),
    RISKY("risky"),
    UNFAVORABLE("unfavorable");

    private final String value;

    OverallOutlook(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static OverallOutlook fromValue(String value) {
        return WireEnums.parse(OverallOutlook.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(OverallOutlook.class, value);
    }
}
