package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position of a trend on its adoption curve.
 */
public enum LifecycleStage implements WireEnum {
    EMERGING("emerging"),
    GROWTH("growth"),
    PEAK("peak"),
    DECLINE("decline"),
    DORMANT("dormant");

    private final String value;

    LifecycleStage(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    /** Decline and dormant stages share the late-lifecycle risk rules. */
    public boolean isLate() {
        return this == DECLINE || this == DORMANT;
    }

    public static LifecycleStage fromValue(String value) {
        return WireEnums.parse(LifecycleStage.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(LifecycleStage.class, value);
    }
}
