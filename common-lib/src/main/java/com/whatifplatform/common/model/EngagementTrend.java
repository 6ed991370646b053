package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller's belief about where engagement is heading.
 */
public enum EngagementTrend implements WireEnum {
    OPTIMISTIC("optimistic"),
    NEUTRAL("neutral"),
    PESSIMISTIC("pessimistic");

    private final String value;

    EngagementTrend(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static EngagementTrend fromValue(String value) {
        return WireEnums.parse(EngagementTrend.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(EngagementTrend.class, value);
    }
}
