package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller's belief about competing noise in the feed.
 */
public enum MarketNoise implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    MarketNoise(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static MarketNoise fromValue(String value) {
        return WireEnums.parse(MarketNoise.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(MarketNoise.class, value);
    }
}
