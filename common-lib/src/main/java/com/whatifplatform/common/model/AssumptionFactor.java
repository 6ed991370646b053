package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Assumption dimensions flipped by the sensitivity analysis.
 */
public enum AssumptionFactor implements WireEnum {
    ENGAGEMENT_TREND("engagement_trend"),
    CREATOR_PARTICIPATION("creator_participation"),
    MARKET_NOISE("market_noise");

    private final String value;

    AssumptionFactor(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static AssumptionFactor fromValue(String value) {
        return WireEnums.parse(AssumptionFactor.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(AssumptionFactor.class, value);
    }
}
