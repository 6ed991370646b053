package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Audience size class of the participating creators.
 */
public enum CreatorTier implements WireEnum {
    NANO("nano"),
    MICRO("micro"),
    MACRO("macro"),
    MIXED("mixed");

    private final String value;

    CreatorTier(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static CreatorTier fromValue(String value) {
        return WireEnums.parse(CreatorTier.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(CreatorTier.class, value);
    }
}
