package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller's belief about creator participation.
 */
public enum CreatorParticipation implements WireEnum {
    INCREASING("increasing"),
    STABLE("stable"),
    DECLINING("declining");

    private final String value;

    CreatorParticipation(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static CreatorParticipation fromValue(String value) {
        return WireEnums.parse(CreatorParticipation.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(CreatorParticipation.class, value);
    }
}
