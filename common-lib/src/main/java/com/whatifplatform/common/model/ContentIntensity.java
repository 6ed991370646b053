package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Posting cadence and production effort of the campaign.
 */
public enum ContentIntensity implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    ContentIntensity(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static ContentIntensity fromValue(String value) {
        return WireEnums.parse(ContentIntensity.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(ContentIntensity.class, value);
    }
}
