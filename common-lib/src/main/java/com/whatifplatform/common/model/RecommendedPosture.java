package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Recommended investment stance.
 */
public enum RecommendedPosture implements WireEnum {
    SCALE("scale"),
    TEST_SMALL("test_small"),
    MONITOR("monitor"),
    AVOID("avoid");

    private final String value;

    RecommendedPosture(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static RecommendedPosture fromValue(String value) {
        return WireEnums.parse(RecommendedPosture.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(RecommendedPosture.class, value);
    }
}
