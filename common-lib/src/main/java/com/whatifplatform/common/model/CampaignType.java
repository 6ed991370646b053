package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of the proposed campaign.
 */
public enum CampaignType implements WireEnum {
    SHORT_TERM_INFLUENCER("short_term_influencer"),
    LONG_TERM_PAID("long_term_paid"),
    ORGANIC_ONLY("organic_only"),
    MIXED("mixed");

    private final String value;

    CampaignType(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static CampaignType fromValue(String value) {
        return WireEnums.parse(CampaignType.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(CampaignType.class, value);
    }
}
