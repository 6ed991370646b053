package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Budget bucket derived from the campaign's maximum budget.
 */
public enum BudgetTier implements WireEnum {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    BudgetTier(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String value() {
        return value;
    }

    public static BudgetTier fromValue(String value) {
        return WireEnums.parse(BudgetTier.class, value);
    }

    public static boolean isValid(String value) {
        return WireEnums.isValid(BudgetTier.class, value);
    }
}
