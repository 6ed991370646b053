package com.whatifplatform.common.constants;

import com.whatifplatform.common.model.BudgetTier;
import com.whatifplatform.common.model.ContentIntensity;
import com.whatifplatform.common.model.CreatorParticipation;
import com.whatifplatform.common.model.CreatorTier;
import com.whatifplatform.common.model.EngagementTrend;
import com.whatifplatform.common.model.MarketNoise;
import com.whatifplatform.common.model.Multiplier;

/**
 * Fixed multiplier tables feeding the range computation chain.
 *
 * <pre>
 *   budget tier          low (0.5,0.8)   medium (0.8,1.2)  high (1.2,1.8)
 *   content intensity    low (0.6,0.8)   medium (0.8,1.1)  high (1.1,1.4)
 *   engagement trend     optimistic (1.1,1.3)  neutral (0.9,1.1)  pessimistic (0.7,0.9)
 *   creator participation increasing (1.0,1.2) stable (0.9,1.1)  declining (0.6,0.8)
 *   creator tier reach   nano (0.3,0.5) micro (0.5,0.8) macro (0.8,1.2) mixed (0.6,0.9)
 *   market noise         low 1.0  medium 1.2  high 1.5   (half-width widening)
 * </pre>
 */
public final class MultiplierTables {

    /** Budget at or above which a campaign stops being "low". */
    public static final double LOW_BUDGET_CEILING  = 5_000.0;
    /** Budget above which a campaign is "high". */
    public static final double HIGH_BUDGET_FLOOR   = 20_000.0;

    public static final Multiplier ENGAGEMENT_SEED    = Multiplier.of(0.8, 1.2);
    public static final Multiplier REACH_SEED         = Multiplier.of(0.6, 1.4);
    public static final Multiplier PEAK_SATURATION    = Multiplier.of(0.7, 0.85);

    public static final double CREATOR_CHANGE_BASE_MIN = 10.0;
    public static final double CREATOR_CHANGE_BASE_MAX = 30.0;

    public static final int    DIMINISHING_RETURNS_THRESHOLD_DAYS = 90;
    public static final double DIMINISHING_RETURNS_MAX_REDUCTION  = 0.3;

    private MultiplierTables() {}

    public static BudgetTier budgetTier(double budget) {
        if (budget < LOW_BUDGET_CEILING) return BudgetTier.LOW;
        if (budget > HIGH_BUDGET_FLOOR)  return BudgetTier.HIGH;
        return BudgetTier.MEDIUM;
    }

    public static Multiplier budget(BudgetTier tier) {
        return switch (tier) {
            case LOW    -> Multiplier.of(0.5, 0.8);
            case MEDIUM -> Multiplier.of(0.8, 1.2);
            case HIGH   -> Multiplier.of(1.2, 1.8);
        };
    }

    public static Multiplier contentIntensity(ContentIntensity intensity) {
        return switch (intensity) {
            case LOW    -> Multiplier.of(0.6, 0.8);
            case MEDIUM -> Multiplier.of(0.8, 1.1);
            case HIGH   -> Multiplier.of(1.1, 1.4);
        };
    }

    public static Multiplier engagementTrend(EngagementTrend trend) {
        return switch (trend) {
            case OPTIMISTIC  -> Multiplier.of(1.1, 1.3);
            case NEUTRAL     -> Multiplier.of(0.9, 1.1);
            case PESSIMISTIC -> Multiplier.of(0.7, 0.9);
        };
    }

    public static Multiplier creatorParticipation(CreatorParticipation participation) {
        return switch (participation) {
            case INCREASING -> Multiplier.of(1.0, 1.2);
            case STABLE     -> Multiplier.of(0.9, 1.1);
            case DECLINING  -> Multiplier.of(0.6, 0.8);
        };
    }

    public static Multiplier creatorTierReach(CreatorTier tier) {
        return switch (tier) {
            case NANO  -> Multiplier.of(0.3, 0.5);
            case MICRO -> Multiplier.of(0.5, 0.8);
            case MACRO -> Multiplier.of(0.8, 1.2);
            case MIXED -> Multiplier.of(0.6, 0.9);
        };
    }

    public static double marketNoiseWidening(MarketNoise noise) {
        return switch (noise) {
            case LOW    -> 1.0;
            case MEDIUM -> 1.2;
            case HIGH   -> 1.5;
        };
    }
}
