package com.whatifplatform.common.validation;

import com.whatifplatform.common.model.CampaignType;
import com.whatifplatform.common.model.LifecycleStage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lifecycle stage × campaign type compatibility table.
 *
 * <p>The table covers all 20 combinations. {@link #lookup} still falls back to
 * {@link #OPEN_WORLD_DEFAULT} (compatible, not high-risk) for a pair it does not hold,
 * so adding an enum constant never turns into a validation failure on its own.
 *
 * <pre>
 *                 short_term_influencer  long_term_paid      organic_only  mixed
 *   emerging      ok                     ok / high-risk      ok            ok
 *   growth        ok                     ok                  ok            ok
 *   peak          ok                     ok / high-risk      ok            ok / high-risk
 *   decline       ok / high-risk         INCOMPATIBLE        ok / high-risk ok / high-risk
 *   dormant       ok / high-risk         INCOMPATIBLE        ok / high-risk ok / high-risk
 * </pre>
 */
public final class CompatibilityMatrix {

    public record Compatibility(boolean compatible, boolean highRisk) {}

    public static final Compatibility OPEN_WORLD_DEFAULT = new Compatibility(true, false);

    private static final Compatibility OK           = new Compatibility(true, false);
    private static final Compatibility HIGH_RISK    = new Compatibility(true, true);
    private static final Compatibility INCOMPATIBLE = new Compatibility(false, true);

    private static final Map<LifecycleStage, Map<CampaignType, Compatibility>> MATRIX =
        new EnumMap<>(LifecycleStage.class);

    static {
        row(LifecycleStage.EMERGING, OK,        HIGH_RISK,    OK,        OK);
        row(LifecycleStage.GROWTH,   OK,        OK,           OK,        OK);
        row(LifecycleStage.PEAK,     OK,        HIGH_RISK,    OK,        HIGH_RISK);
        row(LifecycleStage.DECLINE,  HIGH_RISK, INCOMPATIBLE, HIGH_RISK, HIGH_RISK);
        row(LifecycleStage.DORMANT,  HIGH_RISK, INCOMPATIBLE, HIGH_RISK, HIGH_RISK);
    }

    private CompatibilityMatrix() {}

    private static void row(LifecycleStage stage, Compatibility shortTermInfluencer,
                            Compatibility longTermPaid, Compatibility organicOnly,
                            Compatibility mixed) {
        Map<CampaignType, Compatibility> byType = new EnumMap<>(CampaignType.class);
        byType.put(CampaignType.SHORT_TERM_INFLUENCER, shortTermInfluencer);
        byType.put(CampaignType.LONG_TERM_PAID, longTermPaid);
        byType.put(CampaignType.ORGANIC_ONLY, organicOnly);
        byType.put(CampaignType.MIXED, mixed);
        MATRIX.put(stage, byType);
    }

    public static Compatibility lookup(LifecycleStage stage, CampaignType type) {
        Map<CampaignType, Compatibility> byType = MATRIX.get(stage);
        if (byType == null) return OPEN_WORLD_DEFAULT;
        return byType.getOrDefault(type, OPEN_WORLD_DEFAULT);
    }

    public static boolean isCompatible(LifecycleStage stage, CampaignType type) {
        return lookup(stage, type).compatible();
    }

    public static boolean isHighRisk(LifecycleStage stage, CampaignType type) {
        return lookup(stage, type).highRisk();
    }
}
