package com.whatifplatform.common.validation;

import com.whatifplatform.common.model.AssumptionFactor;
import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.CreatorParticipation;
import com.whatifplatform.common.model.EngagementTrend;
import com.whatifplatform.common.model.MarketNoise;

import java.util.ArrayList;
import java.util.List;

/**
 * Fills unset assumptions with neutral / stable / medium.
 *
 * <p>Returns a new {@link Assumptions}; the input is never modified. The names of the
 * defaulted fields are reported so the guardrail note can disclose them.
 */
public final class AssumptionDefaults {

    public static final EngagementTrend      DEFAULT_ENGAGEMENT_TREND      = EngagementTrend.NEUTRAL;
    public static final CreatorParticipation DEFAULT_CREATOR_PARTICIPATION = CreatorParticipation.STABLE;
    public static final MarketNoise          DEFAULT_MARKET_NOISE          = MarketNoise.MEDIUM;

    public record Applied(Assumptions assumptions, List<AssumptionFactor> defaulted) {
        public Applied {
            defaulted = List.copyOf(defaulted);
        }

        public List<String> defaultedNames() {
            return defaulted.stream().map(AssumptionFactor::value).toList();
        }
    }

    private AssumptionDefaults() {}

    public static Applied apply(Assumptions assumptions) {
        Assumptions result = assumptions != null ? assumptions : Assumptions.unset();
        List<AssumptionFactor> defaulted = new ArrayList<>();

        if (result.engagementTrend() == null) {
            result = result.withEngagementTrend(DEFAULT_ENGAGEMENT_TREND);
            defaulted.add(AssumptionFactor.ENGAGEMENT_TREND);
        }
        if (result.creatorParticipation() == null) {
            result = result.withCreatorParticipation(DEFAULT_CREATOR_PARTICIPATION);
            defaulted.add(AssumptionFactor.CREATOR_PARTICIPATION);
        }
        if (result.marketNoise() == null) {
            result = result.withMarketNoise(DEFAULT_MARKET_NOISE);
            defaulted.add(AssumptionFactor.MARKET_NOISE);
        }
        return new Applied(result, defaulted);
    }
}
