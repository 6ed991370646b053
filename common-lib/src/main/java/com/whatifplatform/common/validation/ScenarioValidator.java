package com.whatifplatform.common.validation;

import com.whatifplatform.common.model.Assumptions;
import com.whatifplatform.common.model.BudgetRange;
import com.whatifplatform.common.model.CampaignStrategy;
import com.whatifplatform.common.model.CampaignType;
import com.whatifplatform.common.model.ConfidenceLevel;
import com.whatifplatform.common.model.Constraints;
import com.whatifplatform.common.model.ContentIntensity;
import com.whatifplatform.common.model.CreatorParticipation;
import com.whatifplatform.common.model.CreatorTier;
import com.whatifplatform.common.model.EngagementTrend;
import com.whatifplatform.common.model.LifecycleStage;
import com.whatifplatform.common.model.MarketNoise;
import com.whatifplatform.common.model.RiskTolerance;
import com.whatifplatform.common.model.ScenarioInput;
import com.whatifplatform.common.model.TrendContext;
import com.whatifplatform.common.model.ValidationFailure;
import com.whatifplatform.common.model.WireEnum;
import com.whatifplatform.common.model.WireEnums;
import com.whatifplatform.common.validation.CompatibilityMatrix.Compatibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural and domain-rule validation of a {@link ScenarioInput}.
 *
 * <p>Every rule runs independently and all violations are collected in one pass, so a
 * caller can fix everything at once. Never throws; a missing section is itself reported
 * as a failure and the rules depending on it are skipped.
 *
 * <p>Compatible but high-risk lifecycle/campaign pairs pass and are only logged.
 * Downstream risk rules read them through {@link CompatibilityMatrix#isHighRisk}.
 */
public final class ScenarioValidator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioValidator.class);

    private ScenarioValidator() {}

    public static ValidationResult validate(ScenarioInput scenario) {
        List<ValidationFailure> failures = new ArrayList<>();
        if (scenario == null) {
            failures.add(new ValidationFailure("scenario", "scenario is required",
                "Provide trend_context, campaign_strategy, assumptions and constraints"));
            return ValidationResult.of(failures);
        }

        TrendContext trend = scenario.trendContext();
        CampaignStrategy strategy = scenario.campaignStrategy();
        Constraints constraints = scenario.constraints();

        if (trend == null) {
            failures.add(missingSection("trend_context"));
        } else {
            validateTrendContext(trend, failures);
        }

        if (strategy == null) {
            failures.add(missingSection("campaign_strategy"));
        } else {
            validateCampaignStrategy(strategy, failures);
        }

        validateAssumptions(scenario.assumptions(), failures);

        if (constraints == null) {
            failures.add(missingSection("constraints"));
        } else {
            validateConstraints(constraints, failures);
        }

        if (trend != null && strategy != null) {
            validateCompatibility(trend.lifecycleStage(), strategy.campaignType(), failures);
        }
        if (strategy != null && constraints != null) {
            validateBudgetConstraint(strategy.budgetRange(), constraints.maxBudgetCap(), failures);
        }

        return ValidationResult.of(failures);
    }

    private static void validateTrendContext(TrendContext trend, List<ValidationFailure> failures) {
        if (isBlank(trend.trendId())) {
            failures.add(new ValidationFailure("trend_context.trend_id",
                "trend_id must be a non-empty string", "Provide a valid trend identifier"));
        }
        if (isBlank(trend.trendName())) {
            failures.add(new ValidationFailure("trend_context.trend_name",
                "trend_name must be a non-empty string", "Provide a descriptive trend name"));
        }
        requireMember("trend_context.lifecycle_stage", trend.lifecycleStage(), LifecycleStage.class, failures);

        double risk = trend.currentRiskScore();
        if (!(risk >= 0.0 && risk <= 100.0)) {
            failures.add(new ValidationFailure("trend_context.current_risk_score",
                "current_risk_score must be between 0 and 100",
                "Provide a risk score as a percentage (0-100)"));
        }
        requireMember("trend_context.confidence", trend.confidence(), ConfidenceLevel.class, failures);
    }

    private static void validateCampaignStrategy(CampaignStrategy strategy, List<ValidationFailure> failures) {
        requireMember("campaign_strategy.campaign_type", strategy.campaignType(), CampaignType.class, failures);

        BudgetRange budget = strategy.budgetRange();
        if (budget == null) {
            failures.add(new ValidationFailure("campaign_strategy.budget_range",
                "budget_range must have 'min' and 'max'",
                "Provide budget_range as {\"min\": number, \"max\": number}"));
        } else if (budget.min() > budget.max()) {
            failures.add(new ValidationFailure("campaign_strategy.budget_range",
                "budget_range min must be <= max", "Ensure min <= max in budget_range"));
        }

        if (strategy.campaignDurationDays() <= 0) {
            failures.add(new ValidationFailure("campaign_strategy.campaign_duration_days",
                "campaign_duration_days must be positive", "Provide a positive number of days"));
        }
        requireMember("campaign_strategy.creator_tier", strategy.creatorTier(), CreatorTier.class, failures);
        requireMember("campaign_strategy.content_intensity", strategy.contentIntensity(),
            ContentIntensity.class, failures);
    }

    // Unset assumptions are legal here; defaults are applied after validation.
    private static void validateAssumptions(Assumptions assumptions, List<ValidationFailure> failures) {
        if (assumptions == null) return;
        requireMemberIfSet("assumptions.engagement_trend", assumptions.engagementTrend(),
            EngagementTrend.class, failures);
        requireMemberIfSet("assumptions.creator_participation", assumptions.creatorParticipation(),
            CreatorParticipation.class, failures);
        requireMemberIfSet("assumptions.market_noise", assumptions.marketNoise(),
            MarketNoise.class, failures);
    }

    private static void validateConstraints(Constraints constraints, List<ValidationFailure> failures) {
        requireMember("constraints.risk_tolerance", constraints.riskTolerance(), RiskTolerance.class, failures);
        if (!(constraints.maxBudgetCap() > 0.0)) {
            failures.add(new ValidationFailure("constraints.max_budget_cap",
                "max_budget_cap must be positive", "Provide a positive budget cap"));
        }
    }

    private static void validateCompatibility(String stageValue, String typeValue,
                                              List<ValidationFailure> failures) {
        Optional<LifecycleStage> stage = WireEnums.find(LifecycleStage.class, stageValue);
        Optional<CampaignType> type = WireEnums.find(CampaignType.class, typeValue);
        // Out-of-domain values are already reported by the membership checks.
        if (stage.isEmpty() || type.isEmpty()) return;

        Compatibility compatibility = CompatibilityMatrix.lookup(stage.get(), type.get());
        if (!compatibility.compatible()) {
            failures.add(new ValidationFailure("compatibility",
                "Campaign type '" + typeValue + "' is not compatible with lifecycle stage '" + stageValue + "'",
                "Consider using a different campaign type for the " + stageValue + " stage"));
        } else if (compatibility.highRisk()) {
            log.warn("[ScenarioValidator] High-risk combination accepted. lifecycleStage={} campaignType={}",
                stageValue, typeValue);
        }
    }

    private static void validateBudgetConstraint(BudgetRange budget, double maxBudgetCap,
                                                 List<ValidationFailure> failures) {
        if (budget == null) return;
        if (budget.max() > maxBudgetCap) {
            failures.add(new ValidationFailure("budget_constraint",
                String.format("Budget range max (%.2f) exceeds max_budget_cap (%.2f)", budget.max(), maxBudgetCap),
                String.format("Reduce budget_range.max to be <= %.2f", maxBudgetCap)));
        }
    }

    private static <E extends Enum<E> & WireEnum> void requireMember(String field, String value, Class<E> type,
                                                                     List<ValidationFailure> failures) {
        if (!WireEnums.isValid(type, value)) {
            failures.add(new ValidationFailure(field,
                field.substring(field.lastIndexOf('.') + 1) + " must be one of [" + WireEnums.describe(type)
                    + "] but was '" + value + "'",
                "Valid values: " + WireEnums.describe(type)));
        }
    }

    private static <E extends Enum<E> & WireEnum> void requireMemberIfSet(String field, String value, Class<E> type,
                                                                          List<ValidationFailure> failures) {
        if (value != null) requireMember(field, value, type, failures);
    }

    private static ValidationFailure missingSection(String section) {
        return new ValidationFailure(section, section + " is required", "Provide the " + section + " object");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
