package com.whatifplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Narrative report templated from a finished {@link SimulationResponse}.
 *
 * <p>Every section is derived; nothing here feeds back into the numbers.
 */
public record ExecutiveSummary(
    @JsonProperty("trend_analysis")           TrendAnalysis trendAnalysis,
    @JsonProperty("success_probability")      SuccessProbability successProbability,
    @JsonProperty("financial_outlook")        FinancialOutlook financialOutlook,
    @JsonProperty("risk_assessment")          RiskAssessment riskAssessment,
    @JsonProperty("strategic_recommendation") StrategicRecommendation strategicRecommendation,
    @JsonProperty("key_drivers")              KeyDrivers keyDrivers,
    @JsonProperty("critical_assumptions")     CriticalAssumptions criticalAssumptions,
    @JsonProperty("action_items")             List<ActionItem> actionItems
) {

    public ExecutiveSummary {
        actionItems = List.copyOf(actionItems);
    }

    public record TrendAnalysis(
        @JsonProperty("stage")                  LifecycleStage stage,
        @JsonProperty("stage_description")      String stageDescription,
        @JsonProperty("current_risk_score")     double currentRiskScore,
        @JsonProperty("risk_level")             String riskLevel,
        @JsonProperty("risk_trend")             RiskTrend riskTrend,
        @JsonProperty("risk_trend_description") String riskTrendDescription,
        @JsonProperty("interpretation")         String interpretation
    ) {}

    public record SuccessProbability(
        @JsonProperty("break_even_probability") double breakEvenProbability,
        @JsonProperty("loss_probability")       double lossProbability,
        @JsonProperty("success_level")          String successLevel,
        @JsonProperty("roi_range")              RangeValue roiRange,
        @JsonProperty("roi_midpoint")           double roiMidpoint,
        @JsonProperty("interpretation")         String interpretation
    ) {}

    public record FinancialOutlook(
        @JsonProperty("outlook")                String outlook,
        @JsonProperty("best_case_roi")          double bestCaseRoi,
        @JsonProperty("worst_case_roi")         double worstCaseRoi,
        @JsonProperty("expected_roi")           double expectedRoi,
        @JsonProperty("break_even_probability") double breakEvenProbability,
        @JsonProperty("interpretation")         String interpretation
    ) {}

    public record RiskAssessment(
        @JsonProperty("current_risk_score")   double currentRiskScore,
        @JsonProperty("current_risk_level")   String currentRiskLevel,
        @JsonProperty("projected_risk_range") RangeValue projectedRiskRange,
        @JsonProperty("risk_change")          double riskChange,
        @JsonProperty("risk_trend")           RiskTrend riskTrend,
        @JsonProperty("risk_tolerance")       RiskTolerance riskTolerance,
        @JsonProperty("tolerance_alignment")  String toleranceAlignment,
        @JsonProperty("interpretation")       String interpretation
    ) {}

    public record StrategicRecommendation(
        @JsonProperty("recommended_posture")  RecommendedPosture recommendedPosture,
        @JsonProperty("posture_description")  String postureDescription,
        @JsonProperty("overall_outlook")      OverallOutlook overallOutlook,
        @JsonProperty("outlook_description")  String outlookDescription,
        @JsonProperty("confidence")           ConfidenceLevel confidence,
        @JsonProperty("rationale")            String rationale
    ) {}

    public record KeyDrivers(
        @JsonProperty("primary_opportunities")     List<String> primaryOpportunities,
        @JsonProperty("primary_risks")             List<String> primaryRisks,
        @JsonProperty("most_sensitive_assumption") AssumptionFactor mostSensitiveAssumption,
        @JsonProperty("sensitivity_impact")        ImpactLevel sensitivityImpact,
        @JsonProperty("engagement_growth_range")   RangeValue engagementGrowthRange,
        @JsonProperty("reach_growth_range")        RangeValue reachGrowthRange,
        @JsonProperty("interpretation")            String interpretation
    ) {}

    public record CriticalAssumptions(
        @JsonProperty("engagement_trend")      EngagementTrend engagementTrend,
        @JsonProperty("creator_participation") CreatorParticipation creatorParticipation,
        @JsonProperty("market_noise")          MarketNoise marketNoise,
        @JsonProperty("most_sensitive_factor") AssumptionFactor mostSensitiveFactor,
        @JsonProperty("impact_if_wrong")       ImpactLevel impactIfWrong,
        @JsonProperty("data_coverage")         double dataCoverage,
        @JsonProperty("data_quality_note")     String dataQualityNote,
        @JsonProperty("interpretation")        String interpretation
    ) {}

    public record ActionItem(
        @JsonProperty("priority")  Priority priority,
        @JsonProperty("action")    String action,
        @JsonProperty("rationale") String rationale
    ) {}

    public enum Priority {
        HIGH, MEDIUM;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
