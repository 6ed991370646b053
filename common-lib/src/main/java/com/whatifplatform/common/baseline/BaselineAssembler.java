package com.whatifplatform.common.baseline;

import com.whatifplatform.common.external.DeclineRiskSnapshot;
import com.whatifplatform.common.external.TrendLifecycleSnapshot;
import com.whatifplatform.common.model.Baseline;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.RiskTrajectory;
import com.whatifplatform.common.model.WireEnums;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the two upstream snapshots into a coverage-aware {@link Baseline}.
 *
 * <p>Five fields are tracked. A missing trend snapshot marks engagement_trend, roi_trend and
 * historical_volatility missing; a missing risk snapshot marks current_risk_score and
 * risk_trajectory missing and keeps the scenario's own risk score (source scenario_input).
 * An absent, null or non-finite metric, or an unknown trajectory value, marks just that field
 * missing.
 * Every numeric field is clamped into [0, 100].
 *
 * Pure logic class. No WebClient. No logging.
 */
public final class BaselineAssembler {

    public static final String ENGAGEMENT_TREND      = "engagement_trend";
    public static final String ROI_TREND             = "roi_trend";
    public static final String HISTORICAL_VOLATILITY = "historical_volatility";
    public static final String CURRENT_RISK_SCORE    = "current_risk_score";
    public static final String RISK_TRAJECTORY       = "risk_trajectory";

    public static final String SOURCE_TREND_LIFECYCLE = "trend_lifecycle_engine";
    public static final String SOURCE_EARLY_DECLINE   = "early_decline_detection";
    public static final String SOURCE_SCENARIO_INPUT  = "scenario_input";

    private BaselineAssembler() {}

    public static Baseline assemble(double scenarioRiskScore,
                                    Optional<TrendLifecycleSnapshot> trend,
                                    Optional<DeclineRiskSnapshot> risk) {
        List<String> missing = new ArrayList<>();
        Map<String, String> sources = new LinkedHashMap<>();

        Double engagement = null;
        Double roi = null;
        Double volatility = null;
        if (trend.isPresent()) {
            TrendLifecycleSnapshot snapshot = trend.get();
            engagement = track(ENGAGEMENT_TREND, snapshot.engagementTrend(), SOURCE_TREND_LIFECYCLE, missing, sources);
            roi        = track(ROI_TREND, snapshot.roiTrend(), SOURCE_TREND_LIFECYCLE, missing, sources);
            volatility = track(HISTORICAL_VOLATILITY, snapshot.historicalVolatility(), SOURCE_TREND_LIFECYCLE,
                missing, sources);
        } else {
            missing.add(ENGAGEMENT_TREND);
            missing.add(ROI_TREND);
            missing.add(HISTORICAL_VOLATILITY);
        }

        Double currentRisk = null;
        RiskTrajectory trajectory = null;
        if (risk.isPresent()) {
            DeclineRiskSnapshot snapshot = risk.get();
            currentRisk = track(CURRENT_RISK_SCORE, snapshot.currentRiskScore(), SOURCE_EARLY_DECLINE, missing, sources);
            trajectory = WireEnums.find(RiskTrajectory.class, snapshot.riskTrajectory()).orElse(null);
            if (trajectory != null) {
                sources.put(RISK_TRAJECTORY, SOURCE_EARLY_DECLINE);
            } else {
                missing.add(RISK_TRAJECTORY);
            }
        } else {
            missing.add(CURRENT_RISK_SCORE);
            missing.add(RISK_TRAJECTORY);
        }

        if (currentRisk == null) {
            currentRisk = normalize(scenarioRiskScore);
            sources.put(CURRENT_RISK_SCORE, SOURCE_SCENARIO_INPUT);
        }

        return new Baseline(engagement, roi, volatility, currentRisk, trajectory,
            coverage(missing.size()), missing, sources);
    }

    public static double coverage(int missingCount) {
        int available = Baseline.TRACKED_FIELDS - missingCount;
        return (double) available / Baseline.TRACKED_FIELDS * 100.0;
    }

    private static Double track(String field, Double value, String source,
                                List<String> missing, Map<String, String> sources) {
        if (value == null || !Double.isFinite(value)) {
            missing.add(field);
            return null;
        }
        sources.put(field, source);
        return normalize(value);
    }

    static double normalize(double value) {
        return RangeValue.clamp(value, 0.0, 100.0);
    }
}
