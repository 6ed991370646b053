package com.whatifplatform.common.roi;

import com.whatifplatform.common.exception.RoiComputationException;
import com.whatifplatform.common.model.RangeValue;
import com.whatifplatform.common.model.ScenarioInput;

/**
 * ROI fallback formula and range-overlap probability math.
 *
 * <p>Probabilities are not statistical. They are the share of the ROI range lying on each
 * side of 0%, by linear interpolation over the range.
 *
 * <h3>Fallback ROI</h3>
 * <pre>
 *   avg        = (mid(engagement) + mid(reach)) / 2
 *   efficiency = budget / 1000 × 0.1
 *   roi        = [avg×0.5 − efficiency − 15, avg×1.2 − efficiency + 10]
 * </pre>
 *
 * <h3>Scenario adjustment (in order)</h3>
 * <pre>
 *   budget &gt; 50,000       → breakEven × 0.85, loss × 1.15
 *   decline / dormant      → loss = min(loss × 1.3, 100), breakEven = max(breakEven × 0.7, 0)
 *   |breakEven + loss − 100| &gt; 5 → rescale both to sum to 100
 *   clamp both into [0, 100]
 * </pre>
 *
 * Pure logic class. No WebClient. No logging.
 */
public final class RoiCalculator {

    static final double HIGH_BUDGET_THRESHOLD   = 50_000.0;
    static final double NORMALIZATION_TOLERANCE = 5.0;
    static final double BREAK_EVEN_THRESHOLD    = 0.0;

    private RoiCalculator() {}

    /**
     * @throws RoiComputationException if the inputs cannot produce a finite range
     */
    public static RangeValue fallbackRoiRange(RangeValue engagementGrowth, RangeValue reachGrowth,
                                              double campaignBudget) {
        double avgGrowth = (engagementGrowth.midpoint() + reachGrowth.midpoint()) / 2.0;
        double budgetEfficiency = campaignBudget / 1000.0 * 0.1;

        double min = avgGrowth * 0.5 - budgetEfficiency - 15.0;
        double max = avgGrowth * 1.2 - budgetEfficiency + 10.0;
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new RoiComputationException(String.format(
                "Fallback ROI is not finite: avgGrowth=%s budget=%s", avgGrowth, campaignBudget));
        }
        return RangeValue.ordered(min, max);
    }

    /** Share of the range at or above 0%, as a percentage. */
    public static double breakEvenProbability(RangeValue roi) {
        if (roi.min() >= BREAK_EVEN_THRESHOLD) return 100.0;
        if (roi.max() < BREAK_EVEN_THRESHOLD)  return 0.0;
        return clampProbability((roi.max() - BREAK_EVEN_THRESHOLD) / roi.width() * 100.0);
    }

    /** Share of the range below 0%, as a percentage. */
    public static double lossProbability(RangeValue roi) {
        if (roi.max() < BREAK_EVEN_THRESHOLD)  return 100.0;
        if (roi.min() >= BREAK_EVEN_THRESHOLD) return 0.0;
        return clampProbability((BREAK_EVEN_THRESHOLD - roi.min()) / roi.width() * 100.0);
    }

    public static RoiProbabilities probabilities(RangeValue roi) {
        return new RoiProbabilities(breakEvenProbability(roi), lossProbability(roi));
    }

    public static RoiProbabilities adjustForScenario(RoiProbabilities raw, ScenarioInput scenario) {
        double breakEven = raw.breakEven();
        double loss = raw.loss();

        if (scenario.campaignStrategy().budget() > HIGH_BUDGET_THRESHOLD) {
            breakEven *= 0.85;
            loss *= 1.15;
        }

        if (scenario.trendContext().stage().isLate()) {
            loss = Math.min(loss * 1.3, 100.0);
            breakEven = Math.max(breakEven * 0.7, 0.0);
        }

        double total = new RoiProbabilities(breakEven, loss).sum();
        if (Math.abs(total - 100.0) > NORMALIZATION_TOLERANCE && total > 0.0) {
            breakEven = breakEven / total * 100.0;
            loss = loss / total * 100.0;
        }

        return new RoiProbabilities(clampProbability(breakEven), clampProbability(loss));
    }

    static double clampProbability(double value) {
        return RangeValue.clamp(value, 0.0, 100.0);
    }
}
