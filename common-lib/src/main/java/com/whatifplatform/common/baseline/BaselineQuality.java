package com.whatifplatform.common.baseline;

import com.whatifplatform.common.model.ConfidenceLevel;

/**
 * Confidence and widening rules derived from baseline data coverage.
 *
 * <pre>
 *   adjustConfidence:  coverage &lt; 50 → low
 *                      50 ≤ coverage &lt; 75 → high downgraded to medium
 *                      otherwise unchanged
 *   shouldWiden:       coverage &lt; 50 OR confidence == low
 *   wideningFactor:    1.0 × (1.5 if coverage &lt; 50, 1.2 if coverage &lt; 75)
 *                          × (1.3 if low, 1.1 if medium)
 * </pre>
 *
 * Pure logic class. No WebClient. No logging.
 */
public final class BaselineQuality {

    public static final double LOW_COVERAGE_THRESHOLD     = 50.0;
    public static final double PARTIAL_COVERAGE_THRESHOLD = 75.0;

    private BaselineQuality() {}

    public static ConfidenceLevel adjustConfidence(ConfidenceLevel original, double coverage) {
        if (coverage < LOW_COVERAGE_THRESHOLD) return ConfidenceLevel.LOW;
        if (coverage < PARTIAL_COVERAGE_THRESHOLD && original == ConfidenceLevel.HIGH) {
            return ConfidenceLevel.MEDIUM;
        }
        return original;
    }

    public static boolean shouldWiden(double coverage, ConfidenceLevel confidence) {
        return coverage < LOW_COVERAGE_THRESHOLD || confidence == ConfidenceLevel.LOW;
    }

    /**
     * Compounding widening factor; always {@code >= 1.0}.
     */
    public static double wideningFactor(double coverage, ConfidenceLevel confidence) {
        double factor = 1.0;

        if (coverage < LOW_COVERAGE_THRESHOLD)          factor *= 1.5;
        else if (coverage < PARTIAL_COVERAGE_THRESHOLD) factor *= 1.2;

        factor *= switch (confidence) {
            case LOW    -> 1.3;
            case MEDIUM -> 1.1;
            case HIGH   -> 1.0;
        };
        return factor;
    }

    /**
     * Factor the pipeline actually applies: {@link #wideningFactor} when widening is
     * triggered, otherwise exactly 1.0.
     */
    public static double effectiveWideningFactor(double coverage, ConfidenceLevel confidence) {
        return shouldWiden(coverage, confidence) ? wideningFactor(coverage, confidence) : 1.0;
    }
}
