package com.whatifplatform.common.roi;

/**
 * Break-even and loss probabilities, both percentages.
 */
public record RoiProbabilities(double breakEven, double loss) {

    public double sum() {
        return breakEven + loss;
    }
}
