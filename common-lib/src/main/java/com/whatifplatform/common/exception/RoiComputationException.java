package com.whatifplatform.common.exception;

/**
 * Raised when neither the ROI-attribution system nor the local fallback can produce
 * a usable ROI range. The only failure that aborts a simulation after validation.
 */
public class RoiComputationException extends SimulatorException {

    public static final String STAGE = "RoiComputation";

    public RoiComputationException(String message) {
        super(STAGE, message);
    }

    public RoiComputationException(String message, Throwable cause) {
        super(STAGE, message, cause);
    }
}
