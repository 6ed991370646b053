package com.whatifplatform.common.exception;

public class SimulatorException extends RuntimeException {
    private final String stage;

    public SimulatorException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public SimulatorException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
