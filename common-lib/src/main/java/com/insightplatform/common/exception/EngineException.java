package com.insightplatform.common.exception;

/**
 * Failure raised by an insight pipeline stage. The message is prefixed with the stage name.
 */
public class EngineException extends RuntimeException {
    private final String stage;

    public EngineException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public EngineException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
