package com.phillippitts.talkback.exception;

/**
 * Thrown when the language model cannot produce a completion.
 * This may occur due to connection errors, timeouts, or an error reported by the model server.
 */
public class GenerationException extends TalkBackException {

    private final String engineName;

    public GenerationException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public GenerationException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
