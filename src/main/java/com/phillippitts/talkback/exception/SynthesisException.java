package com.phillippitts.talkback.exception;

/**
 * Thrown when the text-to-speech engine fails to synthesize a phrase.
 */
public class SynthesisException extends TalkBackException {

    private final String engineName;

    public SynthesisException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SynthesisException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
