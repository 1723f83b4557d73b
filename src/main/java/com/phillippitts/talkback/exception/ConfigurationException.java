package com.phillippitts.talkback.exception;

/**
 * Thrown when required configuration is missing or invalid.
 * Raised at startup or session creation; the session is never started.
 */
public class ConfigurationException extends TalkBackException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
