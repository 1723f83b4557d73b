package com.phillippitts.talkback.exception;

import java.util.Objects;

/**
 * Thrown when an utterance does not produce a usable transcript.
 *
 * <p>The {@link Reason} tells the transcription stage how to react: an empty result is
 * discarded quietly, an engine failure is reported upstream, and a cancelled call is dropped.
 */
public class TranscriptionException extends TalkBackException {

    public enum Reason {
        /** The engine answered but the text was blank. */
        EMPTY_RESULT,
        /** The engine call failed, timed out or returned an unreadable body. */
        ENGINE_FAILURE,
        /** The session was cancelled while the call was in flight. */
        CANCELLED
    }

    private final Reason reason;
    private final String engineName;

    public TranscriptionException(Reason reason, String message) {
        this(reason, message, "unknown", null);
    }

    public TranscriptionException(Reason reason, String message, String engineName) {
        this(reason, message, engineName, null);
    }

    public TranscriptionException(Reason reason, String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.engineName = engineName;
    }

    public Reason getReason() {
        return reason;
    }

    public String getEngineName() {
        return engineName;
    }
}
