package com.phillippitts.talkback.exception;

/**
 * Thrown when outbound data cannot be delivered to the client.
 * Fatal to the session that owns the transport.
 */
public class TransportException extends TalkBackException {

    private final String sessionId;

    public TransportException(String message, String sessionId, Throwable cause) {
        super(message + " (session: " + sessionId + ")", cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
