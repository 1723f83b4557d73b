package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.exception.TransportException;

import java.util.Map;

/**
 * Outbound side of the client connection.
 *
 * <p>Implementations must be safe to call from pipeline threads. Both methods throw
 * {@link TransportException} when delivery fails; the session treats that as fatal.
 */
public interface TransportSink {

    /** Sends synthesized audio to the client. */
    void sendAudio(Frame.AudioChunk chunk);

    /**
     * Sends a JSON event to the client.
     *
     * @param type event type (user-transcript, bot-text, error)
     * @param data event payload
     */
    void sendEvent(String type, Map<String, Object> data);
}
