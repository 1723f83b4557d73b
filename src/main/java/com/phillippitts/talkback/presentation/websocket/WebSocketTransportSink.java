package com.phillippitts.talkback.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.exception.TransportException;
import com.phillippitts.talkback.service.pipeline.TransportSink;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes pipeline output onto a WebSocket: audio as binary messages, events as
 * {@code {"type": ..., "data": ...}} text messages.
 *
 * <p>The session must be thread-safe for sending (a {@code ConcurrentWebSocketSessionDecorator}),
 * since synthesis and transcription lanes send from different threads.
 */
class WebSocketTransportSink implements TransportSink {

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    WebSocketTransportSink(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void sendAudio(Frame.AudioChunk chunk) {
        send(new BinaryMessage(chunk.samples()));
    }

    @Override
    public void sendEvent(String type, Map<String, Object> data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("data", data);
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to serialize '" + type + "' event", session.getId(), e);
        }
        send(new TextMessage(json));
    }

    private void send(WebSocketMessage<?> message) {
        if (!session.isOpen()) {
            throw new TransportException("Connection already closed", session.getId(), null);
        }
        try {
            session.sendMessage(message);
        } catch (IOException | IllegalStateException e) {
            // SessionLimitExceededException (slow client) is an IllegalStateException
            throw new TransportException("Failed to send " + message.getClass().getSimpleName(), session.getId(), e);
        }
    }
}
