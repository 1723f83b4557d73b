package com.phillippitts.talkback.presentation.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.pipeline.PipelineRunner;
import com.phillippitts.talkback.service.pipeline.SessionFactory;
import com.phillippitts.talkback.service.pipeline.TransportEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket transport for the voice pipeline.
 *
 * <p>Inbound protocol:
 * <ul>
 *   <li>binary messages: raw PCM16LE audio, 16 kHz mono unless the connection URI carries
 *       {@code sampleRate} / {@code channels} query parameters</li>
 *   <li>text messages: {@code {"type": "client-ready" | "vad-start" | "vad-end" | "cancel"}}</li>
 * </ul>
 *
 * <p>Outbound: synthesized audio as binary messages and {@code user-transcript},
 * {@code bot-text} and {@code error} events as text messages.
 *
 * <p>Each connection gets its own {@link PipelineRunner}. When the runner closes (cancel, fatal
 * error) the socket is closed too.
 */
@Component
public class PipelineWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(PipelineWebSocketHandler.class);

    static final int MESSAGE_SIZE_LIMIT = 1_048_576;
    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final long SHUTDOWN_WAIT_MS = 5_000;

    private final SessionFactory sessionFactory;
    private final ObjectMapper objectMapper;
    private final Map<String, PipelineRunner> runners = new ConcurrentHashMap<>();

    public PipelineWebSocketHandler(SessionFactory sessionFactory, ObjectMapper objectMapper) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        rawSession.setTextMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        rawSession.setBinaryMessageSizeLimit(MESSAGE_SIZE_LIMIT);
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS,
                MESSAGE_SIZE_LIMIT);
        String sessionId = rawSession.getId();

        PipelineRunner runner;
        try {
            runner = sessionFactory.create(sessionId, new WebSocketTransportSink(session, objectMapper));
        } catch (RuntimeException e) {
            LOG.error("Failed to create pipeline for session {}", sessionId, e);
            session.close(CloseStatus.SERVER_ERROR.withReason("Pipeline initialization failed"));
            return;
        }
        runners.put(sessionId, runner);
        runner.closed().whenComplete((reason, error) -> {
            runners.remove(sessionId, runner);
            closeSocket(session, reason);
        });

        String participant = Optional.ofNullable(rawSession.getRemoteAddress()).map(Object::toString).orElse("");
        LOG.info("Client connected: session={}, remote={}", sessionId, participant);
        runner.dispatch(new TransportEvent.ClientConnected(participant));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PipelineRunner runner = runners.get(session.getId());
        if (runner == null) {
            LOG.debug("Text message for unknown session {}", session.getId());
            return;
        }
        String type;
        try {
            JsonNode root = objectMapper.readTree(message.getPayload());
            type = root.path("type").asText("");
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring malformed control message on session {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        switch (type) {
            case "client-ready" -> runner.dispatch(new TransportEvent.ClientReady());
            case "vad-start" -> runner.dispatch(new TransportEvent.VoiceActivity(Kind.UTTERANCE_START));
            case "vad-end" -> runner.dispatch(new TransportEvent.VoiceActivity(Kind.UTTERANCE_END));
            case "cancel" -> runner.dispatch(new TransportEvent.CancelRequested());
            default -> LOG.warn("Unsupported control message type '{}' on session {}", type, session.getId());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        PipelineRunner runner = runners.get(session.getId());
        if (runner == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] pcm = new byte[payload.remaining()];
        payload.get(pcm);
        URI uri = session.getUri();
        int sampleRate = readIntQuery(uri, "sampleRate", AudioFormat.DEFAULT_SAMPLE_RATE);
        int channels = readIntQuery(uri, "channels", AudioFormat.DEFAULT_CHANNELS);
        runner.dispatch(new TransportEvent.AudioReceived(new Frame.AudioChunk(pcm, sampleRate, channels)));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Transport error on session {}: {}", session.getId(),
                exception == null ? "unknown" : exception.getMessage());
        PipelineRunner runner = runners.get(session.getId());
        if (runner != null) {
            runner.dispatch(new TransportEvent.ClientDisconnected("transport-error"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        PipelineRunner runner = runners.get(session.getId());
        if (runner != null) {
            LOG.info("Client disconnected: session={}, status={}", session.getId(), status.getCode());
            runner.dispatch(new TransportEvent.ClientDisconnected(String.valueOf(status.getCode())));
        }
    }

    /**
     * Number of sessions whose pipeline has not closed yet.
     */
    public int activeSessions() {
        return runners.size();
    }

    /**
     * Cancels every live session and waits a bounded time for them to close.
     */
    @PreDestroy
    public void shutdown() {
        if (runners.isEmpty()) {
            return;
        }
        LOG.info("Shutting down {} active session(s)", runners.size());
        CompletableFuture<?>[] pending = runners.values().stream()
                .map(runner -> runner.cancel("shutdown"))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(pending).get(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for sessions to close");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Not every session closed cleanly on shutdown: {}", e.toString());
        }
    }

    private void closeSocket(WebSocketSession session, String reason) {
        if (!session.isOpen()) {
            return;
        }
        CloseStatus status = "fatal-error".equals(reason) ? CloseStatus.SERVER_ERROR : CloseStatus.NORMAL;
        try {
            session.close(status.withReason(reason == null ? "closed" : reason));
        } catch (IOException e) {
            LOG.warn("Failed to close socket for session {}: {}", session.getId(), e.getMessage());
        }
    }

    static int readIntQuery(URI uri, String key, int defaultValue) {
        if (uri == null || uri.getQuery() == null || uri.getQuery().isBlank()) {
            return defaultValue;
        }
        for (String pair : uri.getQuery().split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && key.equals(kv[0])) {
                try {
                    int value = Integer.parseInt(kv[1]);
                    return value > 0 ? value : defaultValue;
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring non-numeric query parameter {}={}", key, kv[1]);
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }
}
