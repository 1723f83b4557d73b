package com.phillippitts.talkback.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.talkback.config.engine.OllamaConfig;
import com.phillippitts.talkback.domain.Message;
import com.phillippitts.talkback.exception.GenerationException;
import com.phillippitts.talkback.service.engine.BlockingFluxIterator;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineHealthTracker;
import com.phillippitts.talkback.service.engine.EngineStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Streaming chat completions from a local Ollama server.
 *
 * <p>Sends {@code POST /api/chat} with {@code stream: true}. The server answers with
 * newline-delimited JSON; each line carries the next increment in {@code message.content}
 * and the last one has {@code done: true}. A line with an {@code error} field fails the stream.
 */
@Component
public class OllamaLlmEngine implements LlmEngine {

    private static final Logger LOG = LogManager.getLogger(OllamaLlmEngine.class);

    static final String ENGINE_NAME = "ollama";
    static final String CHAT_PATH = "/api/chat";

    private final WebClient webClient;
    private final OllamaConfig config;
    private final ObjectMapper objectMapper;
    private final EngineHealthTracker health = new EngineHealthTracker();

    public OllamaLlmEngine(@Qualifier("ollamaWebClient") WebClient webClient, OllamaConfig config,
                           ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public EngineStream<String> streamChat(List<Message> messages, CancellationToken token) {
        Objects.requireNonNull(messages, "messages must not be null");
        Objects.requireNonNull(token, "token must not be null");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", messages.stream()
                .map(m -> Map.of("role", m.role().wireName(), "content", m.content()))
                .toList());
        payload.put("stream", true);

        LOG.debug("Requesting chat completion from {} with {} message(s)", config.model(), messages.size());

        Flux<String> increments = webClient.post()
                .uri(CHAT_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_NDJSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(String.class)
                .filter(line -> !line.isBlank())
                .handle((line, sink) -> {
                    try {
                        JsonNode node = objectMapper.readTree(line);
                        if (node.hasNonNull("error")) {
                            sink.error(new GenerationException("Model server error: " + node.get("error").asText(),
                                    ENGINE_NAME));
                            return;
                        }
                        String content = node.path("message").path("content").asText("");
                        if (!content.isEmpty()) {
                            sink.next(content);
                        }
                        if (node.path("done").asBoolean(false)) {
                            sink.complete();
                        }
                    } catch (JsonProcessingException e) {
                        sink.error(new GenerationException("Unreadable stream line from model server", ENGINE_NAME, e));
                    }
                });

        Flux<String> tracked = increments
                .doOnComplete(health::recordSuccess)
                .doOnError(e -> health.recordFailure());

        return new BlockingFluxIterator<>(tracked, token, Duration.ofMillis(config.idleTimeoutMs()),
                this::toGenerationException);
    }

    private RuntimeException toGenerationException(Throwable error) {
        if (error instanceof TimeoutException) {
            health.recordFailure();
        }
        if (error instanceof GenerationException generationException) {
            return generationException;
        }
        return new GenerationException("Chat stream failed: " + error.getMessage(), ENGINE_NAME, error);
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public boolean isHealthy() {
        return health.isHealthy();
    }
}
