package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.config.engine.KokoroConfig;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.engine.BlockingFluxIterator;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineHealthTracker;
import com.phillippitts.talkback.service.engine.EngineStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Text-to-speech over a Kokoro server exposing the OpenAI-compatible speech endpoint.
 *
 * <p>Sends {@code POST /v1/audio/speech} with {@code response_format: pcm} and streams the raw
 * 16-bit mono PCM body as it arrives.
 */
@Component
public class KokoroTtsEngine implements TtsEngine {

    private static final Logger LOG = LogManager.getLogger(KokoroTtsEngine.class);

    static final String ENGINE_NAME = "kokoro";
    static final String SPEECH_PATH = "/v1/audio/speech";

    private final WebClient webClient;
    private final KokoroConfig config;
    private final EngineHealthTracker health = new EngineHealthTracker();

    public KokoroTtsEngine(@Qualifier("kokoroWebClient") WebClient webClient, KokoroConfig config) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public EngineStream<byte[]> synthesize(String text, CancellationToken token) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }

        Map<String, Object> payload = Map.of(
                "model", config.model(),
                "input", text,
                "voice", config.voice(),
                "response_format", "pcm",
                "speed", config.speed(),
                "stream", true
        );
        LOG.debug("Requesting speech for {} chars with voice {}", text.length(), config.voice());

        Flux<byte[]> audio = webClient.post()
                .uri(SPEECH_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(payload)
                .retrieve()
                .bodyToFlux(DataBuffer.class)
                .map(KokoroTtsEngine::toBytes)
                .doOnComplete(health::recordSuccess)
                .doOnError(e -> health.recordFailure());

        return new BlockingFluxIterator<>(audio, token, Duration.ofMillis(config.idleTimeoutMs()),
                this::toSynthesisException);
    }

    @Override
    public int outputSampleRate() {
        return config.sampleRate();
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public boolean isHealthy() {
        return health.isHealthy();
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private RuntimeException toSynthesisException(Throwable error) {
        if (error instanceof TimeoutException) {
            health.recordFailure();
        }
        if (error instanceof SynthesisException synthesisException) {
            return synthesisException;
        }
        return new SynthesisException("Speech stream failed: " + error.getMessage(), ENGINE_NAME, error);
    }
}
