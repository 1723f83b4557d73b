package com.phillippitts.talkback.service.stt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.talkback.config.engine.WhisperConfig;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionException;
import com.phillippitts.talkback.exception.TranscriptionException.Reason;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.audio.PcmConverter;
import com.phillippitts.talkback.service.audio.WavWriter;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineHealthTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Speech-to-text over an OpenAI-compatible Whisper server.
 *
 * <p>Each utterance is wrapped in an in-memory WAV file and uploaded as multipart form data to
 * {@code POST /v1/audio/transcriptions}. The JSON response's {@code text} field is the
 * transcript.
 *
 * <p>The call blocks the transcription lane until the server answers, the configured timeout
 * expires, or the session is cancelled; cancellation aborts the HTTP exchange.
 */
@Component
public class WhisperSttEngine implements SttEngine {

    private static final Logger LOG = LogManager.getLogger(WhisperSttEngine.class);

    static final String ENGINE_NAME = "whisper";
    static final String TRANSCRIPTIONS_PATH = "/v1/audio/transcriptions";

    private final WebClient webClient;
    private final WhisperConfig config;
    private final ObjectMapper objectMapper;
    private final EngineHealthTracker health = new EngineHealthTracker();

    public WhisperSttEngine(@Qualifier("whisperWebClient") WebClient webClient, WhisperConfig config,
                            ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public TranscriptionResult transcribe(float[] samples, int sampleRate, String language, CancellationToken token) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(token, "token must not be null");
        if (token.isCancelled()) {
            throw new TranscriptionException(Reason.CANCELLED, "Session cancelled before transcription", ENGINE_NAME);
        }

        byte[] pcm = PcmConverter.toPcm16(samples);
        byte[] wav = WavWriter.toWavBytes(pcm, sampleRate, AudioFormat.DEFAULT_CHANNELS);
        Duration audioDuration = AudioFormat.durationOf(pcm.length, sampleRate, AudioFormat.DEFAULT_CHANNELS);
        String effectiveLanguage = language == null || language.isBlank() ? config.language() : language;

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", wav)
                .header("Content-Disposition", "form-data; name=file; filename=utterance.wav")
                .contentType(MediaType.parseMediaType("audio/wav"));
        builder.part("model", config.model());
        builder.part("language", effectiveLanguage);
        builder.part("response_format", "json");

        CompletableFuture<String> call = webClient.post()
                .uri(TRANSCRIPTIONS_PATH)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .toFuture();
        Runnable deregister = token.onCancel(() -> call.cancel(true));

        try {
            String body = call.get(config.timeoutMs(), TimeUnit.MILLISECONDS);
            String text = parseText(body);
            health.recordSuccess();
            LOG.debug("Whisper transcribed {} of audio into {} chars", audioDuration, text.length());
            return TranscriptionResult.of(text, audioDuration, ENGINE_NAME);
        } catch (CancellationException e) {
            throw new TranscriptionException(Reason.CANCELLED, "Transcription cancelled", ENGINE_NAME, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new TranscriptionException(Reason.CANCELLED, "Transcription interrupted", ENGINE_NAME, e);
        } catch (TimeoutException e) {
            call.cancel(true);
            health.recordFailure();
            throw new TranscriptionException(Reason.ENGINE_FAILURE,
                    "Transcription timed out after " + config.timeoutMs() + "ms", ENGINE_NAME, e);
        } catch (ExecutionException e) {
            health.recordFailure();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TranscriptionException(Reason.ENGINE_FAILURE,
                    "Transcription request failed: " + cause.getMessage(), ENGINE_NAME, cause);
        } finally {
            deregister.run();
        }
    }

    private String parseText(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return "";
            }
            return root.path("text").asText("").trim();
        } catch (IOException e) {
            health.recordFailure();
            throw new TranscriptionException(Reason.ENGINE_FAILURE,
                    "Unreadable transcription response", ENGINE_NAME, e);
        }
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
