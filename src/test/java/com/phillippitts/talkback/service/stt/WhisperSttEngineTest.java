package com.phillippitts.talkback.service.stt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.talkback.config.engine.WebClientConfig;
import com.phillippitts.talkback.config.engine.WhisperConfig;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionException;
import com.phillippitts.talkback.exception.TranscriptionException.Reason;
import com.phillippitts.talkback.service.engine.CancellationToken;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WhisperSttEngineTest {

    private static final float[] ONE_SECOND = new float[16_000];

    private MockWebServer server;
    private WhisperSttEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        engine = engine(5_000);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private WhisperSttEngine engine(long timeoutMs) {
        String baseUrl = "http://" + server.getHostName() + ":" + server.getPort();
        WhisperConfig config = new WhisperConfig(baseUrl, "large-v3-turbo", "en", timeoutMs);
        return new WhisperSttEngine(new WebClientConfig().whisperWebClient(config), config, new ObjectMapper());
    }

    private void enqueueJson(String body) {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body));
    }

    @Test
    void shouldUploadWavAndParseTranscript() throws Exception {
        enqueueJson("{\"text\": \"  hello world \"}");

        TranscriptionResult result = engine.transcribe(ONE_SECOND, 16_000, "de", new CancellationToken());

        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.engineName()).isEqualTo("whisper");
        assertThat(result.audioDuration()).isEqualTo(Duration.ofSeconds(1));
        assertThat(engine.isHealthy()).isTrue();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/v1/audio/transcriptions");
        assertThat(request.getHeader("Content-Type")).startsWith("multipart/form-data");
        String body = request.getBody().readUtf8();
        assertThat(body)
                .contains("RIFF")
                .contains("filename=utterance.wav")
                .contains("large-v3-turbo")
                .contains("de");
    }

    @Test
    void shouldFallBackToConfiguredLanguage() throws Exception {
        enqueueJson("{\"text\": \"bonjour\"}");

        engine.transcribe(ONE_SECOND, 16_000, " ", new CancellationToken());

        String body = server.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8();
        assertThat(body).contains("name=\"language\"").contains("\r\n\r\nen\r\n");
    }

    @Test
    void shouldReturnEmptyTextWhenServerHeardNothing() {
        enqueueJson("{}");

        TranscriptionResult result = engine.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken());

        assertThat(result.isBlank()).isTrue();
    }

    @Test
    void shouldMapServerErrorToEngineFailure() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("model exploded"));

        TranscriptionException ex = catchThrowableOfType(
                () -> engine.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken()),
                TranscriptionException.class);

        assertThat(ex.getReason()).isEqualTo(Reason.ENGINE_FAILURE);
        assertThat(ex.getEngineName()).isEqualTo("whisper");
    }

    @Test
    void shouldMapUnreadableBodyToEngineFailure() {
        enqueueJson("not json at all {");

        assertThatThrownBy(() -> engine.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken()))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unreadable transcription response");
    }

    @Test
    void shouldReportUnhealthyAfterRepeatedFailures() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
            assertThatThrownBy(() -> engine.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken()))
                    .isInstanceOf(TranscriptionException.class);
        }

        assertThat(engine.isHealthy()).isFalse();

        enqueueJson("{\"text\": \"back\"}");
        engine.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken());
        assertThat(engine.isHealthy()).isTrue();
    }

    @Test
    void shouldTimeOutSlowServer() {
        WhisperSttEngine impatient = engine(200);
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"text\": \"too late\"}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        TranscriptionException ex = catchThrowableOfType(
                () -> impatient.transcribe(ONE_SECOND, 16_000, "en", new CancellationToken()),
                TranscriptionException.class);

        assertThat(ex.getReason()).isEqualTo(Reason.ENGINE_FAILURE);
    }

    @Test
    void shouldNotCallServerWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        TranscriptionException ex = catchThrowableOfType(
                () -> engine.transcribe(ONE_SECOND, 16_000, "en", token), TranscriptionException.class);

        assertThat(ex.getReason()).isEqualTo(Reason.CANCELLED);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldAbortInFlightRequestOnCancel() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"text\": \"never delivered\"}")
                .setHeadersDelay(3, TimeUnit.SECONDS));
        CancellationToken token = new CancellationToken();

        CompletableFuture<Throwable> failure = CompletableFuture.supplyAsync(() -> {
            try {
                engine.transcribe(ONE_SECOND, 16_000, "en", token);
                return null;
            } catch (TranscriptionException e) {
                return e;
            }
        });
        server.takeRequest(1, TimeUnit.SECONDS);
        token.cancel();

        assertThat(failure.get(1, TimeUnit.SECONDS))
                .isInstanceOfSatisfying(TranscriptionException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.CANCELLED));
    }
}
