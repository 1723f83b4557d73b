package com.phillippitts.talkback.config.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper speech-to-text server.
 * Binds to properties prefixed with "stt.whisper".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper.base-url=http://localhost:8000
 * stt.whisper.model=large-v3-turbo
 * stt.whisper.language=en
 * stt.whisper.timeout-ms=15000
 * </pre>
 *
 * @param baseUrl   root URL of an OpenAI-compatible transcription server
 * @param model     model name sent with each request
 * @param language  language hint (e.g. "en", "es")
 * @param timeoutMs maximum time to wait for one transcription
 */
@ConfigurationProperties(prefix = "stt.whisper")
@Validated
public record WhisperConfig(
        @NotBlank(message = "Whisper base URL must not be blank")
        String baseUrl,

        @NotBlank(message = "Whisper model must not be blank")
        String model,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Timeout must be positive")
        long timeoutMs
) {
    public WhisperConfig {
        baseUrl = baseUrl == null ? "http://localhost:8000" : baseUrl;
        model = model == null ? "large-v3-turbo" : model;
        language = language == null ? "en" : language;
        timeoutMs = timeoutMs <= 0 ? 15_000 : timeoutMs;
    }
}
