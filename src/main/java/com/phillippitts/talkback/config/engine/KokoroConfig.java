package com.phillippitts.talkback.config.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Kokoro text-to-speech server.
 * Binds to properties prefixed with "tts.kokoro".
 *
 * @param baseUrl       root URL of an OpenAI-compatible speech server (e.g. Kokoro-FastAPI)
 * @param model         model name sent with each request
 * @param voice         voice identifier
 * @param sampleRate    sample rate of the raw PCM the server returns
 * @param speed         speaking rate multiplier
 * @param idleTimeoutMs maximum wait between two audio chunks
 */
@ConfigurationProperties(prefix = "tts.kokoro")
@Validated
public record KokoroConfig(
        @NotBlank(message = "Kokoro base URL must not be blank")
        String baseUrl,

        @NotBlank(message = "Kokoro model must not be blank")
        String model,

        @NotBlank(message = "Kokoro voice must not be blank")
        String voice,

        @Positive(message = "Sample rate must be positive")
        int sampleRate,

        @Positive(message = "Speed must be positive")
        double speed,

        @Positive(message = "Idle timeout must be positive")
        long idleTimeoutMs
) {
    public KokoroConfig {
        baseUrl = baseUrl == null ? "http://localhost:8880" : baseUrl;
        model = model == null ? "kokoro" : model;
        voice = voice == null ? "af_sarah" : voice;
        sampleRate = sampleRate <= 0 ? 24_000 : sampleRate;
        speed = speed <= 0 ? 1.0 : speed;
        idleTimeoutMs = idleTimeoutMs <= 0 ? 15_000 : idleTimeoutMs;
    }
}
