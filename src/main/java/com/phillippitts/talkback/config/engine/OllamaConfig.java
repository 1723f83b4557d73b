package com.phillippitts.talkback.config.engine;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Ollama language model server.
 * Binds to properties prefixed with "llm.ollama".
 *
 * @param baseUrl       root URL of the Ollama server
 * @param model         chat model, pulled beforehand ({@code ollama pull llama3.2})
 * @param idleTimeoutMs maximum wait between two streamed tokens
 */
@ConfigurationProperties(prefix = "llm.ollama")
@Validated
public record OllamaConfig(
        @NotBlank(message = "Ollama base URL must not be blank")
        String baseUrl,

        @NotBlank(message = "Ollama model must not be blank")
        String model,

        @Positive(message = "Idle timeout must be positive")
        long idleTimeoutMs
) {
    public OllamaConfig {
        baseUrl = baseUrl == null ? "http://localhost:11434" : baseUrl;
        model = model == null ? "llama3.2" : model;
        idleTimeoutMs = idleTimeoutMs <= 0 ? 30_000 : idleTimeoutMs;
    }
}
