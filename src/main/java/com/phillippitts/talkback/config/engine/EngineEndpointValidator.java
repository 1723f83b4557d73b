package com.phillippitts.talkback.config.engine;

import com.phillippitts.talkback.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validates engine endpoint configuration at startup.
 *
 * <p>Fail-fast: abort startup with an actionable message when an engine base URL is not an
 * absolute http(s) URL. Reachability is not checked; servers may start after this service.
 */
@Component
@ConditionalOnProperty(name = "engines.validation.enabled", havingValue = "true", matchIfMissing = true)
class EngineEndpointValidator {

    private static final Logger LOG = LogManager.getLogger(EngineEndpointValidator.class);

    private final WhisperConfig whisper;
    private final OllamaConfig ollama;
    private final KokoroConfig kokoro;

    EngineEndpointValidator(WhisperConfig whisper, OllamaConfig ollama, KokoroConfig kokoro) {
        this.whisper = whisper;
        this.ollama = ollama;
        this.kokoro = kokoro;
    }

    @PostConstruct
    void validateAllOnStartup() {
        validateBaseUrl("stt.whisper.base-url", whisper.baseUrl());
        validateBaseUrl("llm.ollama.base-url", ollama.baseUrl());
        validateBaseUrl("tts.kokoro.base-url", kokoro.baseUrl());
        LOG.info("Engine endpoints: whisper='{}' (model={}), ollama='{}' (model={}), kokoro='{}' (voice={})",
                whisper.baseUrl(), whisper.model(), ollama.baseUrl(), ollama.model(),
                kokoro.baseUrl(), kokoro.voice());
    }

    // Visible for tests
    static void validateBaseUrl(String property, String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid URL for " + property + ": '" + value + "'", e);
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new ConfigurationException(property + " must use http or https, got: '" + value + "'");
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException(property + " has no host: '" + value + "'");
        }
    }
}
