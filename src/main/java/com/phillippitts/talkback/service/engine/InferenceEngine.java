package com.phillippitts.talkback.service.engine;

/**
 * Common surface of the speech-to-text, language-model and text-to-speech engines.
 */
public interface InferenceEngine {

    /**
     * Returns the name of this engine for logging and monitoring.
     *
     * @return engine name (e.g. "whisper", "ollama", "kokoro")
     */
    String getEngineName();

    /**
     * Checks whether recent calls succeeded.
     *
     * @return false after repeated consecutive failures, until the next success
     */
    boolean isHealthy();
}
