package com.phillippitts.talkback.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of one speech-to-text call.
 *
 * @param text          the transcribed text (may be empty when the audio held no speech)
 * @param audioDuration length of the audio that was transcribed
 * @param timestamp     when the transcription completed
 * @param engineName    name of the engine that produced the text (e.g. "whisper")
 */
public record TranscriptionResult(
        String text,
        Duration audioDuration,
        Instant timestamp,
        String engineName
) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if any component is null
     * @throws IllegalArgumentException if the duration is negative
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        Objects.requireNonNull(audioDuration, "Audio duration must not be null");
        if (audioDuration.isNegative()) {
            throw new IllegalArgumentException("Audio duration must not be negative, got: " + audioDuration);
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(engineName, "Engine name must not be null");
    }

    /**
     * Creates a result stamped with the current time.
     */
    public static TranscriptionResult of(String text, Duration audioDuration, String engineName) {
        return new TranscriptionResult(text, audioDuration, Instant.now(), engineName);
    }

    /** True when the engine returned nothing but whitespace. */
    public boolean isBlank() {
        return text.isBlank();
    }
}
