package com.phillippitts.talkback.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the per-session frame pipeline.
 *
 * <p>Example application.properties:
 * <pre>
 * pipeline.utterance.threshold-bytes=32000
 * pipeline.utterance.max-bytes=960000
 * pipeline.vad.enabled=false
 * pipeline.conversation.greeting-mode=GENERATED
 * pipeline.cancel-timeout-ms=2000
 * </pre>
 *
 * <p>Every missing value falls back to its default.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    public enum GreetingMode { NONE, STATIC, GENERATED }

    @Valid
    @NotNull
    private final Utterance utterance;

    @Valid
    @NotNull
    private final Vad vad;

    @Valid
    @NotNull
    private final Conversation conversation;

    /**
     * Upper bound on waiting for every stage to acknowledge cancellation.
     */
    @Positive
    private final long cancelTimeoutMs;

    @ConstructorBinding
    public PipelineProperties(Utterance utterance, Vad vad, Conversation conversation, Long cancelTimeoutMs) {
        this.utterance = utterance == null ? new Utterance(null, null, null) : utterance;
        this.vad = vad == null ? new Vad(null, null, null, null, null) : vad;
        this.conversation = conversation == null
                ? new Conversation(null, null, null, null, null) : conversation;
        this.cancelTimeoutMs = cancelTimeoutMs == null ? 2000L : cancelTimeoutMs;
    }

    /**
     * All defaults; used by tests.
     */
    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null);
    }

    public Utterance getUtterance() {
        return utterance;
    }

    public Vad getVad() {
        return vad;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public long getCancelTimeoutMs() {
        return cancelTimeoutMs;
    }

    /**
     * Utterance flushing.
     *
     * @param thresholdBytes flush size when no voice-activity signal is seen (1 s at 16 kHz mono)
     * @param maxBytes       safety cap once voice-activity signals drive flushing (30 s)
     * @param preRollBytes   audio kept from before a start-of-speech signal (200 ms)
     */
    public record Utterance(
            @Positive Integer thresholdBytes,
            @Positive Integer maxBytes,
            @Min(0) Integer preRollBytes
    ) {
        public Utterance {
            thresholdBytes = thresholdBytes == null ? 32_000 : thresholdBytes;
            maxBytes = maxBytes == null ? 960_000 : maxBytes;
            preRollBytes = preRollBytes == null ? 6_400 : preRollBytes;
        }
    }

    /**
     * Built-in energy voice-activity detection, used when the client sends no VAD signals.
     */
    public record Vad(
            @NotNull Boolean enabled,
            @Positive Integer startThreshold,
            @Positive Integer stopThreshold,
            @Positive Integer windowMs,
            @Positive Integer hangoverMs
    ) {
        public Vad {
            enabled = enabled != null && enabled;
            startThreshold = startThreshold == null ? 800 : startThreshold;
            stopThreshold = stopThreshold == null ? 500 : stopThreshold;
            windowMs = windowMs == null ? 20 : windowMs;
            hangoverMs = hangoverMs == null ? 700 : hangoverMs;
        }
    }

    /**
     * Conversation behaviour.
     *
     * @param fallbackResponse spoken when the language model fails mid-response
     * @param greetingMode     what the bot says once the client is ready
     * @param greetingText     text for {@link GreetingMode#STATIC}
     * @param minPhraseChars   shortest phrase sent to speech synthesis at a sentence boundary
     * @param maxPhraseChars   longest phrase before splitting at a word boundary
     */
    public record Conversation(
            @NotBlank String fallbackResponse,
            @NotNull GreetingMode greetingMode,
            String greetingText,
            @Min(1) Integer minPhraseChars,
            @Min(1) Integer maxPhraseChars
    ) {
        public Conversation {
            fallbackResponse = fallbackResponse == null || fallbackResponse.isBlank()
                    ? "I'm sorry, but I encountered an error while trying to respond." : fallbackResponse;
            greetingMode = greetingMode == null ? GreetingMode.GENERATED : greetingMode;
            greetingText = greetingText == null ? "" : greetingText;
            minPhraseChars = minPhraseChars == null ? 20 : minPhraseChars;
            maxPhraseChars = maxPhraseChars == null ? 200 : maxPhraseChars;
            if (maxPhraseChars < minPhraseChars) {
                throw new IllegalArgumentException("maxPhraseChars must be >= minPhraseChars");
            }
        }
    }
}
