package com.phillippitts.talkback.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One unit of data flowing through the pipeline.
 *
 * <p>The set of frames is closed: every variant is a record nested in this interface and
 * reports its {@link FrameType}, so stage boundaries can {@code switch} over
 * {@link #type()} exhaustively instead of probing runtime classes.
 *
 * <p>Frames are immutable once created. A frame instance is consumed by exactly one stage;
 * forwarding hands ownership to the next stage.
 */
public sealed interface Frame
        permits Frame.AudioChunk,
                Frame.PartialTranscript,
                Frame.FinalTranscript,
                Frame.TextDelta,
                Frame.ControlSignal,
                Frame.UtteranceReady,
                Frame.StageError {

    /**
     * Discriminator for the frame variants.
     */
    enum FrameType {
        AUDIO_CHUNK,
        PARTIAL_TRANSCRIPT,
        FINAL_TRANSCRIPT,
        TEXT_DELTA,
        CONTROL_SIGNAL,
        UTTERANCE_READY,
        STAGE_ERROR
    }

    FrameType type();

    /**
     * Raw PCM16LE audio, inbound from the transport or outbound from synthesis.
     *
     * <p>The sample array is copied on construction and on access.
     */
    record AudioChunk(byte[] samples, int sampleRate, int channels) implements Frame {

        public AudioChunk {
            Objects.requireNonNull(samples, "samples must not be null");
            if (sampleRate <= 0) {
                throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
            }
            if (channels <= 0) {
                throw new IllegalArgumentException("channels must be positive, got: " + channels);
            }
            samples = samples.clone();
        }

        @Override
        public byte[] samples() {
            return samples.clone();
        }

        /** Number of audio bytes, without copying the payload. */
        public int length() {
            return samples.length;
        }

        /**
         * Copies the bytes {@code [from, to)} into a chunk of the same format.
         *
         * @throws IndexOutOfBoundsException if the range is outside the payload
         */
        public AudioChunk slice(int from, int to) {
            Objects.checkFromToIndex(from, to, samples.length);
            return new AudioChunk(Arrays.copyOfRange(samples, from, to), sampleRate, channels);
        }

        @Override
        public FrameType type() {
            return FrameType.AUDIO_CHUNK;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AudioChunk other
                    && sampleRate == other.sampleRate
                    && channels == other.channels
                    && Arrays.equals(samples, other.samples);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(sampleRate, channels) + Arrays.hashCode(samples);
        }

        @Override
        public String toString() {
            return "AudioChunk[bytes=" + samples.length + ", sampleRate=" + sampleRate
                    + ", channels=" + channels + "]";
        }
    }

    record PartialTranscript(String text) implements Frame {
        public PartialTranscript {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public FrameType type() {
            return FrameType.PARTIAL_TRANSCRIPT;
        }
    }

    record FinalTranscript(String text) implements Frame {
        public FinalTranscript {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public FrameType type() {
            return FrameType.FINAL_TRANSCRIPT;
        }
    }

    /** One increment of language-model output, in engine order. */
    record TextDelta(String text) implements Frame {
        public TextDelta {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public FrameType type() {
            return FrameType.TEXT_DELTA;
        }
    }

    record ControlSignal(Kind kind) implements Frame {

        public enum Kind {
            UTTERANCE_START,
            UTTERANCE_END,
            CANCEL,
            SHUTDOWN,
            /** Opens one assistant response. */
            RESPONSE_START,
            /** Closes one assistant response; synthesis flushes its pending phrase. */
            RESPONSE_END,
            /** Client is ready; the generation stage may greet. */
            KICKOFF
        }

        public ControlSignal {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        public static ControlSignal of(Kind kind) {
            return new ControlSignal(kind);
        }

        public boolean isTermination() {
            return kind == Kind.CANCEL || kind == Kind.SHUTDOWN;
        }

        @Override
        public FrameType type() {
            return FrameType.CONTROL_SIGNAL;
        }
    }

    /** A flushed utterance travelling from the session to the transcription stage. */
    record UtteranceReady(Utterance utterance) implements Frame {
        public UtteranceReady {
            Objects.requireNonNull(utterance, "utterance must not be null");
        }

        @Override
        public FrameType type() {
            return FrameType.UTTERANCE_READY;
        }
    }

    /**
     * Failure report travelling upstream to the runner.
     *
     * @param stage  name of the reporting stage
     * @param reason short machine-readable reason (e.g. "empty-result", "engine-failure")
     * @param message human-readable detail; never contains transcript text
     * @param fatal  whether the session must be cancelled
     */
    record StageError(String stage, String reason, String message, boolean fatal) implements Frame {
        public StageError {
            Objects.requireNonNull(stage, "stage must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
            message = message == null ? "" : message;
        }

        public static StageError recoverable(String stage, String reason, String message) {
            return new StageError(stage, reason, message, false);
        }

        public static StageError fatal(String stage, String reason, String message) {
            return new StageError(stage, reason, message, true);
        }

        @Override
        public FrameType type() {
            return FrameType.STAGE_ERROR;
        }
    }
}
