package com.phillippitts.talkback.domain;

import java.io.ByteArrayOutputStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable accumulator for one span of user speech.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * OPEN → FLUSHING (via markFlushing, when a flush condition fires)
 * FLUSHING → CLOSED (via drain, when the audio is handed to transcription)
 * </pre>
 *
 * <p>Not thread-safe. The buffer owns an utterance while it is OPEN; ownership moves to the
 * transcription stage together with the {@link Frame.UtteranceReady} frame.
 */
public final class Utterance {

    public enum State { OPEN, FLUSHING, CLOSED }

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final int sampleRate;
    private final int channels;
    private ByteArrayOutputStream audio = new ByteArrayOutputStream();
    private int byteCount;
    private State state = State.OPEN;

    public Utterance(int sampleRate, int channels) {
        if (sampleRate <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate and channels must be positive");
        }
        this.id = SEQUENCE.incrementAndGet();
        this.sampleRate = sampleRate;
        this.channels = channels;
    }

    /**
     * Appends a chunk of audio.
     *
     * @throws IllegalStateException if the utterance is no longer OPEN
     * @throws IllegalArgumentException if the chunk format differs from this utterance
     */
    public void append(Frame.AudioChunk chunk) {
        if (state != State.OPEN) {
            throw new IllegalStateException("Cannot append to utterance " + id + " in state " + state);
        }
        if (chunk.sampleRate() != sampleRate || chunk.channels() != channels) {
            throw new IllegalArgumentException("Audio format changed mid-utterance: expected "
                    + sampleRate + "Hz/" + channels + "ch, got "
                    + chunk.sampleRate() + "Hz/" + chunk.channels() + "ch");
        }
        audio.writeBytes(chunk.samples());
        byteCount += chunk.length();
    }

    public void markFlushing() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Utterance " + id + " already " + state);
        }
        state = State.FLUSHING;
    }

    /**
     * Hands the accumulated audio over and closes the utterance.
     *
     * @return the concatenated PCM bytes, in append order
     * @throws IllegalStateException unless the utterance is FLUSHING
     */
    public byte[] drain() {
        if (state != State.FLUSHING) {
            throw new IllegalStateException("Utterance " + id + " must be FLUSHING to drain, was " + state);
        }
        byte[] pcm = audio.toByteArray();
        audio = new ByteArrayOutputStream(0);
        state = State.CLOSED;
        return pcm;
    }

    public long id() {
        return id;
    }

    public int byteCount() {
        return byteCount;
    }

    public boolean isEmpty() {
        return byteCount == 0;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int channels() {
        return channels;
    }

    public State state() {
        return state;
    }

    @Override
    public String toString() {
        return "Utterance[id=" + id + ", bytes=" + byteCount + ", state=" + state + "]";
    }
}
