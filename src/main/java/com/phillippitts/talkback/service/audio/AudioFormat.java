package com.phillippitts.talkback.service.audio;

import java.time.Duration;

/**
 * Single source of truth for pipeline audio format.
 * All audio is 16-bit signed PCM, little-endian. Inbound default: 16 kHz mono.
 */
public final class AudioFormat {

    /** Default inbound sample rate in Hz. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Bits per sample; the only supported sample width. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Bytes per sample for one channel. */
    public static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;
    /** Default number of channels (mono). */
    public static final int DEFAULT_CHANNELS = 1;

    /** Bytes per second at the default format. */
    public static final int DEFAULT_BYTE_RATE = DEFAULT_SAMPLE_RATE * BYTES_PER_SAMPLE * DEFAULT_CHANNELS; // 32,000

    /** Size of the canonical PCM WAV header. */
    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /** Bytes per PCM frame (one sample for every channel). */
    public static int blockAlign(int channels) {
        return BYTES_PER_SAMPLE * channels;
    }

    public static int byteRate(int sampleRate, int channels) {
        return sampleRate * blockAlign(channels);
    }

    /**
     * Playback duration of a PCM16LE payload.
     */
    public static Duration durationOf(int byteCount, int sampleRate, int channels) {
        long frames = byteCount / blockAlign(channels);
        return Duration.ofMillis(frames * 1000L / sampleRate);
    }
}
