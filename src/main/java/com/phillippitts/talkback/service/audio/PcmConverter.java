package com.phillippitts.talkback.service.audio;

import java.util.Objects;

/**
 * Converts between PCM16LE bytes and normalized float samples.
 *
 * <p>Float samples are in [-1.0, 1.0), computed as {@code sample / 32768}. Multi-channel input
 * is downmixed to mono by averaging each frame. A trailing partial frame is ignored.
 */
public final class PcmConverter {

    private static final float SCALE = 32768f;

    private PcmConverter() {}

    /**
     * Decodes interleaved PCM16LE audio into mono float samples.
     *
     * @param pcm      interleaved PCM16LE bytes
     * @param channels number of interleaved channels (1 = mono)
     * @return one float per frame
     */
    public static float[] toMonoFloat(byte[] pcm, int channels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive, got: " + channels);
        }
        int blockAlign = AudioFormat.blockAlign(channels);
        int frames = pcm.length / blockAlign;
        float[] out = new float[frames];
        for (int f = 0; f < frames; f++) {
            int base = f * blockAlign;
            float sum = 0f;
            for (int c = 0; c < channels; c++) {
                sum += readSample(pcm, base + c * AudioFormat.BYTES_PER_SAMPLE) / SCALE;
            }
            out[f] = sum / channels;
        }
        return out;
    }

    /**
     * Encodes mono float samples as PCM16LE, clipping to the 16-bit range.
     */
    public static byte[] toPcm16(float[] samples) {
        Objects.requireNonNull(samples, "samples must not be null");
        byte[] out = new byte[samples.length * AudioFormat.BYTES_PER_SAMPLE];
        for (int i = 0; i < samples.length; i++) {
            int v = Math.round(samples[i] * SCALE);
            v = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, v));
            out[2 * i] = (byte) (v & 0xFF);
            out[2 * i + 1] = (byte) ((v >>> 8) & 0xFF);
        }
        return out;
    }

    /** Reads one signed little-endian 16-bit sample. */
    static int readSample(byte[] pcm, int offset) {
        return (pcm[offset] & 0xFF) | (pcm[offset + 1] << 8);
    }
}
