package com.phillippitts.talkback.service.audio;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * Wraps raw PCM16LE audio in a minimal in-memory WAV container.
 *
 * <p>Speech-to-text servers accept uploads as files; this produces the 44-byte RIFF header
 * followed by the unchanged payload.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Builds a WAV file image for the given PCM16LE payload.
     *
     * @param pcm        raw PCM16LE audio
     * @param sampleRate sample rate in Hz
     * @param channels   number of interleaved channels
     * @return header plus payload
     */
    public static byte[] toWavBytes(byte[] pcm, int sampleRate, int channels) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate and channels must be positive");
        }
        ByteArrayOutputStream os = new ByteArrayOutputStream(AudioFormat.WAV_HEADER_SIZE + pcm.length);

        os.writeBytes(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + pcm.length);
        os.writeBytes(new byte[] { 'W', 'A', 'V', 'E' });

        os.writeBytes(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, 1); // PCM
        writeLEShort(os, channels);
        writeLEInt(os, sampleRate);
        writeLEInt(os, AudioFormat.byteRate(sampleRate, channels));
        writeLEShort(os, AudioFormat.blockAlign(channels));
        writeLEShort(os, AudioFormat.BITS_PER_SAMPLE);

        os.writeBytes(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, pcm.length);
        os.writeBytes(pcm);
        return os.toByteArray();
    }

    private static void writeLEShort(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
