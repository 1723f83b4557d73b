package com.phillippitts.talkback.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PcmConverterTest {

    @Test
    void shouldNormalizeMonoSamples() {
        // 0, 16384, -32768 little-endian
        byte[] pcm = {0, 0, 0, 0x40, 0, (byte) 0x80};

        float[] samples = PcmConverter.toMonoFloat(pcm, 1);

        assertThat(samples).containsExactly(new float[] {0f, 0.5f, -1f}, within(1e-6f));
    }

    @Test
    void shouldAverageStereoFramesToMono() {
        // left 16384, right 0 -> 0.25
        byte[] pcm = {0, 0x40, 0, 0};

        float[] samples = PcmConverter.toMonoFloat(pcm, 2);

        assertThat(samples).hasSize(1);
        assertThat(samples[0]).isCloseTo(0.25f, within(1e-6f));
    }

    @Test
    void shouldIgnoreTrailingPartialFrame() {
        assertThat(PcmConverter.toMonoFloat(new byte[] {0, 0, 1}, 1)).hasSize(1);
        assertThat(PcmConverter.toMonoFloat(new byte[0], 1)).isEmpty();
    }

    @Test
    void shouldClipWhenEncoding() {
        byte[] pcm = PcmConverter.toPcm16(new float[] {2f, -2f, 0.5f});

        assertThat(PcmConverter.readSample(pcm, 0)).isEqualTo(Short.MAX_VALUE);
        assertThat(PcmConverter.readSample(pcm, 2)).isEqualTo(Short.MIN_VALUE);
        assertThat(PcmConverter.readSample(pcm, 4)).isEqualTo(16384);
    }

    @Test
    void shouldDecodeWhatItEncodes() {
        float[] original = {0f, 0.25f, -0.75f};

        float[] decoded = PcmConverter.toMonoFloat(PcmConverter.toPcm16(original), 1);

        assertThat(decoded).containsExactly(original, within(1e-4f));
    }
}
