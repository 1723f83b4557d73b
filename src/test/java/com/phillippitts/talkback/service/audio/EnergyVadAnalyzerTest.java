package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnergyVadAnalyzerTest {

    /** {@code millis} of 16 kHz mono audio held at a constant level. */
    private static Frame.AudioChunk level(int millis, int amplitude) {
        int samples = 16 * millis;
        float[] mono = new float[samples];
        Arrays.fill(mono, amplitude / 32768f);
        return new Frame.AudioChunk(PcmConverter.toPcm16(mono), 16_000, 1);
    }

    @Test
    void shouldSignalStartOnLoudAudio() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);

        assertThat(vad.analyze(level(40, 3000)))
                .extracting(EnergyVadAnalyzer.Transition::kind).containsExactly(Kind.UTTERANCE_START);
        assertThat(vad.isSpeaking()).isTrue();
    }

    @Test
    void shouldStayQuietBelowStartThreshold() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);

        assertThat(vad.analyze(level(100, 600))).isEmpty();
        assertThat(vad.isSpeaking()).isFalse();
    }

    @Test
    void shouldSignalEndOnlyAfterHangover() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);
        vad.analyze(level(40, 3000));

        assertThat(vad.analyze(level(100, 0))).isEmpty();
        assertThat(vad.analyze(level(100, 0)))
                .extracting(EnergyVadAnalyzer.Transition::kind).containsExactly(Kind.UTTERANCE_END);
        assertThat(vad.isSpeaking()).isFalse();
    }

    @Test
    void shouldKeepSpeakingBetweenStopAndStartThresholds() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 100);
        vad.analyze(level(40, 3000));

        // hysteresis: 600 is below start but above stop
        assertThat(vad.analyze(level(500, 600))).isEmpty();
        assertThat(vad.isSpeaking()).isTrue();
    }

    @Test
    void shouldReportStartAndEndWithinOneChunk() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 40);
        float[] mono = new float[16 * 100];
        for (int i = 0; i < 16 * 20; i++) {
            mono[i] = 3000 / 32768f;
        }
        Frame.AudioChunk chunk = new Frame.AudioChunk(PcmConverter.toPcm16(mono), 16_000, 1);

        assertThat(vad.analyze(chunk)).containsExactly(
                new EnergyVadAnalyzer.Transition(Kind.UTTERANCE_START, 0),
                // 20 ms of speech, then 40 ms of hangover: 60 ms at 32 bytes per ms
                new EnergyVadAnalyzer.Transition(Kind.UTTERANCE_END, 1_920));
    }

    @Test
    void shouldReportStartAtTheWindowWhereSpeechBegins() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);
        float[] mono = new float[16 * 60];
        for (int i = 16 * 40; i < mono.length; i++) {
            mono[i] = 3000 / 32768f;
        }

        assertThat(vad.analyze(new Frame.AudioChunk(PcmConverter.toPcm16(mono), 16_000, 1)))
                .containsExactly(new EnergyVadAnalyzer.Transition(Kind.UTTERANCE_START, 1_280));
    }

    @Test
    void shouldReportOffsetsInStereoBytes() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);
        byte[] pcm = new byte[16 * 40 * 4];
        byte[] loud = level(20, 3000).samples();
        // second window of 20 ms, both channels loud
        for (int frame = 0; frame < 16 * 20; frame++) {
            int target = (16 * 20 + frame) * 4;
            pcm[target] = loud[frame * 2];
            pcm[target + 1] = loud[frame * 2 + 1];
            pcm[target + 2] = loud[frame * 2];
            pcm[target + 3] = loud[frame * 2 + 1];
        }

        assertThat(vad.analyze(new Frame.AudioChunk(pcm, 16_000, 2)))
                .containsExactly(new EnergyVadAnalyzer.Transition(Kind.UTTERANCE_START, 1_280));
    }

    @Test
    void shouldForgetSpeechOnReset() {
        EnergyVadAnalyzer vad = new EnergyVadAnalyzer(800, 500, 20, 200);
        vad.analyze(level(40, 3000));

        vad.reset();

        assertThat(vad.isSpeaking()).isFalse();
    }

    @Test
    void shouldRejectStopAboveStart() {
        assertThatThrownBy(() -> new EnergyVadAnalyzer(500, 800, 20, 200))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
