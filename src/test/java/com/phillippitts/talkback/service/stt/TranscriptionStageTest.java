package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Utterance;
import com.phillippitts.talkback.exception.TranscriptionException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.testutil.FakeSttEngine;
import com.phillippitts.talkback.testutil.RecordingEmitter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionStageTest {

    private SimpleMeterRegistry registry;
    private CancellationToken token;
    private RecordingEmitter emitter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        token = new CancellationToken();
        emitter = new RecordingEmitter();
    }

    private TranscriptionStage stage(FakeSttEngine engine) {
        return new TranscriptionStage(engine, "en", token, new PipelineMetrics(registry));
    }

    private static Utterance flushed(int bytes) {
        Utterance utterance = new Utterance(16_000, 1);
        utterance.append(new Frame.AudioChunk(new byte[bytes], 16_000, 1));
        utterance.markFlushing();
        return utterance;
    }

    @Test
    void shouldEmitStrippedFinalTranscript() {
        FakeSttEngine engine = new FakeSttEngine("  hello world \n");
        Utterance utterance = flushed(3_200);

        stage(engine).process(new Frame.UtteranceReady(utterance), emitter);

        assertThat(emitter.downstream).containsExactly(new Frame.FinalTranscript("hello world"));
        assertThat(engine.sampleCounts).containsExactly(1_600);
        assertThat(utterance.state()).isEqualTo(Utterance.State.CLOSED);
        assertThat(registry.get("talkback.pipeline.success").tag("stage", "transcription").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldDiscardEmptyTranscriptWithoutError() {
        FakeSttEngine engine = new FakeSttEngine("   ");

        stage(engine).process(new Frame.UtteranceReady(flushed(320)), emitter);

        assertThat(emitter.downstream).isEmpty();
        assertThat(emitter.upstream).isEmpty();
        assertThat(registry.get("talkback.pipeline.failure").tag("reason", "empty-result").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldReportEngineFailureAsRecoverable() {
        FakeSttEngine engine = new FakeSttEngine();
        engine.failWith = new TranscriptionException(TranscriptionException.Reason.ENGINE_FAILURE,
                "server unavailable", "fake-stt");

        stage(engine).process(new Frame.UtteranceReady(flushed(320)), emitter);

        assertThat(emitter.downstream).isEmpty();
        assertThat(emitter.upstream).singleElement().isInstanceOfSatisfying(Frame.StageError.class, error -> {
            assertThat(error.stage()).isEqualTo(TranscriptionStage.NAME);
            assertThat(error.reason()).isEqualTo("engine-failure");
            assertThat(error.fatal()).isFalse();
        });
    }

    @Test
    void shouldWrapUnexpectedEngineErrors() {
        FakeSttEngine engine = new FakeSttEngine();
        engine.failWith = new IllegalStateException("bug");

        assertThatThrownBy(() -> stage(engine).transcribe(flushed(320)))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unexpected engine error: bug")
                .satisfies(e -> assertThat(((TranscriptionException) e).getReason())
                        .isEqualTo(TranscriptionException.Reason.ENGINE_FAILURE));
    }

    @Test
    void shouldDropCancelledTranscriptionSilently() {
        FakeSttEngine engine = new FakeSttEngine("late text");
        token.cancel();

        stage(engine).process(new Frame.UtteranceReady(flushed(320)), emitter);

        assertThat(emitter.downstream).isEmpty();
        assertThat(emitter.upstream).isEmpty();
    }

    @Test
    void shouldDownmixStereoBeforeTranscribing() {
        FakeSttEngine engine = new FakeSttEngine("stereo");
        Utterance utterance = new Utterance(16_000, 2);
        utterance.append(new Frame.AudioChunk(new byte[400], 16_000, 2));
        utterance.markFlushing();

        stage(engine).transcribe(utterance);

        assertThat(engine.sampleCounts).containsExactly(100);
    }

    @Test
    void shouldForwardOtherFramesUnchanged() {
        Frame signal = Frame.ControlSignal.of(Frame.ControlSignal.Kind.KICKOFF);

        stage(new FakeSttEngine()).process(signal, emitter);

        assertThat(emitter.downstream).containsExactly(signal);
    }
}
