package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineStream;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.testutil.FakeTtsEngine;
import com.phillippitts.talkback.testutil.RecordingEmitter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisStageTest {

    private FakeTtsEngine tts;
    private CancellationToken token;
    private RecordingEmitter emitter;
    private SynthesisStage stage;

    @BeforeEach
    void setUp() {
        tts = new FakeTtsEngine();
        token = new CancellationToken();
        emitter = new RecordingEmitter();
        stage = new SynthesisStage(tts, token, new PhraseAggregator(10, 200),
                new PipelineMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void shouldYieldNothingForBlankText() {
        try (Stream<Frame.AudioChunk> audio = stage.synthesize("  ")) {
            assertThat(audio).isEmpty();
        }
        assertThat(tts.texts).isEmpty();
    }

    @Test
    void shouldStreamChunksAtEngineRate() {
        List<Frame.AudioChunk> chunks;
        try (Stream<Frame.AudioChunk> audio = stage.synthesize("Hello world.")) {
            chunks = audio.collect(Collectors.toList());
        }

        assertThat(chunks).hasSize(2).allSatisfy(chunk -> {
            assertThat(chunk.sampleRate()).isEqualTo(FakeTtsEngine.SAMPLE_RATE);
            assertThat(chunk.length()).isEqualTo(480);
        });
        assertThat(tts.closedStreams).isEqualTo(1);
    }

    @Test
    void shouldRealignOddSizedEngineChunks() {
        tts.chunkBytes = 3;
        tts.chunksPerPhrase = 3;

        List<Frame.AudioChunk> chunks;
        try (Stream<Frame.AudioChunk> audio = stage.synthesize("Hello world.")) {
            chunks = audio.collect(Collectors.toList());
        }

        // 9 bytes: 2 + 4 + 2, trailing odd byte dropped
        assertThat(chunks).extracting(Frame.AudioChunk::length).containsExactly(2, 4, 2);
    }

    @Test
    void shouldSpeakCompletedPhrasesAndFlushOnResponseEnd() {
        stage.process(Frame.ControlSignal.of(Kind.RESPONSE_START), emitter);
        stage.process(new Frame.TextDelta("First sentence here. Sec"), emitter);
        stage.process(new Frame.TextDelta("ond part"), emitter);
        stage.process(Frame.ControlSignal.of(Kind.RESPONSE_END), emitter);

        assertThat(tts.texts).containsExactly("First sentence here.", "Second part");
        assertThat(emitter.downstreamOfType(Frame.AudioChunk.class)).hasSize(4);
        assertThat(emitter.downstreamOfType(Frame.TextDelta.class)).hasSize(2);
        assertThat(emitter.downstream.get(emitter.downstream.size() - 1))
                .isEqualTo(Frame.ControlSignal.of(Kind.RESPONSE_END));
    }

    @Test
    void shouldDropFailedPhraseAndContinueWithNext() {
        tts.failOn = "broken";

        stage.process(new Frame.TextDelta("This one is broken. This one works. "), emitter);

        assertThat(tts.texts).containsExactly("This one is broken.", "This one works.");
        assertThat(emitter.downstreamOfType(Frame.AudioChunk.class)).hasSize(2);
        assertThat(emitter.upstream).singleElement().isInstanceOfSatisfying(Frame.StageError.class, error -> {
            assertThat(error.stage()).isEqualTo(SynthesisStage.NAME);
            assertThat(error.fatal()).isFalse();
        });
    }

    @Test
    void shouldNotSpeakAfterCancellation() {
        token.cancel();

        stage.process(new Frame.TextDelta("A complete sentence. "), emitter);

        assertThat(tts.texts).isEmpty();
        assertThat(emitter.downstreamOfType(Frame.AudioChunk.class)).isEmpty();
    }

    @Test
    void shouldDiscardPendingTextOnCancel() {
        stage.process(new Frame.TextDelta("unfinished thought"), emitter);

        stage.onCancel();
        stage.process(Frame.ControlSignal.of(Kind.RESPONSE_END), emitter);

        assertThat(tts.texts).isEmpty();
    }

    @Test
    void shouldCloseEngineStreamWhenStreamIsClosedEarly() {
        Stream<Frame.AudioChunk> audio = stage.synthesize("Hello world.");
        Iterator<Frame.AudioChunk> it = audio.iterator();
        it.next();

        audio.close();

        assertThat(tts.closedStreams).isEqualTo(1);
    }

    @Test
    void shouldPropagateEngineFailureFromSynthesize() {
        SynthesisStage failing = new SynthesisStage(new FakeTtsEngine() {
            @Override
            public EngineStream<byte[]> synthesize(String text, CancellationToken token) {
                throw new SynthesisException("connection refused", getEngineName());
            }
        }, token, new PhraseAggregator(10, 200), new PipelineMetrics(new SimpleMeterRegistry()));

        failing.process(new Frame.TextDelta("Hello there, world. "), emitter);

        assertThat(emitter.upstream).hasSize(1);
        assertThat(emitter.downstreamOfType(Frame.AudioChunk.class)).isEmpty();
    }
}
