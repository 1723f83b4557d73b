package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.audio.AudioFormat;
import com.phillippitts.talkback.service.bus.FrameEmitter;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineStream;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pipeline stage that speaks streamed text.
 *
 * <p>Text deltas are forwarded unchanged and fed to a {@link PhraseAggregator}; every completed
 * phrase is synthesized and its audio emitted downstream. {@code RESPONSE_END} flushes the last
 * partial phrase. A phrase's audio is collected completely before emission, so a failing or
 * cancelled phrase emits nothing.
 *
 * <p>Synthesis failures are reported upstream as non-fatal; the phrase is dropped and the next
 * one is attempted.
 */
public class SynthesisStage implements FrameProcessor {

    private static final Logger LOG = LogManager.getLogger(SynthesisStage.class);

    public static final String NAME = "synthesis";

    private final TtsEngine engine;
    private final CancellationToken token;
    private final PhraseAggregator aggregator;
    private final PipelineMetrics metrics;

    public SynthesisStage(TtsEngine engine, CancellationToken token, PhraseAggregator aggregator,
                          PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Frame frame, FrameEmitter emitter) {
        switch (frame.type()) {
            case TEXT_DELTA -> {
                emitter.pushDownstream(frame);
                for (String phrase : aggregator.append(((Frame.TextDelta) frame).text())) {
                    speak(phrase, emitter);
                }
            }
            case CONTROL_SIGNAL -> {
                Kind kind = ((Frame.ControlSignal) frame).kind();
                if (kind == Kind.RESPONSE_START) {
                    aggregator.reset();
                } else if (kind == Kind.RESPONSE_END) {
                    speak(aggregator.flush(), emitter);
                }
                emitter.pushDownstream(frame);
            }
            default -> emitter.pushDownstream(frame);
        }
    }

    @Override
    public void onCancel() {
        aggregator.reset();
    }

    /**
     * Synthesizes text into audio chunks aligned to whole samples.
     *
     * <p>Blank text yields an empty stream without calling the engine. The engine is called
     * lazily; closing the stream releases the engine connection.
     *
     * @throws SynthesisException while consuming the stream, if the engine fails
     */
    public Stream<Frame.AudioChunk> synthesize(String text) {
        if (text == null || text.isBlank()) {
            return Stream.empty();
        }
        EngineStream<byte[]> source = engine.synthesize(text, token);
        Iterator<Frame.AudioChunk> aligned = new SampleAligningIterator(source, engine.outputSampleRate());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(aligned, Spliterator.ORDERED), false)
                .onClose(source::close);
    }

    private void speak(String phrase, FrameEmitter emitter) {
        if (phrase.isBlank() || token.isCancelled()) {
            return;
        }
        long start = System.nanoTime();
        List<Frame.AudioChunk> chunks;
        try (Stream<Frame.AudioChunk> audio = synthesize(phrase)) {
            chunks = audio.collect(Collectors.toList());
        } catch (SynthesisException e) {
            if (token.isCancelled()) {
                return;
            }
            LOG.warn("Synthesis failed for a {}-char phrase: {}", phrase.length(), e.getMessage());
            metrics.incrementFailure(NAME, engine.getEngineName(), "engine-failure");
            emitter.pushUpstream(Frame.StageError.recoverable(NAME, "engine-failure", e.getMessage()));
            return;
        }
        if (token.isCancelled()) {
            metrics.incrementFailure(NAME, engine.getEngineName(), "cancelled");
            return;
        }
        metrics.recordLatency(NAME, engine.getEngineName(), System.nanoTime() - start);
        metrics.incrementSuccess(NAME, engine.getEngineName());
        int bytes = chunks.stream().mapToInt(Frame.AudioChunk::length).sum();
        LOG.debug("Synthesized {}-char phrase into {} chunk(s), {} bytes", phrase.length(), chunks.size(), bytes);
        chunks.forEach(emitter::pushDownstream);
    }

    /**
     * Re-chunks raw engine output so no chunk splits a 16-bit sample. A trailing odd byte at the
     * end of the stream is dropped.
     */
    private static final class SampleAligningIterator implements Iterator<Frame.AudioChunk> {

        private final Iterator<byte[]> source;
        private final int sampleRate;
        private final int blockAlign = AudioFormat.blockAlign(AudioFormat.DEFAULT_CHANNELS);
        private byte[] carry = new byte[0];
        private Frame.AudioChunk next;

        private SampleAligningIterator(Iterator<byte[]> source, int sampleRate) {
            this.source = source;
            this.sampleRate = sampleRate;
        }

        @Override
        public boolean hasNext() {
            while (next == null && source.hasNext()) {
                byte[] incoming = source.next();
                byte[] data = new byte[carry.length + incoming.length];
                System.arraycopy(carry, 0, data, 0, carry.length);
                System.arraycopy(incoming, 0, data, carry.length, incoming.length);
                int usable = data.length - data.length % blockAlign;
                carry = Arrays.copyOfRange(data, usable, data.length);
                if (usable > 0) {
                    next = new Frame.AudioChunk(Arrays.copyOf(data, usable), sampleRate, AudioFormat.DEFAULT_CHANNELS);
                }
            }
            return next != null;
        }

        @Override
        public Frame.AudioChunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Frame.AudioChunk chunk = next;
            next = null;
            return chunk;
        }
    }
}
