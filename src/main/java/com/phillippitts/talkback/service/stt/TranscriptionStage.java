package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.domain.Utterance;
import com.phillippitts.talkback.exception.TranscriptionException;
import com.phillippitts.talkback.exception.TranscriptionException.Reason;
import com.phillippitts.talkback.service.audio.PcmConverter;
import com.phillippitts.talkback.service.bus.FrameEmitter;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Pipeline stage that turns flushed utterances into final transcripts.
 *
 * <p>Failures never stop the session:
 * <ul>
 *   <li>empty text: logged and discarded</li>
 *   <li>engine failure: logged, counted, reported upstream as a non-fatal error, discarded</li>
 *   <li>cancelled: dropped silently</li>
 * </ul>
 * The next utterance is accepted either way.
 */
public class TranscriptionStage implements FrameProcessor {

    private static final Logger LOG = LogManager.getLogger(TranscriptionStage.class);

    public static final String NAME = "transcription";

    private final SttEngine engine;
    private final String language;
    private final CancellationToken token;
    private final PipelineMetrics metrics;

    public TranscriptionStage(SttEngine engine, String language, CancellationToken token, PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Frame frame, FrameEmitter emitter) {
        if (frame.type() != Frame.FrameType.UTTERANCE_READY) {
            emitter.pushDownstream(frame);
            return;
        }
        Utterance utterance = ((Frame.UtteranceReady) frame).utterance();
        try {
            emitter.pushDownstream(transcribe(utterance));
        } catch (TranscriptionException e) {
            switch (e.getReason()) {
                case EMPTY_RESULT -> LOG.info("Discarding utterance {}: transcription was empty", utterance.id());
                case CANCELLED -> LOG.debug("Transcription of utterance {} cancelled", utterance.id());
                default -> {
                    LOG.warn("Transcription of utterance {} failed: {}", utterance.id(), e.getMessage());
                    emitter.pushUpstream(Frame.StageError.recoverable(NAME, reasonTag(e.getReason()), e.getMessage()));
                }
            }
        }
    }

    /**
     * Transcribes one flushed utterance.
     *
     * @param utterance a FLUSHING utterance; drained and CLOSED by this call
     * @return the final transcript (never blank)
     * @throws TranscriptionException with reason EMPTY_RESULT, ENGINE_FAILURE or CANCELLED
     */
    public Frame.FinalTranscript transcribe(Utterance utterance) {
        Objects.requireNonNull(utterance, "utterance must not be null");
        byte[] pcm = utterance.drain();
        float[] samples = PcmConverter.toMonoFloat(pcm, utterance.channels());

        long start = System.nanoTime();
        TranscriptionResult result;
        try {
            result = engine.transcribe(samples, utterance.sampleRate(), language, token);
        } catch (TranscriptionException e) {
            metrics.incrementFailure(NAME, engine.getEngineName(), reasonTag(e.getReason()));
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementFailure(NAME, engine.getEngineName(), reasonTag(Reason.ENGINE_FAILURE));
            throw new TranscriptionException(Reason.ENGINE_FAILURE, "Unexpected engine error: " + e.getMessage(),
                    engine.getEngineName(), e);
        }
        metrics.recordLatency(NAME, engine.getEngineName(), System.nanoTime() - start);

        if (token.isCancelled()) {
            metrics.incrementFailure(NAME, engine.getEngineName(), reasonTag(Reason.CANCELLED));
            throw new TranscriptionException(Reason.CANCELLED, "Session cancelled during transcription",
                    engine.getEngineName());
        }
        if (result.isBlank()) {
            metrics.incrementFailure(NAME, engine.getEngineName(), reasonTag(Reason.EMPTY_RESULT));
            throw new TranscriptionException(Reason.EMPTY_RESULT, "Engine returned no text", engine.getEngineName());
        }

        metrics.incrementSuccess(NAME, engine.getEngineName());
        String text = result.text().strip();
        LOG.info("Utterance {} transcribed: {} of audio, {} chars", utterance.id(), result.audioDuration(), text.length());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Transcript: {}", LogSanitizer.preview(text));
        }
        return new Frame.FinalTranscript(text);
    }

    private static String reasonTag(Reason reason) {
        return reason.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
