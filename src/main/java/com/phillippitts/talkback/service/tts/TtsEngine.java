package com.phillippitts.talkback.service.tts;

import com.phillippitts.talkback.exception.SynthesisException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineStream;
import com.phillippitts.talkback.service.engine.InferenceEngine;

/**
 * Contract for streaming text-to-speech engines.
 *
 * <p>Output is mono PCM16LE at {@link #outputSampleRate()}. Chunk boundaries are arbitrary and
 * may split a sample.
 */
public interface TtsEngine extends InferenceEngine {

    /**
     * Starts synthesizing one phrase.
     *
     * @param text  non-blank phrase
     * @param token session cancellation token; firing it ends the stream
     * @return lazy stream of raw PCM bytes; the caller must close it
     * @throws SynthesisException if the request fails, at call time or while streaming
     */
    EngineStream<byte[]> synthesize(String text, CancellationToken token);

    /**
     * @return sample rate of the produced audio in Hz
     */
    int outputSampleRate();
}
