package com.phillippitts.talkback.service.stt;

import com.phillippitts.talkback.domain.TranscriptionResult;
import com.phillippitts.talkback.exception.TranscriptionException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.InferenceEngine;

/**
 * Contract for speech-to-text engines.
 *
 * <p>Implementations are stateless with respect to sessions and safe for concurrent calls from
 * different sessions.
 *
 * <p>Audio is passed as mono float samples normalized to [-1.0, 1.0), at the sample rate of
 * the captured audio.
 *
 * @see TranscriptionResult
 * @see TranscriptionException
 */
public interface SttEngine extends InferenceEngine {

    /**
     * Transcribes one utterance.
     *
     * @param samples    mono samples in [-1.0, 1.0)
     * @param sampleRate sample rate in Hz
     * @param language   language hint (e.g. "en")
     * @param token      session cancellation token
     * @return the result; text may be empty when the audio held no speech
     * @throws TranscriptionException with reason {@code ENGINE_FAILURE} on call failure, or
     *                                {@code CANCELLED} when the token fired mid-call
     */
    TranscriptionResult transcribe(float[] samples, int sampleRate, String language, CancellationToken token);
}
