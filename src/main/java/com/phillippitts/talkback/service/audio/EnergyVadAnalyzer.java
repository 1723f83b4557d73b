package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;

import java.util.ArrayList;
import java.util.List;

/**
 * Server-side voice activity detection based on signal energy.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Split each chunk into short windows (default 20 ms)</li>
 *   <li>Compute the RMS amplitude of every window on the mono downmix</li>
 *   <li>Enter speech when a window reaches the start threshold</li>
 *   <li>Leave speech once windows stay below the stop threshold for the hangover period</li>
 * </ol>
 *
 * <p>Using a lower stop threshold than start threshold gives hysteresis, so a speaker trailing
 * off does not toggle the state on every window.
 *
 * <p>One instance per session. Not thread-safe; the runner calls it under its ingest lock.
 */
public final class EnergyVadAnalyzer {

    private final int startThreshold;
    private final int stopThreshold;
    private final int windowMs;
    private final int hangoverMs;

    private boolean speaking;
    private int silenceMs;

    /**
     * @param startThreshold RMS (0-32767) at which speech starts
     * @param stopThreshold  RMS below which a window counts as silence; at most startThreshold
     * @param windowMs       analysis window length in milliseconds
     * @param hangoverMs     continuous silence that ends an utterance
     */
    public EnergyVadAnalyzer(int startThreshold, int stopThreshold, int windowMs, int hangoverMs) {
        if (startThreshold <= 0 || stopThreshold <= 0 || stopThreshold > startThreshold) {
            throw new IllegalArgumentException("Require 0 < stopThreshold <= startThreshold, got start="
                    + startThreshold + ", stop=" + stopThreshold);
        }
        if (windowMs <= 0 || hangoverMs <= 0) {
            throw new IllegalArgumentException("windowMs and hangoverMs must be positive");
        }
        this.startThreshold = startThreshold;
        this.stopThreshold = stopThreshold;
        this.windowMs = windowMs;
        this.hangoverMs = hangoverMs;
    }

    /**
     * A speech boundary inside one chunk.
     *
     * @param kind       {@code UTTERANCE_START} or {@code UTTERANCE_END}
     * @param byteOffset where the boundary falls in the chunk, on a sample frame boundary.
     *                   Speech starts at the first byte of the window that crossed the start
     *                   threshold and ends after the last byte of the hangover window.
     */
    public record Transition(Kind kind, int byteOffset) {
    }

    /**
     * Feeds one chunk and reports the speech transitions it caused, in order.
     *
     * @return transitions with their position in the chunk; usually empty
     */
    public List<Transition> analyze(Frame.AudioChunk chunk) {
        List<Transition> transitions = new ArrayList<>(2);
        float[] mono = PcmConverter.toMonoFloat(chunk.samples(), chunk.channels());
        int windowSamples = Math.max(1, chunk.sampleRate() * windowMs / 1000);
        int frameBytes = chunk.channels() * 2;

        for (int pos = 0; pos < mono.length; pos += windowSamples) {
            int end = Math.min(mono.length, pos + windowSamples);
            double rms = rms(mono, pos, end);
            int durationMs = (end - pos) * 1000 / chunk.sampleRate();

            if (!speaking) {
                if (rms >= startThreshold) {
                    speaking = true;
                    silenceMs = 0;
                    transitions.add(new Transition(Kind.UTTERANCE_START, pos * frameBytes));
                }
            } else if (rms < stopThreshold) {
                silenceMs += durationMs;
                if (silenceMs >= hangoverMs) {
                    speaking = false;
                    silenceMs = 0;
                    transitions.add(new Transition(Kind.UTTERANCE_END, end * frameBytes));
                }
            } else {
                silenceMs = 0;
            }
        }
        return transitions;
    }

    public boolean isSpeaking() {
        return speaking;
    }

    public void reset() {
        speaking = false;
        silenceMs = 0;
    }

    /** RMS on the 16-bit scale. */
    private static double rms(float[] mono, int from, int to) {
        double sumSquares = 0;
        for (int i = from; i < to; i++) {
            double s = mono[i] * 32768.0;
            sumSquares += s * s;
        }
        int count = to - from;
        return count == 0 ? 0 : Math.sqrt(sumSquares / count);
    }
}
