package com.phillippitts.talkback.service.audio;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.domain.Utterance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates inbound audio and decides when an utterance is complete.
 *
 * <p>Flush conditions, in order:
 * <ol>
 *   <li>an explicit {@link Kind#UTTERANCE_END} signal</li>
 *   <li>the byte threshold is reached while no voice-activity signal has been seen</li>
 *   <li>the safety cap is reached after voice-activity signals were seen</li>
 * </ol>
 *
 * <p><b>Voice gating:</b> once voice-activity signals drive the buffer, an utterance only opens
 * on {@link Kind#UTTERANCE_START}. Audio outside speech is not buffered, except for a short
 * pre-roll that is prepended to the next utterance so a late start signal does not clip the
 * first syllable. A buffer created voice-gated starts in that mode; otherwise it switches on the
 * first signal.
 *
 * <p>At most one utterance is open at a time. After a flush the next chunk opens a fresh one.
 * The buffer never calls transcription; it hands completed utterances back to its caller.
 *
 * <p>Not thread-safe. The pipeline runner serializes access under its ingest lock.
 */
public final class UtteranceBuffer {

    private static final Logger LOG = LogManager.getLogger(UtteranceBuffer.class);

    private final int thresholdBytes;
    private final int maxBytes;
    private final int preRollBytes;
    private final Deque<Frame.AudioChunk> preRoll = new ArrayDeque<>();

    private Utterance open;
    private boolean vadObserved;
    private boolean speaking;
    private int preRollBuffered;

    /**
     * Byte-threshold buffer without pre-roll; switches to signal-driven flushing on the first
     * voice-activity signal.
     */
    public UtteranceBuffer(int thresholdBytes, int maxBytes) {
        this(thresholdBytes, maxBytes, 0, false);
    }

    /**
     * @param thresholdBytes flush size when no voice-activity signal has been seen
     * @param maxBytes       flush size once voice-activity signals drive flushing
     * @param preRollBytes   audio kept from before a start signal; 0 keeps none
     * @param voiceGated     start in signal-driven mode (a voice-activity detector is attached)
     */
    public UtteranceBuffer(int thresholdBytes, int maxBytes, int preRollBytes, boolean voiceGated) {
        if (thresholdBytes <= 0) {
            throw new IllegalArgumentException("thresholdBytes must be positive, got: " + thresholdBytes);
        }
        if (maxBytes < thresholdBytes) {
            throw new IllegalArgumentException("maxBytes must be >= thresholdBytes, got: " + maxBytes);
        }
        if (preRollBytes < 0) {
            throw new IllegalArgumentException("preRollBytes must not be negative, got: " + preRollBytes);
        }
        this.thresholdBytes = thresholdBytes;
        this.maxBytes = maxBytes;
        this.preRollBytes = preRollBytes;
        this.vadObserved = voiceGated;
    }

    /**
     * Appends a chunk to the open utterance, opening one if needed.
     *
     * <p>A chunk whose format differs from the open utterance closes it first; the chunk then
     * starts the next utterance, which is itself returned if the chunk alone reaches the limit.
     *
     * @return completed utterances in flush order; usually empty
     */
    public List<Utterance> accept(Frame.AudioChunk chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        if (chunk.length() == 0) {
            return List.of();
        }
        if (vadObserved && !speaking) {
            retainPreRoll(chunk);
            return List.of();
        }

        List<Utterance> completed = new ArrayList<>(2);
        if (open != null && !sameFormat(open, chunk)) {
            LOG.debug("Audio format changed to {}Hz/{}ch; closing {}", chunk.sampleRate(), chunk.channels(), open);
            flush().ifPresent(completed::add);
        }
        if (open == null) {
            open = new Utterance(chunk.sampleRate(), chunk.channels());
        }
        open.append(chunk);

        int limit = vadObserved ? maxBytes : thresholdBytes;
        if (open.byteCount() >= limit) {
            if (vadObserved) {
                LOG.warn("Utterance reached safety cap of {} bytes without end-of-speech; flushing", maxBytes);
            }
            flush().ifPresent(completed::add);
        }
        return completed;
    }

    /**
     * Applies a voice-activity signal.
     *
     * <p>{@code UTTERANCE_START} switches the buffer to signal-driven flushing and opens speech,
     * seeded with the pre-roll. {@code UTTERANCE_END} closes speech and flushes the open
     * utterance. Other kinds are ignored.
     *
     * @return the completed utterance for a non-empty {@code UTTERANCE_END}
     */
    public Optional<Utterance> signal(Kind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case UTTERANCE_START -> {
                vadObserved = true;
                if (!speaking) {
                    speaking = true;
                    openFromPreRoll();
                }
                yield Optional.empty();
            }
            case UTTERANCE_END -> {
                vadObserved = true;
                speaking = false;
                yield flush();
            }
            default -> Optional.empty();
        };
    }

    /** Discards any open utterance and the pre-roll. */
    public void reset() {
        open = null;
        speaking = false;
        clearPreRoll();
    }

    public int bufferedBytes() {
        return open == null ? 0 : open.byteCount();
    }

    public int preRollBytes() {
        return preRollBuffered;
    }

    public boolean isVadObserved() {
        return vadObserved;
    }

    private void retainPreRoll(Frame.AudioChunk chunk) {
        if (preRollBytes == 0) {
            return;
        }
        Frame.AudioChunk last = preRoll.peekLast();
        if (last != null && (last.sampleRate() != chunk.sampleRate() || last.channels() != chunk.channels())) {
            clearPreRoll();
        }
        int frameBytes = chunk.channels() * 2;
        int keep = preRollBytes - preRollBytes % frameBytes;
        if (keep == 0) {
            return;
        }
        Frame.AudioChunk tail = chunk.length() > keep ? chunk.slice(chunk.length() - keep, chunk.length()) : chunk;
        preRoll.addLast(tail);
        preRollBuffered += tail.length();
        while (preRollBuffered > preRollBytes) {
            preRollBuffered -= preRoll.removeFirst().length();
        }
    }

    private void openFromPreRoll() {
        if (open == null && !preRoll.isEmpty()) {
            Frame.AudioChunk first = preRoll.peekFirst();
            open = new Utterance(first.sampleRate(), first.channels());
            for (Frame.AudioChunk chunk : preRoll) {
                open.append(chunk);
            }
        }
        clearPreRoll();
    }

    private void clearPreRoll() {
        preRoll.clear();
        preRollBuffered = 0;
    }

    private static boolean sameFormat(Utterance utterance, Frame.AudioChunk chunk) {
        return utterance.sampleRate() == chunk.sampleRate() && utterance.channels() == chunk.channels();
    }

    private Optional<Utterance> flush() {
        Utterance current = open;
        open = null;
        if (current == null || current.isEmpty()) {
            return Optional.empty();
        }
        current.markFlushing();
        LOG.debug("Flushed {}", current);
        return Optional.of(current);
    }
}
