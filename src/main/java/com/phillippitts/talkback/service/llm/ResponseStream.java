package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.domain.ConversationContext;
import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.exception.GenerationException;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.engine.EngineStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One assistant response, streamed as text deltas.
 *
 * <p>Lazy, finite and single-pass. The engine call is opened on the first {@link #hasNext()}.
 *
 * <p><b>Outcomes:</b>
 * <ul>
 *   <li>{@code COMPLETED}: every increment was yielded and the accumulated text was appended to
 *       the context as one ASSISTANT turn</li>
 *   <li>{@code EMPTY}: the engine produced no text; nothing appended</li>
 *   <li>{@code FAILED}: the engine failed; exactly one fallback delta was yielded and nothing
 *       appended</li>
 *   <li>{@code CANCELLED}: the session token fired; nothing further yielded or appended</li>
 * </ul>
 *
 * <p>The token is checked before every increment is yielded.
 */
public final class ResponseStream implements Iterator<Frame.TextDelta>, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ResponseStream.class);

    public enum Outcome { PENDING, COMPLETED, EMPTY, FAILED, CANCELLED }

    private final ConversationContext context;
    private final Supplier<EngineStream<String>> opener;
    private final CancellationToken token;
    private final String fallbackText;
    private final StringBuilder accumulated = new StringBuilder();

    private EngineStream<String> stream;
    private Frame.TextDelta pending;
    private Outcome outcome = Outcome.PENDING;
    private GenerationException failure;

    ResponseStream(ConversationContext context, Supplier<EngineStream<String>> opener,
                   CancellationToken token, String fallbackText) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.fallbackText = Objects.requireNonNull(fallbackText, "fallbackText must not be null");
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (outcome != Outcome.PENDING) {
            return false;
        }
        if (token.isCancelled()) {
            finish(Outcome.CANCELLED);
            return false;
        }
        try {
            if (stream == null) {
                stream = opener.get();
            }
            if (stream.hasNext()) {
                String increment = stream.next();
                if (token.isCancelled()) {
                    finish(Outcome.CANCELLED);
                    return false;
                }
                accumulated.append(increment);
                pending = new Frame.TextDelta(increment);
                return true;
            }
        } catch (GenerationException e) {
            if (token.isCancelled()) {
                finish(Outcome.CANCELLED);
                return false;
            }
            failure = e;
            LOG.warn("Response stream failed after {} chars: {}", accumulated.length(), e.getMessage());
            finish(Outcome.FAILED);
            pending = new Frame.TextDelta(fallbackText);
            return true;
        }

        if (token.isCancelled()) {
            finish(Outcome.CANCELLED);
        } else if (accumulated.toString().isBlank()) {
            LOG.info("Model returned an empty response");
            finish(Outcome.EMPTY);
        } else {
            context.appendAssistant(accumulated.toString());
            finish(Outcome.COMPLETED);
        }
        return false;
    }

    @Override
    public Frame.TextDelta next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Frame.TextDelta delta = pending;
        pending = null;
        return delta;
    }

    /** Abandons the response; an unfinished stream counts as cancelled. */
    @Override
    public void close() {
        pending = null;
        if (outcome == Outcome.PENDING) {
            finish(Outcome.CANCELLED);
        }
    }

    public Outcome outcome() {
        return outcome;
    }

    /** Text accumulated from the engine so far (excludes any fallback). */
    public String text() {
        return accumulated.toString();
    }

    /** The engine failure for a {@code FAILED} outcome, otherwise null. */
    public GenerationException failure() {
        return failure;
    }

    private void finish(Outcome result) {
        outcome = result;
        if (stream != null) {
            stream.close();
        }
    }
}
