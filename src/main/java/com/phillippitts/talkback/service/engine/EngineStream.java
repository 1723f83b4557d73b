package com.phillippitts.talkback.service.engine;

import java.util.Iterator;

/**
 * Lazy, finite, single-pass stream of engine output increments.
 *
 * <p>{@link #hasNext()} blocks until the next increment arrives, the stream ends, or the
 * session's {@link CancellationToken} fires. After cancellation it returns {@code false};
 * callers distinguish cancellation from completion by checking the token. Engine failures
 * surface as the engine's own unchecked exception from {@code hasNext()}.
 *
 * <p>{@link #close()} releases the underlying connection and is idempotent.
 *
 * @param <T> increment type (text token, audio bytes)
 */
public interface EngineStream<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();
}
