package com.phillippitts.talkback.service.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared by everything working on behalf of a session.
 *
 * <p>Engine calls poll {@link #isCancelled()} between increments and register listeners to
 * abort blocking I/O. Once cancelled a token stays cancelled.
 *
 * <p>Thread-safe.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Cancels the token and runs every registered listener once.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            runSafely(listener);
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a listener run on cancellation. Runs immediately if already cancelled.
     *
     * @return handle that deregisters the listener
     */
    public Runnable onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (cancelled.get()) {
            runSafely(listener);
            return () -> { };
        }
        listeners.add(listener);
        // cancel() may have iterated before the add
        if (cancelled.get() && listeners.remove(listener)) {
            runSafely(listener);
        }
        return () -> listeners.remove(listener);
    }

    private static void runSafely(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
