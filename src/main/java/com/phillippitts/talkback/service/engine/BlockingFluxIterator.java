package com.phillippitts.talkback.service.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Adapts a reactive {@link Flux} into a cancellable blocking {@link EngineStream}.
 *
 * <p>The flux is subscribed on the first call to {@link #hasNext()}. Signals are buffered in a
 * queue that the consuming thread polls in short slices, so it can notice cancellation and the
 * idle timeout between increments. Cancelling the token disposes the subscription, which
 * aborts the HTTP exchange.
 *
 * <p>One consumer thread only.
 *
 * @param <T> element type
 */
public final class BlockingFluxIterator<T> implements EngineStream<T> {

    private static final Logger LOG = LogManager.getLogger(BlockingFluxIterator.class);

    private static final long POLL_SLICE_MS = 50;

    private final Flux<T> source;
    private final CancellationToken token;
    private final Duration idleTimeout;
    private final Function<Throwable, ? extends RuntimeException> errorMapper;
    private final BlockingQueue<Signal<T>> signals = new LinkedBlockingQueue<>();

    private volatile Disposable subscription;
    private Runnable deregistration;
    private T next;
    private boolean finished;
    private volatile boolean closed;

    /**
     * @param source      cold flux to consume
     * @param token       session cancellation token
     * @param idleTimeout maximum wait for one increment
     * @param errorMapper turns a stream failure into the engine's exception type
     */
    public BlockingFluxIterator(Flux<T> source, CancellationToken token, Duration idleTimeout,
                                Function<Throwable, ? extends RuntimeException> errorMapper) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        this.errorMapper = Objects.requireNonNull(errorMapper, "errorMapper must not be null");
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished || closed) {
            return false;
        }
        subscribeIfNeeded();

        long deadline = System.nanoTime() + idleTimeout.toNanos();
        while (true) {
            if (token.isCancelled()) {
                close();
                return false;
            }
            Signal<T> signal;
            try {
                signal = signals.poll(POLL_SLICE_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw errorMapper.apply(e);
            }
            if (signal == null) {
                if (System.nanoTime() - deadline > 0) {
                    close();
                    throw errorMapper.apply(new TimeoutException("No data received within " + idleTimeout.toMillis() + "ms"));
                }
                continue;
            }
            if (signal instanceof Item<T> item) {
                next = item.value();
                return true;
            }
            finished = true;
            release();
            if (signal instanceof Failure<T> failure) {
                throw errorMapper.apply(failure.cause());
            }
            return false;
        }
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T element = next;
        next = null;
        return element;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Disposable current = subscription;
        if (current != null && !current.isDisposed()) {
            current.dispose();
            LOG.debug("Engine stream disposed before completion");
        }
        release();
    }

    private void subscribeIfNeeded() {
        if (subscription != null) {
            return;
        }
        subscription = source.subscribe(
                value -> signals.add(new Item<>(value)),
                error -> signals.add(new Failure<>(error)),
                () -> signals.add(new Complete<>()));
        deregistration = token.onCancel(this::dispose);
    }

    private void dispose() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }

    private void release() {
        if (deregistration != null) {
            deregistration.run();
            deregistration = null;
        }
    }

    private sealed interface Signal<T> permits Item, Failure, Complete {
    }

    private record Item<T>(T value) implements Signal<T> {
    }

    private record Failure<T>(Throwable cause) implements Signal<T> {
    }

    private record Complete<T>() implements Signal<T> {
    }
}
