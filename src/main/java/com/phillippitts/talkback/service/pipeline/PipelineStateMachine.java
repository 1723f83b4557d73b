package com.phillippitts.talkback.service.pipeline;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state holder for one pipeline.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE → CONNECTED (client connected)
 * CONNECTED → READY (client ready)
 * READY → ACTIVE (first audio or greeting)
 * any non-terminal → CANCELLING (disconnect, cancel, fatal error)
 * CANCELLING → CLOSED (all stages acknowledged)
 * </pre>
 *
 * <p><b>Thread Safety:</b> All public methods use a {@link ReentrantLock} to protect
 * transitions. Each transition is a compare-and-set on the expected source state.
 */
public final class PipelineStateMachine {

    private final Lock lock = new ReentrantLock();
    private PipelineState state = PipelineState.IDLE;

    /**
     * Moves from {@code expected} to {@code target} if the machine is in {@code expected} and
     * the lifecycle allows it.
     *
     * @return {@code true} if the transition happened
     */
    public boolean transition(PipelineState expected, PipelineState target) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(target, "target must not be null");
        lock.lock();
        try {
            if (state != expected || !expected.canTransitionTo(target)) {
                return false;
            }
            state = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enters CANCELLING from any non-terminal state.
     *
     * @return the state left behind, or {@code null} if already cancelling or closed
     */
    public PipelineState beginCancel() {
        lock.lock();
        try {
            if (state.isTerminating()) {
                return null;
            }
            PipelineState previous = state;
            state = PipelineState.CANCELLING;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public PipelineState current() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
