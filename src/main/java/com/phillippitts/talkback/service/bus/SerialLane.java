package com.phillippitts.talkback.service.bus;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * FIFO mailbox that runs its tasks one at a time on a shared executor.
 *
 * <p>At most one drain loop is active per lane, so tasks never overlap and run in submission
 * order, while many lanes share the same pool threads. A task submitted from inside a running
 * task of the same lane is queued behind it rather than run re-entrantly.
 *
 * <p>Thread-safe.
 */
final class SerialLane {

    private static final Logger LOG = LogManager.getLogger(SerialLane.class);

    private final String name;
    private final Executor executor;
    private final Deque<Runnable> queue = new ArrayDeque<>();
    private boolean draining;

    SerialLane(String name, Executor executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    void submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        synchronized (this) {
            queue.addLast(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            int dropped;
            synchronized (this) {
                draining = false;
                dropped = queue.size();
                queue.clear();
            }
            LOG.error("Lane '{}' rejected by executor; dropped {} task(s)", name, dropped, e);
        }
    }

    /**
     * Drops every queued task. A task already running is not interrupted.
     *
     * @return number of dropped tasks
     */
    synchronized int clear() {
        int dropped = queue.size();
        queue.clear();
        return dropped;
    }

    synchronized int pending() {
        return queue.size();
    }

    String name() {
        return name;
    }

    private void drain() {
        while (true) {
            Runnable task;
            synchronized (this) {
                task = queue.pollFirst();
                if (task == null) {
                    draining = false;
                    return;
                }
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Task failed on lane '{}'", name, e);
            }
        }
    }
}
