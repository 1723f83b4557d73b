package com.phillippitts.talkback.service.bus;

import com.phillippitts.talkback.domain.Frame;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Ordered, typed channel connecting the stages of one session.
 *
 * <p>Stages are arranged head to tail. Each stage owns a {@link SerialLane}; a frame pushed
 * downstream by stage {@code i} is queued on the lane of stage {@code i + 1}, so a stage sees
 * frames in exactly the order its predecessor emitted them. Frames pushed past the tail are
 * dropped. Upstream frames go straight to the session's upstream sink; no stage lane sees them.
 *
 * <p><b>Cancellation:</b> {@link #cancel()} closes the bus (later pushes are dropped), clears
 * every lane, and queues an acknowledgement behind any in-flight frame. The returned future
 * completes once every lane has acknowledged.
 *
 * <p>Thread-safe. One bus per session; nothing is shared across sessions.
 */
public final class FrameBus {

    private static final Logger LOG = LogManager.getLogger(FrameBus.class);

    private final String sessionId;
    private final List<FrameProcessor> processors;
    private final List<SerialLane> lanes;
    private final Consumer<Frame> upstreamSink;
    private volatile boolean closed;

    /**
     * @param sessionId    owning session, for logs
     * @param processors   stages in head-to-tail order
     * @param executor     shared executor that runs the lanes
     * @param upstreamSink receives every upstream frame
     */
    public FrameBus(String sessionId, List<FrameProcessor> processors, Executor executor,
                    Consumer<Frame> upstreamSink) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.processors = List.copyOf(processors);
        if (this.processors.isEmpty()) {
            throw new IllegalArgumentException("At least one processor is required");
        }
        Objects.requireNonNull(executor, "executor must not be null");
        this.upstreamSink = Objects.requireNonNull(upstreamSink, "upstreamSink must not be null");
        List<SerialLane> created = new ArrayList<>(this.processors.size());
        for (FrameProcessor processor : this.processors) {
            created.add(new SerialLane(processor.name(), executor));
        }
        this.lanes = List.copyOf(created);
    }

    /** Queues a frame on the head stage. */
    public void pushDownstream(Frame frame) {
        deliver(0, frame);
    }

    /**
     * Closes the bus and waits for every lane to acknowledge.
     *
     * @return completes when each stage has run {@link FrameProcessor#onCancel()}
     */
    public CompletableFuture<Void> cancel() {
        closed = true;
        List<CompletableFuture<Void>> acks = new ArrayList<>(lanes.size());
        for (int i = 0; i < lanes.size(); i++) {
            SerialLane lane = lanes.get(i);
            FrameProcessor processor = processors.get(i);
            int dropped = lane.clear();
            if (dropped > 0) {
                LOG.debug("Dropped {} queued frame(s) on lane '{}' for session {}", dropped, lane.name(), sessionId);
            }
            CompletableFuture<Void> ack = new CompletableFuture<>();
            lane.submit(() -> {
                try {
                    processor.onCancel();
                } catch (RuntimeException e) {
                    LOG.warn("Stage '{}' failed during cancellation: {}", processor.name(), e.getMessage());
                } finally {
                    ack.complete(null);
                }
            });
            acks.add(ack);
        }
        return CompletableFuture.allOf(acks.toArray(new CompletableFuture<?>[0]));
    }

    public boolean isClosed() {
        return closed;
    }

    /** Stage names in head-to-tail order. */
    public List<String> stageNames() {
        return processors.stream().map(FrameProcessor::name).toList();
    }

    private void deliver(int index, Frame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        if (closed) {
            LOG.trace("Bus closed; dropping {}", frame.type());
            return;
        }
        if (index >= processors.size()) {
            LOG.trace("Frame {} reached the end of the pipeline", frame.type());
            return;
        }
        lanes.get(index).submit(() -> runStage(index, frame));
    }

    private void runStage(int index, Frame frame) {
        if (closed) {
            return;
        }
        FrameProcessor processor = processors.get(index);
        try {
            processor.process(frame, new LaneEmitter(index));
        } catch (RuntimeException e) {
            LOG.error("Stage '{}' crashed processing {} in session {}", processor.name(), frame.type(), sessionId, e);
            reportUpstream(Frame.StageError.fatal(processor.name(), "stage-crashed", e.getMessage()));
        }
    }

    private void reportUpstream(Frame frame) {
        Objects.requireNonNull(frame, "frame must not be null");
        try {
            upstreamSink.accept(frame);
        } catch (RuntimeException e) {
            LOG.error("Upstream sink failed for {} in session {}", frame.type(), sessionId, e);
        }
    }

    private final class LaneEmitter implements FrameEmitter {

        private final int index;

        private LaneEmitter(int index) {
            this.index = index;
        }

        @Override
        public void pushDownstream(Frame frame) {
            deliver(index + 1, frame);
        }

        @Override
        public void pushUpstream(Frame frame) {
            reportUpstream(frame);
        }
    }
}
