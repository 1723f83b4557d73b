package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.domain.Utterance;
import com.phillippitts.talkback.exception.TransportException;
import com.phillippitts.talkback.service.audio.EnergyVadAnalyzer;
import com.phillippitts.talkback.service.bus.FrameBus;
import com.phillippitts.talkback.service.events.PipelineEventPublisher;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the lifecycle of one session's pipeline.
 *
 * <p>Transport callbacks enter through {@link #dispatch(TransportEvent)}. Ingest never waits on
 * inference: audio is appended to the utterance buffer and completed utterances are queued on
 * the frame bus. Stage errors arrive on the upstream side of the bus; fatal ones cancel the
 * session.
 *
 * <p><b>Cancellation order:</b>
 * <ol>
 *   <li>state moves to CANCELLING, so further ingest is ignored</li>
 *   <li>the session token fires, aborting in-flight engine calls</li>
 *   <li>the bus drops queued frames and asks every lane to acknowledge</li>
 *   <li>once all lanes acknowledged, or the cancel timeout expired, buffers are released and
 *       the state moves to CLOSED</li>
 * </ol>
 *
 * <p>Thread-safe. Ingest dispatch calls are serialized by an ingest lock; cancellation is not.
 */
public class PipelineRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineRunner.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String EVENT_ERROR = "error";

    private final Session session;
    private final FrameBus bus;
    private final boolean greetOnReady;
    private final long cancelTimeoutMs;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final PipelineStateMachine stateMachine = new PipelineStateMachine();
    private final ReentrantLock ingestLock = new ReentrantLock();
    private final CompletableFuture<String> closed = new CompletableFuture<>();
    private final Instant createdAt = Instant.now();

    /**
     * @param session         the session's components
     * @param executor        shared executor running the stage lanes
     * @param greetOnReady    push {@code KICKOFF} once the client is ready
     * @param cancelTimeoutMs upper bound on waiting for stage acknowledgements
     * @param publisher       Spring event publisher (may be null in tests)
     * @param metrics         pipeline metrics
     */
    public PipelineRunner(Session session, Executor executor, boolean greetOnReady, long cancelTimeoutMs,
                          ApplicationEventPublisher publisher, PipelineMetrics metrics) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.greetOnReady = greetOnReady;
        this.cancelTimeoutMs = cancelTimeoutMs;
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.bus = new FrameBus(session.id(), session.stages(), executor, this::onUpstream);
        metrics.incrementSessionsOpened();
    }

    /**
     * Single entry point for transport callbacks.
     *
     * <p>Cancel and disconnect skip the ingest lock, so the session token fires even while
     * another thread is still ingesting.
     */
    public void dispatch(TransportEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_SESSION_ID, session.id())) {
            switch (event.type()) {
                case CANCEL_REQUESTED -> cancel("cancel");
                case CLIENT_DISCONNECTED -> cancel("disconnect");
                default -> {
                    ingestLock.lock();
                    try {
                        handle(event);
                    } finally {
                        ingestLock.unlock();
                    }
                }
            }
        }
    }

    public PipelineState state() {
        return stateMachine.current();
    }

    public String sessionId() {
        return session.id();
    }

    public Session session() {
        return session;
    }

    /**
     * Completes with the close reason once the session reaches CLOSED.
     */
    public CompletableFuture<String> closed() {
        return closed;
    }

    /**
     * Cancels the session. Idempotent; only the first reason is kept.
     *
     * @param reason why the session ends (disconnect, cancel, fatal-error, shutdown)
     * @return completes with the effective reason once the session is CLOSED
     */
    public CompletableFuture<String> cancel(String reason) {
        PipelineState previous = stateMachine.beginCancel();
        if (previous == null) {
            return closed;
        }
        LOG.info("Cancelling session {} from {}: {}", session.id(), previous, reason);
        PipelineEventPublisher.publishStateChange(publisher, session.id(), previous, PipelineState.CANCELLING);

        session.token().cancel();
        bus.cancel()
                .orTimeout(cancelTimeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> finishClose(reason, error == null));
        return closed;
    }

    private void handle(TransportEvent event) {
        switch (event.type()) {
            case CLIENT_CONNECTED -> moveTo(PipelineState.IDLE, PipelineState.CONNECTED);
            case CLIENT_READY -> onClientReady();
            case AUDIO_RECEIVED -> onAudio(((TransportEvent.AudioReceived) event).chunk());
            case VOICE_ACTIVITY -> onVoiceActivity(((TransportEvent.VoiceActivity) event).kind());
            default -> LOG.warn("Unhandled transport event {}", event.type());
        }
    }

    private void onClientReady() {
        if (!moveTo(PipelineState.CONNECTED, PipelineState.READY)) {
            return;
        }
        if (greetOnReady) {
            bus.pushDownstream(Frame.ControlSignal.of(Kind.KICKOFF));
            moveTo(PipelineState.READY, PipelineState.ACTIVE);
        }
    }

    private void onAudio(Frame.AudioChunk chunk) {
        PipelineState current = stateMachine.current();
        if (current == PipelineState.READY) {
            moveTo(PipelineState.READY, PipelineState.ACTIVE);
        } else if (current != PipelineState.ACTIVE) {
            LOG.trace("Dropping {} bytes of audio in state {}", chunk.length(), current);
            return;
        }

        Optional<EnergyVadAnalyzer> vad = session.vad();
        List<EnergyVadAnalyzer.Transition> transitions = vad.isPresent() ? vad.get().analyze(chunk) : List.of();
        if (transitions.isEmpty()) {
            session.buffer().accept(chunk).forEach(this::submitUtterance);
            return;
        }
        // Split at each boundary so audio on either side lands in the right utterance
        int from = 0;
        for (EnergyVadAnalyzer.Transition transition : transitions) {
            acceptSegment(chunk, from, transition.byteOffset());
            session.buffer().signal(transition.kind()).ifPresent(this::submitUtterance);
            from = transition.byteOffset();
        }
        acceptSegment(chunk, from, chunk.length());
    }

    private void acceptSegment(Frame.AudioChunk chunk, int from, int to) {
        if (to > from) {
            session.buffer().accept(chunk.slice(from, to)).forEach(this::submitUtterance);
        }
    }

    private void onVoiceActivity(Kind kind) {
        PipelineState current = stateMachine.current();
        if (current != PipelineState.READY && current != PipelineState.ACTIVE) {
            LOG.debug("Ignoring {} in state {}", kind, current);
            return;
        }
        session.buffer().signal(kind).ifPresent(this::submitUtterance);
    }

    private void submitUtterance(Utterance utterance) {
        LOG.debug("Submitting utterance {} ({} bytes) for transcription", utterance.id(), utterance.byteCount());
        bus.pushDownstream(new Frame.UtteranceReady(utterance));
    }

    private void onUpstream(Frame frame) {
        if (frame.type() != Frame.FrameType.STAGE_ERROR) {
            LOG.debug("Ignoring upstream {}", frame.type());
            return;
        }
        Frame.StageError error = (Frame.StageError) frame;
        PipelineEventPublisher.publishStageFailure(publisher, session.id(), error.stage(), error.reason(),
                error.message(), error.fatal());

        if (!error.fatal()) {
            notifyClient(error);
            return;
        }
        if (!"transport-failure".equals(error.reason())) {
            notifyClient(error);
        }
        cancel("fatal-error");
    }

    private void notifyClient(Frame.StageError error) {
        if (stateMachine.current().isTerminating()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("stage", error.stage());
        data.put("reason", error.reason());
        data.put("fatal", error.fatal());
        try {
            session.transport().sendEvent(EVENT_ERROR, data);
        } catch (TransportException e) {
            LOG.warn("Could not report {} error to client: {}", error.stage(), e.getMessage());
            cancel("fatal-error");
        }
    }

    private void finishClose(String reason, boolean acknowledged) {
        if (!acknowledged) {
            LOG.warn("Not every stage acknowledged cancellation of session {} within {}ms",
                    session.id(), cancelTimeoutMs);
        }
        ingestLock.lock();
        try {
            session.buffer().reset();
            session.vad().ifPresent(EnergyVadAnalyzer::reset);
        } finally {
            ingestLock.unlock();
        }
        moveTo(PipelineState.CANCELLING, PipelineState.CLOSED);
        metrics.incrementSessionsClosed(reason);
        PipelineEventPublisher.publishClosed(publisher, session.id(), reason,
                Duration.between(createdAt, Instant.now()), acknowledged);
        closed.complete(reason);
    }

    private boolean moveTo(PipelineState from, PipelineState to) {
        if (!stateMachine.transition(from, to)) {
            LOG.debug("Ignoring transition {} -> {} in state {}", from, to, stateMachine.current());
            return false;
        }
        PipelineEventPublisher.publishStateChange(publisher, session.id(), from, to);
        return true;
    }
}
