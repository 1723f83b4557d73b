package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.config.properties.PipelineProperties;
import com.phillippitts.talkback.domain.ConversationContext;
import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;
import com.phillippitts.talkback.service.bus.FrameEmitter;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Pipeline stage that turns final transcripts into streamed assistant responses.
 *
 * <p>Owns the session's {@link ConversationContext}; no other component writes to it. For each
 * final transcript the stage forwards the transcript, then emits one response bracketed by
 * {@code RESPONSE_START} and {@code RESPONSE_END} with the text deltas in between.
 *
 * <p>On {@code KICKOFF} the stage greets according to the configured greeting mode.
 */
public class GenerationStage implements FrameProcessor {

    private static final Logger LOG = LogManager.getLogger(GenerationStage.class);

    public static final String NAME = "generation";

    private final LlmEngine engine;
    private final ConversationContext context;
    private final CancellationToken token;
    private final PipelineProperties.Conversation settings;
    private final PipelineMetrics metrics;

    public GenerationStage(LlmEngine engine, ConversationContext context, CancellationToken token,
                           PipelineProperties.Conversation settings, PipelineMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Frame frame, FrameEmitter emitter) {
        switch (frame.type()) {
            case FINAL_TRANSCRIPT -> {
                emitter.pushDownstream(frame);
                emit(respond(((Frame.FinalTranscript) frame).text()), emitter);
            }
            case CONTROL_SIGNAL -> {
                if (((Frame.ControlSignal) frame).kind() == Kind.KICKOFF) {
                    greet(emitter);
                } else {
                    emitter.pushDownstream(frame);
                }
            }
            default -> emitter.pushDownstream(frame);
        }
    }

    /**
     * Appends the user turn and returns the lazily streamed reply.
     *
     * <p>A user turn still waiting for an answer absorbs the new text instead.
     */
    public ResponseStream respond(String userText) {
        Objects.requireNonNull(userText, "userText must not be null");
        context.appendUser(userText);
        if (LOG.isDebugEnabled()) {
            LOG.debug("User turn appended: {}", LogSanitizer.preview(userText));
        }
        return newStream();
    }

    /**
     * Generates a greeting from the system prompt alone.
     *
     * <p>Only valid before the first user turn.
     *
     * @throws IllegalStateException if the conversation already has turns
     */
    public ResponseStream introduce() {
        if (context.size() != 1) {
            throw new IllegalStateException("Introduction is only possible at the start of a conversation");
        }
        return newStream();
    }

    public ConversationContext context() {
        return context;
    }

    private ResponseStream newStream() {
        return new ResponseStream(context, () -> engine.streamChat(context.messages(), token), token,
                settings.fallbackResponse());
    }

    private void greet(FrameEmitter emitter) {
        switch (settings.greetingMode()) {
            case STATIC -> {
                String text = settings.greetingText();
                if (text.isBlank()) {
                    LOG.warn("Static greeting configured without text; skipping greeting");
                    return;
                }
                context.appendAssistant(text);
                emitter.pushDownstream(Frame.ControlSignal.of(Kind.RESPONSE_START));
                emitter.pushDownstream(new Frame.TextDelta(text));
                emitter.pushDownstream(Frame.ControlSignal.of(Kind.RESPONSE_END));
            }
            case GENERATED -> emit(introduce(), emitter);
            case NONE -> LOG.debug("Greeting disabled");
            default -> throw new IllegalStateException("Unknown greeting mode: " + settings.greetingMode());
        }
    }

    private void emit(ResponseStream response, FrameEmitter emitter) {
        long start = System.nanoTime();
        int deltas = 0;
        emitter.pushDownstream(Frame.ControlSignal.of(Kind.RESPONSE_START));
        try (response) {
            while (response.hasNext()) {
                emitter.pushDownstream(response.next());
                deltas++;
            }
        }
        emitter.pushDownstream(Frame.ControlSignal.of(Kind.RESPONSE_END));

        ResponseStream.Outcome outcome = response.outcome();
        switch (outcome) {
            case COMPLETED -> {
                metrics.recordLatency(NAME, engine.getEngineName(), System.nanoTime() - start);
                metrics.incrementSuccess(NAME, engine.getEngineName());
                LOG.info("Response completed: {} delta(s), {} chars", deltas, response.text().length());
            }
            case FAILED -> {
                metrics.incrementFailure(NAME, engine.getEngineName(), "engine-failure");
                emitter.pushUpstream(Frame.StageError.recoverable(NAME, "engine-failure",
                        response.failure() == null ? "" : response.failure().getMessage()));
            }
            case EMPTY -> metrics.incrementFailure(NAME, engine.getEngineName(), "empty-result");
            case CANCELLED -> {
                metrics.incrementFailure(NAME, engine.getEngineName(), "cancelled");
                LOG.debug("Response cancelled after {} delta(s)", deltas);
            }
            default -> LOG.warn("Response ended in unexpected state {}", outcome);
        }
    }
}
