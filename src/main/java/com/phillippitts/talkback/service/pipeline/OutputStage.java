package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.exception.TransportException;
import com.phillippitts.talkback.service.bus.FrameEmitter;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Tail stage: delivers audio and transcript events to the transport.
 */
public class OutputStage implements FrameProcessor {

    private static final Logger LOG = LogManager.getLogger(OutputStage.class);

    public static final String NAME = "output";

    static final String EVENT_USER_TRANSCRIPT = "user-transcript";
    static final String EVENT_BOT_TEXT = "bot-text";

    private final TransportSink transport;

    public OutputStage(TransportSink transport) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void process(Frame frame, FrameEmitter emitter) {
        try {
            switch (frame.type()) {
                case AUDIO_CHUNK -> transport.sendAudio((Frame.AudioChunk) frame);
                case FINAL_TRANSCRIPT -> transport.sendEvent(EVENT_USER_TRANSCRIPT,
                        Map.of("text", ((Frame.FinalTranscript) frame).text()));
                case TEXT_DELTA -> transport.sendEvent(EVENT_BOT_TEXT,
                        Map.of("text", ((Frame.TextDelta) frame).text()));
                default -> LOG.trace("Output ignores {}", frame.type());
            }
        } catch (TransportException e) {
            LOG.warn("Delivery to client failed: {}", e.getMessage());
            emitter.pushUpstream(Frame.StageError.fatal(NAME, "transport-failure", e.getMessage()));
        }
    }
}
