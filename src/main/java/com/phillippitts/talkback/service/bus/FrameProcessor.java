package com.phillippitts.talkback.service.bus;

import com.phillippitts.talkback.domain.Frame;

/**
 * One stage of a session's frame pipeline.
 *
 * <p>The bus calls {@link #process} from the stage's serial lane, one frame at a time, in
 * arrival order. A stage never calls another stage directly; everything it produces goes
 * through the {@link FrameEmitter}. Frames a stage does not handle must be forwarded
 * downstream unchanged.
 *
 * <p>A {@link RuntimeException} escaping {@code process} is treated as a stage crash and
 * reported upstream as a fatal {@link Frame.StageError}. Expected engine failures should be
 * handled inside the stage instead.
 */
public interface FrameProcessor {

    /**
     * Short stage name used in logs, metrics and error reports (e.g. "transcription").
     */
    String name();

    /**
     * Handles one frame travelling downstream.
     *
     * @param frame   the frame; ownership passes to this stage
     * @param emitter sink for frames produced in response
     */
    void process(Frame frame, FrameEmitter emitter);

    /**
     * Called on the stage's lane once the session is cancelled and all queued frames were
     * dropped. Implementations release per-response state; they must not emit frames.
     */
    default void onCancel() {
    }
}
