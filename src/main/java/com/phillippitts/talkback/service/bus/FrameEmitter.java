package com.phillippitts.talkback.service.bus;

import com.phillippitts.talkback.domain.Frame;

/**
 * Output port handed to a {@link FrameProcessor} for each frame it processes.
 */
public interface FrameEmitter {

    /** Sends a frame to the next stage; dropped at the tail of the pipeline. */
    void pushDownstream(Frame frame);

    /** Reports a frame to the session owner (errors, control requests). */
    void pushUpstream(Frame frame);
}
