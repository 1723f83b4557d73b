package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.service.bus.FrameEmitter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * FrameEmitter that records frames instead of routing them, for testing one stage in isolation.
 */
public class RecordingEmitter implements FrameEmitter {

    public final List<Frame> downstream = new CopyOnWriteArrayList<>();
    public final List<Frame> upstream = new CopyOnWriteArrayList<>();

    @Override
    public void pushDownstream(Frame frame) {
        downstream.add(frame);
    }

    @Override
    public void pushUpstream(Frame frame) {
        upstream.add(frame);
    }

    public <T extends Frame> List<T> downstreamOfType(Class<T> type) {
        return downstream.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
