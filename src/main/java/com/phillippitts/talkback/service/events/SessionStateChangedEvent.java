package com.phillippitts.talkback.service.events;

import com.phillippitts.talkback.service.pipeline.PipelineState;

import java.time.Instant;

/**
 * Published on every pipeline state transition.
 */
public record SessionStateChangedEvent(
        String sessionId,
        PipelineState from,
        PipelineState to,
        Instant at
) {
    public SessionStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
