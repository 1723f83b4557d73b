package com.phillippitts.talkback.service.events;

import java.time.Instant;

/**
 * Published when a pipeline stage reports an error upstream.
 *
 * <p>PII note: never carries transcript or response text; restrict to technical diagnostics.
 *
 * @param sessionId session that reported the failure
 * @param stage     stage name (transcription, generation, synthesis, output)
 * @param reason    short reason tag (engine-failure, transport-failure, stage-crashed)
 * @param message   technical detail
 * @param fatal     whether the session was cancelled because of it
 * @param at        when the failure was reported
 */
public record StageFailureEvent(
        String sessionId,
        String stage,
        String reason,
        String message,
        boolean fatal,
        Instant at
) {
    public StageFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
