package com.phillippitts.talkback.service.events;

import com.phillippitts.talkback.service.pipeline.PipelineState;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility for publishing pipeline events.
 *
 * <p>A null publisher is tolerated and publishes nothing, so pipelines can run without a
 * Spring context in tests.
 */
public final class PipelineEventPublisher {

    private PipelineEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishStageFailure(ApplicationEventPublisher publisher, String sessionId, String stage,
                                           String reason, String message, boolean fatal) {
        if (publisher != null) {
            publisher.publishEvent(new StageFailureEvent(sessionId, stage, reason, message, fatal, Instant.now()));
        }
    }

    public static void publishStateChange(ApplicationEventPublisher publisher, String sessionId,
                                          PipelineState from, PipelineState to) {
        if (publisher != null) {
            publisher.publishEvent(new SessionStateChangedEvent(sessionId, from, to, Instant.now()));
        }
    }

    public static void publishClosed(ApplicationEventPublisher publisher, String sessionId, String reason,
                                     Duration lifetime, boolean acknowledged) {
        if (publisher != null) {
            publisher.publishEvent(new SessionClosedEvent(sessionId, reason, lifetime, acknowledged, Instant.now()));
        }
    }
}
