package com.phillippitts.talkback.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for pipeline failure and lifecycle events. Privacy-safe and throttled
 * per failure kind to avoid log spam when an engine is down.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onStageFailure(StageFailureEvent e) {
        if (e.fatal()) {
            LOG.error("Fatal {} failure in session {}: reason={}, detail={}",
                    e.stage(), e.sessionId(), e.reason(), e.message());
            return;
        }
        String key = "stage-" + e.stage() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Stage {} degraded: reason={}, detail={}. Check that the engine server is running.",
                    e.stage(), e.reason(), e.message());
        }
    }

    @EventListener
    void onSessionClosed(SessionClosedEvent e) {
        if (e.acknowledged()) {
            LOG.info("Session {} closed: reason={}, lifetime={}s", e.sessionId(), e.reason(),
                    e.lifetime().toSeconds());
        } else {
            LOG.warn("Session {} closed without every stage acknowledging cancellation: reason={}",
                    e.sessionId(), e.reason());
        }
    }

    @EventListener
    void onStateChanged(SessionStateChangedEvent e) {
        LOG.debug("Session {} state {} -> {}", e.sessionId(), e.from(), e.to());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
