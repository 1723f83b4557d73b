package com.phillippitts.talkback.service.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Published once a session reaches CLOSED.
 *
 * @param sessionId     the closed session
 * @param reason        why it closed (disconnect, cancel, fatal-error, shutdown)
 * @param lifetime      time since the session was created
 * @param acknowledged  false if some stage did not acknowledge cancellation within the timeout
 * @param at            when the session closed
 */
public record SessionClosedEvent(
        String sessionId,
        String reason,
        Duration lifetime,
        boolean acknowledged,
        Instant at
) {
    public SessionClosedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
