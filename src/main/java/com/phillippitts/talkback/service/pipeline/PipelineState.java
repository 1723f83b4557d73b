package com.phillippitts.talkback.service.pipeline;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of one session's pipeline.
 */
public enum PipelineState {
    /** Created; no client yet. */
    IDLE,
    /** Transport connected; waiting for the client to be ready. */
    CONNECTED,
    /** Client ready; nothing spoken or heard yet. */
    READY,
    /** Conversation running. */
    ACTIVE,
    /** Tearing down; waiting for stages to acknowledge. */
    CANCELLING,
    /** Terminal. */
    CLOSED;

    /**
     * @return whether the lifecycle allows moving from this state to {@code target}
     */
    public boolean canTransitionTo(PipelineState target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminating() {
        return this == CANCELLING || this == CLOSED;
    }

    private Set<PipelineState> allowedTargets() {
        return switch (this) {
            case IDLE -> EnumSet.of(CONNECTED, CANCELLING);
            case CONNECTED -> EnumSet.of(READY, CANCELLING);
            case READY -> EnumSet.of(ACTIVE, CANCELLING);
            case ACTIVE -> EnumSet.of(CANCELLING);
            case CANCELLING -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.noneOf(PipelineState.class);
        };
    }
}
