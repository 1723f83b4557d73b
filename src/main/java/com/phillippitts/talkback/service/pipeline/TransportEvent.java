package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.domain.Frame;
import com.phillippitts.talkback.domain.Frame.ControlSignal.Kind;

import java.util.Objects;

/**
 * Callbacks from the transport, mapped onto the runner's single dispatch entry point.
 */
public sealed interface TransportEvent
        permits TransportEvent.ClientConnected,
                TransportEvent.ClientReady,
                TransportEvent.AudioReceived,
                TransportEvent.VoiceActivity,
                TransportEvent.CancelRequested,
                TransportEvent.ClientDisconnected {

    enum Type { CLIENT_CONNECTED, CLIENT_READY, AUDIO_RECEIVED, VOICE_ACTIVITY, CANCEL_REQUESTED, CLIENT_DISCONNECTED }

    Type type();

    record ClientConnected(String participant) implements TransportEvent {
        public ClientConnected {
            participant = participant == null ? "" : participant;
        }

        @Override
        public Type type() {
            return Type.CLIENT_CONNECTED;
        }
    }

    record ClientReady() implements TransportEvent {
        @Override
        public Type type() {
            return Type.CLIENT_READY;
        }
    }

    record AudioReceived(Frame.AudioChunk chunk) implements TransportEvent {
        public AudioReceived {
            Objects.requireNonNull(chunk, "chunk must not be null");
        }

        @Override
        public Type type() {
            return Type.AUDIO_RECEIVED;
        }
    }

    /** Client-side voice activity: {@code UTTERANCE_START} or {@code UTTERANCE_END}. */
    record VoiceActivity(Kind kind) implements TransportEvent {
        public VoiceActivity {
            Objects.requireNonNull(kind, "kind must not be null");
            if (kind != Kind.UTTERANCE_START && kind != Kind.UTTERANCE_END) {
                throw new IllegalArgumentException("Voice activity must be UTTERANCE_START or UTTERANCE_END, got: " + kind);
            }
        }

        @Override
        public Type type() {
            return Type.VOICE_ACTIVITY;
        }
    }

    record CancelRequested() implements TransportEvent {
        @Override
        public Type type() {
            return Type.CANCEL_REQUESTED;
        }
    }

    record ClientDisconnected(String reason) implements TransportEvent {
        public ClientDisconnected {
            reason = reason == null ? "" : reason;
        }

        @Override
        public Type type() {
            return Type.CLIENT_DISCONNECTED;
        }
    }
}
