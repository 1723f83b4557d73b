package com.phillippitts.talkback.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * One turn of the conversation history.
 *
 * @param role    who produced the turn
 * @param content the turn text (never null)
 */
public record Message(Role role, String content) {

    public enum Role {
        SYSTEM, USER, ASSISTANT;

        /** Lower-case wire name used by chat-completion APIs. */
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }
}
