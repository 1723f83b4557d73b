package com.phillippitts.talkback.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, append-only dialogue history for one session.
 *
 * <p>Invariants:
 * <ul>
 *   <li>exactly one {@link Message.Role#SYSTEM} message, always first</li>
 *   <li>after it, USER and ASSISTANT turns strictly alternate</li>
 *   <li>an ASSISTANT turn is appended whole, never partially</li>
 * </ul>
 *
 * <p>A USER turn left unanswered (the model failed) stays in place. When the next user text
 * arrives it is merged into that turn instead of appended, so alternation is preserved.
 *
 * <p>Only the session's generation stage mutates the context. Methods are synchronized so
 * readers on other threads see a consistent snapshot.
 */
public final class ConversationContext {

    private final List<Message> messages = new ArrayList<>();

    public ConversationContext(String systemPrompt) {
        Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
        if (systemPrompt.isBlank()) {
            throw new IllegalArgumentException("systemPrompt must not be blank");
        }
        messages.add(Message.system(systemPrompt));
    }

    /**
     * Appends a user turn, or merges into a dangling one.
     *
     * @return the user message now at the end of the context
     */
    public synchronized Message appendUser(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int last = messages.size() - 1;
        if (messages.get(last).role() == Message.Role.USER) {
            Message merged = Message.user(messages.get(last).content() + " " + text);
            messages.set(last, merged);
            return merged;
        }
        Message user = Message.user(text);
        messages.add(user);
        return user;
    }

    /**
     * Appends a complete assistant turn.
     *
     * <p>Allowed after a USER turn, or directly after the SYSTEM message for a greeting.
     *
     * @throws IllegalStateException if the previous turn is already an ASSISTANT turn
     */
    public synchronized Message appendAssistant(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (lastRole() == Message.Role.ASSISTANT) {
            throw new IllegalStateException("Two consecutive assistant turns are not allowed");
        }
        Message assistant = Message.assistant(text);
        messages.add(assistant);
        return assistant;
    }

    /** Immutable snapshot of the history, system message first. */
    public synchronized List<Message> messages() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized Message.Role lastRole() {
        return messages.get(messages.size() - 1).role();
    }

    /** True when the last turn is a user turn still waiting for an answer. */
    public synchronized boolean awaitingResponse() {
        return lastRole() == Message.Role.USER;
    }
}
