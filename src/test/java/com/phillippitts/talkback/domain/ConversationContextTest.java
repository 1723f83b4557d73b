package com.phillippitts.talkback.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationContextTest {

    private static final String PROMPT = "You are a helpful robot.";

    @Test
    void shouldStartWithSystemMessageOnly() {
        ConversationContext context = new ConversationContext(PROMPT);

        assertThat(context.messages()).containsExactly(Message.system(PROMPT));
        assertThat(context.lastRole()).isEqualTo(Message.Role.SYSTEM);
        assertThat(context.awaitingResponse()).isFalse();
    }

    @Test
    void shouldRejectBlankSystemPrompt() {
        assertThatThrownBy(() -> new ConversationContext("  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConversationContext(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldAlternateUserAndAssistantTurns() {
        ConversationContext context = new ConversationContext(PROMPT);

        context.appendUser("hello there");
        assertThat(context.awaitingResponse()).isTrue();
        context.appendAssistant("Hi there!");
        context.appendUser("how are you");
        context.appendAssistant("Great.");

        assertThat(context.messages()).extracting(Message::role).containsExactly(
                Message.Role.SYSTEM, Message.Role.USER, Message.Role.ASSISTANT,
                Message.Role.USER, Message.Role.ASSISTANT);
    }

    @Test
    void shouldMergeTextIntoUnansweredUserTurn() {
        ConversationContext context = new ConversationContext(PROMPT);
        context.appendUser("what is");

        Message merged = context.appendUser("the time");

        assertThat(merged).isEqualTo(Message.user("what is the time"));
        assertThat(context.size()).isEqualTo(2);
    }

    @Test
    void shouldAllowGreetingDirectlyAfterSystemMessage() {
        ConversationContext context = new ConversationContext(PROMPT);

        context.appendAssistant("Hello, I am Chatbot.");

        assertThat(context.lastRole()).isEqualTo(Message.Role.ASSISTANT);
    }

    @Test
    void shouldRejectTwoConsecutiveAssistantTurns() {
        ConversationContext context = new ConversationContext(PROMPT);
        context.appendUser("hi");
        context.appendAssistant("Hello.");

        assertThatThrownBy(() -> context.appendAssistant("Hello again."))
                .isInstanceOf(IllegalStateException.class);
        assertThat(context.size()).isEqualTo(3);
    }

    @Test
    void shouldReturnImmutableSnapshot() {
        ConversationContext context = new ConversationContext(PROMPT);

        assertThatThrownBy(() -> context.messages().add(Message.user("sneaky")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(context.size()).isEqualTo(1);
    }
}
