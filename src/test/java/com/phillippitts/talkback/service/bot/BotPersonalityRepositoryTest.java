package com.phillippitts.talkback.service.bot;

import com.phillippitts.talkback.exception.BotNotFoundException;
import com.phillippitts.talkback.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BotPersonalityRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void shouldLoadTrimmedPrompt() throws IOException {
        Files.writeString(dir.resolve("librarian.txt"), "\n  You are a quiet librarian.  \n");
        BotPersonalityRepository repository = new BotPersonalityRepository(dir);

        assertThat(repository.loadPrompt("librarian")).isEqualTo("You are a quiet librarian.");
    }

    @Test
    void shouldListAvailableBotsSorted() throws IOException {
        Files.writeString(dir.resolve("zed.txt"), "z");
        Files.writeString(dir.resolve("alpha.txt"), "a");
        Files.writeString(dir.resolve("notes.md"), "ignored");
        Files.createDirectory(dir.resolve("nested.txt"));

        assertThat(new BotPersonalityRepository(dir).listAvailable()).containsExactly("alpha", "zed");
    }

    @Test
    void shouldReturnEmptyListWhenDirectoryIsMissing() {
        assertThat(new BotPersonalityRepository(dir.resolve("missing")).listAvailable()).isEmpty();
    }

    @Test
    void shouldNameAlternativesWhenBotIsMissing() throws IOException {
        Files.writeString(dir.resolve("chatbot.txt"), "hello");

        assertThatThrownBy(() -> new BotPersonalityRepository(dir).loadPrompt("pirate"))
                .isInstanceOf(BotNotFoundException.class)
                .hasMessageContaining("'pirate'")
                .hasMessageContaining("chatbot");
    }

    @Test
    void shouldRejectEmptyPromptFile() throws IOException {
        Files.writeString(dir.resolve("blank.txt"), "   \n");

        assertThatThrownBy(() -> new BotPersonalityRepository(dir).loadPrompt("blank"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("is empty");
    }

    @Test
    void shouldRejectPathTraversal() {
        BotPersonalityRepository repository = new BotPersonalityRepository(dir);

        assertThatThrownBy(() -> repository.loadPrompt("../secrets"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid bot name");
        assertThatThrownBy(() -> repository.loadPrompt("a/b"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldResolveDefaultPromptForBlankName() {
        BotPersonalityRepository repository = new BotPersonalityRepository(dir);

        assertThat(repository.resolveSystemPrompt("")).isEqualTo(BotPersonalityRepository.DEFAULT_SYSTEM_PROMPT);
        assertThat(repository.resolveSystemPrompt(null)).isEqualTo(BotPersonalityRepository.DEFAULT_SYSTEM_PROMPT);
    }
}
