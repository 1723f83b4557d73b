package com.phillippitts.talkback.service.bot;

import com.phillippitts.talkback.config.properties.BotProperties;
import com.phillippitts.talkback.exception.BotNotFoundException;
import com.phillippitts.talkback.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Loads bot personalities (system prompts) from {@code <directory>/<name>.txt} files.
 */
@Component
public class BotPersonalityRepository {

    private static final Logger LOG = LogManager.getLogger(BotPersonalityRepository.class);

    private static final String EXTENSION = ".txt";

    /** System prompt used when no bot name is configured. */
    public static final String DEFAULT_SYSTEM_PROMPT = "You are Chatbot, a friendly, helpful robot. "
            + "Your goal is to demonstrate your capabilities in a succinct way. "
            + "Your output will be converted to audio so don't include special characters in your answers. "
            + "Respond to what the user said in a creative and helpful way, but keep your responses brief. "
            + "Start by introducing yourself.";

    private final Path directory;

    @Autowired
    public BotPersonalityRepository(BotProperties properties) {
        this(Paths.get(properties.directory()));
    }

    BotPersonalityRepository(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /**
     * Loads the system prompt of a named bot.
     *
     * @param botName file name without the {@code .txt} extension
     * @return the trimmed file content
     * @throws BotNotFoundException if no such file exists
     * @throws ConfigurationException if the file is empty or unreadable, or the name is invalid
     */
    public String loadPrompt(String botName) {
        Objects.requireNonNull(botName, "botName must not be null");
        if (botName.isBlank() || botName.contains("/") || botName.contains("\\") || botName.contains("..")) {
            throw new ConfigurationException("Invalid bot name: '" + botName + "'");
        }
        Path file = directory.resolve(botName + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new BotNotFoundException(botName, listAvailable());
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read bot file " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigurationException("Bot file '" + file + "' is empty");
        }
        return content;
    }

    /**
     * Lists bot names available in the bots directory, sorted.
     *
     * @return names without extension; empty if the directory does not exist
     */
    public List<String> listAvailable() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to list bots in " + directory, e);
        }
    }

    /**
     * Resolves the system prompt for a configured bot name.
     *
     * @param botName bot name, or null/blank for the built-in default
     */
    public String resolveSystemPrompt(String botName) {
        if (botName == null || botName.isBlank()) {
            LOG.info("No bot personality configured; using the default system prompt");
            return DEFAULT_SYSTEM_PROMPT;
        }
        String prompt = loadPrompt(botName);
        LOG.info("Loaded bot personality '{}' ({} chars)", botName, prompt.length());
        return prompt;
    }

    public Path directory() {
        return directory;
    }
}
