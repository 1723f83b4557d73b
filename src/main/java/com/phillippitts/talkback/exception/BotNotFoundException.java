package com.phillippitts.talkback.exception;

import java.util.List;

/**
 * Thrown when a bot personality file cannot be found in the bots directory.
 */
public class BotNotFoundException extends ConfigurationException {

    private final String botName;
    private final List<String> availableBots;

    public BotNotFoundException(String botName, List<String> availableBots) {
        super("Bot personality '" + botName + "' not found. Available bots: "
                + (availableBots.isEmpty() ? "(none)" : String.join(", ", availableBots)));
        this.botName = botName;
        this.availableBots = List.copyOf(availableBots);
    }

    public String getBotName() {
        return botName;
    }

    public List<String> getAvailableBots() {
        return availableBots;
    }
}
