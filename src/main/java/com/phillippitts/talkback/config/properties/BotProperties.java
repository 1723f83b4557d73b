package com.phillippitts.talkback.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bot personality selection. Binds to properties prefixed with "bot".
 *
 * @param name      personality file name without the {@code .txt} extension; blank selects the
 *                  built-in default prompt
 * @param directory directory holding {@code <name>.txt} personality files
 */
@ConfigurationProperties(prefix = "bot")
@Validated
public record BotProperties(
        String name,

        @NotBlank(message = "Bot directory must not be blank")
        String directory
) {
    public BotProperties {
        name = name == null ? "" : name.trim();
        directory = directory == null ? "bots" : directory;
    }
}
