package com.phillippitts.talkback;

import com.phillippitts.talkback.config.engine.KokoroConfig;
import com.phillippitts.talkback.config.engine.OllamaConfig;
import com.phillippitts.talkback.config.engine.WhisperConfig;
import com.phillippitts.talkback.config.properties.BotProperties;
import com.phillippitts.talkback.config.properties.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        OllamaConfig.class,
        KokoroConfig.class,
        PipelineProperties.class,
        BotProperties.class
})
public class TalkBackApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkBackApplication.class, args);
    }

}
