package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.config.engine.WhisperConfig;
import com.phillippitts.talkback.config.properties.BotProperties;
import com.phillippitts.talkback.config.properties.PipelineProperties;
import com.phillippitts.talkback.domain.Message;
import com.phillippitts.talkback.exception.BotNotFoundException;
import com.phillippitts.talkback.service.bot.BotPersonalityRepository;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.testutil.EventCapturingPublisher;
import com.phillippitts.talkback.testutil.FakeLlmEngine;
import com.phillippitts.talkback.testutil.FakeSttEngine;
import com.phillippitts.talkback.testutil.FakeTtsEngine;
import com.phillippitts.talkback.testutil.RecordingTransportSink;
import com.phillippitts.talkback.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionFactoryTest {

    @TempDir
    Path botsDir;

    private SessionFactory factory(PipelineProperties properties, String botName) {
        return new SessionFactory(new FakeSttEngine("hi"), new FakeLlmEngine("Hello."), new FakeTtsEngine(),
                properties, new WhisperConfig(null, null, null, 0),
                new BotPersonalityRepository(new BotProperties(botName, botsDir.toString())),
                new BotProperties(botName, botsDir.toString()),
                new SyncExecutor(), new EventCapturingPublisher(),
                new PipelineMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void shouldWireStagesInPipelineOrder() {
        PipelineRunner runner = factory(PipelineProperties.defaults(), "").create("s1", new RecordingTransportSink());

        assertThat(runner.session().stages())
                .extracting(FrameProcessor::name)
                .containsExactly("transcription", "generation", "synthesis", "output");
        assertThat(runner.sessionId()).isEqualTo("s1");
        assertThat(runner.state()).isEqualTo(PipelineState.IDLE);
        assertThat(runner.session().vad()).isEmpty();
    }

    @Test
    void shouldGiveEverySessionItsOwnState() {
        SessionFactory factory = factory(PipelineProperties.defaults(), "");

        PipelineRunner first = factory.create("a", new RecordingTransportSink());
        PipelineRunner second = factory.create("b", new RecordingTransportSink());

        assertThat(first.session().context()).isNotSameAs(second.session().context());
        assertThat(first.session().token()).isNotSameAs(second.session().token());
        assertThat(first.session().buffer()).isNotSameAs(second.session().buffer());
    }

    @Test
    void shouldUseDefaultPromptWhenNoBotConfigured() {
        PipelineRunner runner = factory(PipelineProperties.defaults(), "").create("s1", new RecordingTransportSink());

        assertThat(runner.session().context().messages())
                .containsExactly(Message.system(BotPersonalityRepository.DEFAULT_SYSTEM_PROMPT));
    }

    @Test
    void shouldSeedContextWithBotPersonality() throws IOException {
        Files.writeString(botsDir.resolve("pirate.txt"), "You are a pirate.\n");

        PipelineRunner runner = factory(PipelineProperties.defaults(), "pirate")
                .create("s1", new RecordingTransportSink());

        assertThat(runner.session().context().messages()).containsExactly(Message.system("You are a pirate."));
    }

    @Test
    void shouldFailFastForUnknownBot() {
        assertThatThrownBy(() -> factory(PipelineProperties.defaults(), "ghost"))
                .isInstanceOf(BotNotFoundException.class);
    }

    @Test
    void shouldCreateVadWhenEnabled() {
        PipelineProperties properties = new PipelineProperties(null,
                new PipelineProperties.Vad(true, null, null, null, null), null, null);

        PipelineRunner runner = factory(properties, "").create("s1", new RecordingTransportSink());

        assertThat(runner.session().vad()).isPresent();
        assertThat(runner.session().buffer().isVadObserved()).isTrue();
    }
}
