package com.phillippitts.talkback.service.pipeline;

import com.phillippitts.talkback.config.engine.WhisperConfig;
import com.phillippitts.talkback.config.properties.BotProperties;
import com.phillippitts.talkback.config.properties.PipelineProperties;
import com.phillippitts.talkback.domain.ConversationContext;
import com.phillippitts.talkback.service.audio.EnergyVadAnalyzer;
import com.phillippitts.talkback.service.audio.UtteranceBuffer;
import com.phillippitts.talkback.service.bot.BotPersonalityRepository;
import com.phillippitts.talkback.service.bus.FrameProcessor;
import com.phillippitts.talkback.service.engine.CancellationToken;
import com.phillippitts.talkback.service.llm.GenerationStage;
import com.phillippitts.talkback.service.llm.LlmEngine;
import com.phillippitts.talkback.service.metrics.PipelineMetrics;
import com.phillippitts.talkback.service.stt.SttEngine;
import com.phillippitts.talkback.service.stt.TranscriptionStage;
import com.phillippitts.talkback.service.tts.PhraseAggregator;
import com.phillippitts.talkback.service.tts.SynthesisStage;
import com.phillippitts.talkback.service.tts.TtsEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Builds one fully wired pipeline per client connection.
 *
 * <p>The bot's system prompt is resolved once at construction, so a missing or empty
 * personality file aborts startup instead of failing the first session.
 */
@Component
public class SessionFactory {

    private static final Logger LOG = LogManager.getLogger(SessionFactory.class);

    private final SttEngine sttEngine;
    private final LlmEngine llmEngine;
    private final TtsEngine ttsEngine;
    private final PipelineProperties properties;
    private final String language;
    private final String systemPrompt;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;

    public SessionFactory(SttEngine sttEngine,
                          LlmEngine llmEngine,
                          TtsEngine ttsEngine,
                          PipelineProperties properties,
                          WhisperConfig whisperConfig,
                          BotPersonalityRepository bots,
                          BotProperties botProperties,
                          @Qualifier("pipelineExecutor") Executor executor,
                          ApplicationEventPublisher publisher,
                          PipelineMetrics metrics) {
        this.sttEngine = Objects.requireNonNull(sttEngine, "sttEngine must not be null");
        this.llmEngine = Objects.requireNonNull(llmEngine, "llmEngine must not be null");
        this.ttsEngine = Objects.requireNonNull(ttsEngine, "ttsEngine must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.language = whisperConfig.language();
        this.systemPrompt = bots.resolveSystemPrompt(botProperties.name());
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.publisher = publisher;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Creates the pipeline for a new connection. The runner starts in IDLE.
     *
     * @param sessionId unique connection id
     * @param transport outbound side of the connection
     */
    public PipelineRunner create(String sessionId, TransportSink transport) {
        CancellationToken token = new CancellationToken();
        ConversationContext context = new ConversationContext(systemPrompt);
        PipelineProperties.Conversation conversation = properties.getConversation();

        List<FrameProcessor> stages = List.of(
                new TranscriptionStage(sttEngine, language, token, metrics),
                new GenerationStage(llmEngine, context, token, conversation, metrics),
                new SynthesisStage(ttsEngine, token,
                        new PhraseAggregator(conversation.minPhraseChars(), conversation.maxPhraseChars()), metrics),
                new OutputStage(transport));

        PipelineProperties.Utterance utterance = properties.getUtterance();
        Optional<EnergyVadAnalyzer> vad = createVad();
        Session session = new Session(sessionId, stages,
                new UtteranceBuffer(utterance.thresholdBytes(), utterance.maxBytes(), utterance.preRollBytes(),
                        vad.isPresent()),
                context, token, transport, vad);

        boolean greet = conversation.greetingMode() != PipelineProperties.GreetingMode.NONE;
        LOG.debug("Created pipeline for session {} (greeting={}, vad={})", sessionId,
                conversation.greetingMode(), session.vad().isPresent());
        return new PipelineRunner(session, executor, greet, properties.getCancelTimeoutMs(), publisher, metrics);
    }

    private Optional<EnergyVadAnalyzer> createVad() {
        PipelineProperties.Vad vad = properties.getVad();
        if (!vad.enabled()) {
            return Optional.empty();
        }
        return Optional.of(new EnergyVadAnalyzer(vad.startThreshold(), vad.stopThreshold(), vad.windowMs(),
                vad.hangoverMs()));
    }
}
