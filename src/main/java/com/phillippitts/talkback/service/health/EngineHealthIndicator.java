package com.phillippitts.talkback.service.health;

import com.phillippitts.talkback.service.engine.InferenceEngine;
import com.phillippitts.talkback.service.llm.LlmEngine;
import com.phillippitts.talkback.service.stt.SttEngine;
import com.phillippitts.talkback.service.tts.TtsEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the three inference engines (speech-to-text, language model,
 * text-to-speech).
 *
 * <ul>
 *   <li>UP: every engine healthy</li>
 *   <li>DEGRADED: at least one engine healthy</li>
 *   <li>DOWN: no engine healthy</li>
 * </ul>
 *
 * <p>An engine turns unhealthy after repeated consecutive failures and recovers on its next
 * success. Exposed via /actuator/health.
 */
@Component
public class EngineHealthIndicator implements HealthIndicator {

    private final List<InferenceEngine> engines;

    public EngineHealthIndicator(SttEngine sttEngine, LlmEngine llmEngine, TtsEngine ttsEngine) {
        this.engines = List.of(sttEngine, llmEngine, ttsEngine);
    }

    @Override
    public Health health() {
        long healthy = engines.stream().filter(InferenceEngine::isHealthy).count();

        Health.Builder builder = new Health.Builder();
        if (healthy == engines.size()) {
            builder.up().withDetail("status", "All engines operational");
        } else if (healthy > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial engine availability");
        } else {
            builder.down().withDetail("status", "No engines available");
        }
        for (InferenceEngine engine : engines) {
            builder.withDetail(engine.getEngineName(), engine.isHealthy() ? "ready" : "unhealthy");
        }
        return builder.build();
    }
}
