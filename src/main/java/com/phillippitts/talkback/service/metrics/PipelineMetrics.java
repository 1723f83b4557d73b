package com.phillippitts.talkback.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the voice pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Engine call latency per stage (transcription, generation, synthesis)</li>
 *   <li>Success/failure rates per stage and engine</li>
 *   <li>Session lifecycle (opened, closed by reason)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "talkback.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one engine call.
     *
     * @param stage         stage name (transcription, generation, synthesis)
     * @param engineName    engine name (whisper, ollama, kokoro)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String stage, String engineName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by an engine call")
                .tag("stage", stage)
                .tag("engine", engineName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String stage, String engineName) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful engine calls")
                .tag("stage", stage)
                .tag("engine", engineName)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param reason failure reason (empty-result, engine-failure, cancelled)
     */
    public void incrementFailure(String stage, String engineName, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed engine calls")
                .tag("stage", stage)
                .tag("engine", engineName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSessionsOpened() {
        Counter.builder(METRIC_PREFIX + ".sessions.opened")
                .description("Number of sessions created")
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the session ended (disconnect, cancel, fatal-error, shutdown)
     */
    public void incrementSessionsClosed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.closed")
                .description("Number of sessions closed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
