package com.phillippitts.talkback.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerStageAndEngine() {
        metrics.recordLatency("transcription", "whisper", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordLatency("transcription", "whisper", TimeUnit.MILLISECONDS.toNanos(80));

        Timer timer = registry.get("talkback.pipeline.latency")
                .tag("stage", "transcription")
                .tag("engine", "whisper")
                .timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void shouldCountFailuresByReason() {
        metrics.incrementFailure("generation", "ollama", "engine-failure");
        metrics.incrementFailure("generation", "ollama", "engine-failure");
        metrics.incrementFailure("generation", "ollama", "cancelled");

        Counter failures = registry.get("talkback.pipeline.failure")
                .tag("reason", "engine-failure")
                .counter();
        assertThat(failures.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountSessionLifecycle() {
        metrics.incrementSessionsOpened();
        metrics.incrementSessionsOpened();
        metrics.incrementSessionsClosed("disconnect");

        assertThat(registry.get("talkback.pipeline.sessions.opened").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("talkback.pipeline.sessions.closed").tag("reason", "disconnect").counter().count())
                .isEqualTo(1.0);
    }
}
