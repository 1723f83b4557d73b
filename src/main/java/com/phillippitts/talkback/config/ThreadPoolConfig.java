package com.phillippitts.talkback.config;

import com.phillippitts.talkback.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool running the serial stage lanes of every live session.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.pipeline.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor shared by all session lanes.
     *
     * <p>Work queue: unbounded. Each session queues at most one drain task per stage lane, so
     * the queue is bounded by the number of live sessions. Lane drains must never run on the
     * submitting thread (the WebSocket ingest thread), so there is no caller-runs fallback; the
     * pool only rejects work once it is shutting down.
     *
     * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext (the {@code sessionId})
     * is copied onto the worker for the duration of the task.
     *
     * @return configured pipeline executor
     */
    @Bean(name = "pipelineExecutor")
    public Executor pipelineExecutor() {
        ThreadPoolProperties.PipelinePoolProperties props = threadPoolProperties.getPipeline();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        // with an unbounded queue the pool never grows past its core size
        executor.setMaxPoolSize(props.getCorePoolSize());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
