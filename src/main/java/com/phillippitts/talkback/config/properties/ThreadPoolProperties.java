package com.phillippitts.talkback.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The pipeline pool runs the serial lanes of every live session. One session keeps at most
 * one thread per stage busy, so the pool size bounds how many sessions can stream concurrently
 * without queueing. Work beyond that waits in an unbounded queue.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PipelinePoolProperties pipeline = new PipelinePoolProperties();

    public PipelinePoolProperties getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelinePoolProperties pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Pipeline executor pool configuration.
     */
    public static class PipelinePoolProperties {
        private int corePoolSize = 8;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "pipeline-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
