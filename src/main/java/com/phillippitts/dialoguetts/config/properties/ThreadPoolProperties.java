package com.phillippitts.dialoguetts.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the synthesis worker pool.
 *
 * <p>Pool size is not configured here: every run sizes its pool from the run configuration's
 * {@code max_workers}. These properties cover naming, queueing and shutdown only.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SynthesisPoolProperties synthesis = new SynthesisPoolProperties();

    public SynthesisPoolProperties getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(SynthesisPoolProperties synthesis) {
        this.synthesis = synthesis;
    }

    /**
     * Synthesis executor pool configuration.
     */
    public static class SynthesisPoolProperties {
        private int queueCapacity = 16;
        private int keepAliveSeconds = 60;
        private int awaitTerminationSeconds = 30;
        private String threadNamePrefix = "synthesis-pool-";

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
