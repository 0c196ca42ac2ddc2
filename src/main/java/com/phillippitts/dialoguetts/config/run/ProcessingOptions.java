package com.phillippitts.dialoguetts.config.run;

import com.phillippitts.dialoguetts.exception.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs from the {@code processing} block of a run configuration.
 *
 * @param maxWorkers       number of concurrent synthesis workers
 * @param chunkSize        maximum characters per synthesis call
 * @param pauseMs          silence inserted between different speakers
 * @param cleanupTempFiles whether per-segment WAV files are removed after assembly
 * @param taskTimeout      per-segment timeout measured from dispatch
 */
public record ProcessingOptions(
        int maxWorkers,
        int chunkSize,
        long pauseMs,
        boolean cleanupTempFiles,
        Duration taskTimeout
) {

    public static final int DEFAULT_CHUNK_SIZE = 200;
    public static final long DEFAULT_PAUSE_MS = 300;

    public ProcessingOptions {
        if (maxWorkers < 1) {
            throw new ConfigurationException("processing.max_workers must be at least 1, got: " + maxWorkers);
        }
        if (chunkSize < 1) {
            throw new ConfigurationException("processing.chunk_size must be at least 1, got: " + chunkSize);
        }
        if (pauseMs < 0) {
            throw new ConfigurationException("processing.pause_between_speakers_ms must not be negative, got: "
                    + pauseMs);
        }
        Objects.requireNonNull(taskTimeout, "taskTimeout must not be null");
        if (taskTimeout.isNegative() || taskTimeout.isZero()) {
            throw new ConfigurationException("processing.task_timeout_seconds must be positive, got: "
                    + taskTimeout.toSeconds());
        }
    }

    /**
     * Available processors minus one, at least 1.
     */
    public static int defaultMaxWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    }

    public static ProcessingOptions defaults(Duration taskTimeout) {
        return new ProcessingOptions(defaultMaxWorkers(), DEFAULT_CHUNK_SIZE, DEFAULT_PAUSE_MS, true, taskTimeout);
    }
}
