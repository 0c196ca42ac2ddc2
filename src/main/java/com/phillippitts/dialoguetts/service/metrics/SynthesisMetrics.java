package com.phillippitts.dialoguetts.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for speech synthesis.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Latency of each synthesis call (one per chunk)</li>
 *   <li>Segment success count</li>
 *   <li>Segment failure count, tagged by reason ({@value #REASON_ERROR} or
 *       {@value #REASON_TIMEOUT})</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SynthesisMetrics {

    private static final String METRIC_PREFIX = "dialoguetts.synthesis";

    public static final String REASON_ERROR = "error";
    public static final String REASON_TIMEOUT = "timeout";

    private final MeterRegistry registry;

    public SynthesisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of one synthesis call.
     *
     * @param durationNanos duration in nanoseconds
     * @param success       whether the call produced audio
     */
    public void recordChunkLatency(long durationNanos, boolean success) {
        Timer.builder(METRIC_PREFIX + ".chunk.latency")
                .description("Time taken to synthesize one text chunk")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSegmentSuccess() {
        Counter.builder(METRIC_PREFIX + ".segment.success")
                .description("Number of segments synthesized successfully")
                .register(registry)
                .increment();
    }

    /**
     * Increments the segment failure counter.
     *
     * @param reason {@value #REASON_ERROR} or {@value #REASON_TIMEOUT}
     */
    public void incrementSegmentFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".segment.failure")
                .description("Number of segments that failed or timed out")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
