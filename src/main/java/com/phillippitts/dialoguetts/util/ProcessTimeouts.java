package com.phillippitts.dialoguetts.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and stream-reader thread management.
 *
 * <p><b>Usage:</b> Used by
 * {@link com.phillippitts.dialoguetts.service.synthesis.process.SynthesisProcessRunner}
 * when running the external synthesis tool.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort).
     * Gobblers are daemon threads and die with the JVM if they do not terminate.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
