package com.phillippitts.dialoguetts.service.orchestration;

/**
 * Lifecycle of one segment inside a synthesis batch.
 *
 * <pre>
 * PENDING -> CHUNKING -> DISPATCHED -> SUCCEEDED | FAILED | TIMED_OUT
 * </pre>
 * A segment that cannot be chunked (no voice, no text) goes straight from CHUNKING to FAILED.
 * Terminal states are final; there is no retry.
 */
public enum SegmentStatus {
    PENDING,
    CHUNKING,
    DISPATCHED,
    SUCCEEDED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }
}
