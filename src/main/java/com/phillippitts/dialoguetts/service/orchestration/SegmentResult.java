package com.phillippitts.dialoguetts.service.orchestration;

import java.util.Objects;

/**
 * Per-segment entry of the processing report.
 *
 * @param index      segment index
 * @param speaker    speaker label
 * @param status     terminal status
 * @param chunkCount number of synthesis chunks the segment was split into
 * @param elapsedMs  time from dispatch to completion; 0 if never dispatched
 * @param error      failure message, null on success
 */
public record SegmentResult(
        int index,
        String speaker,
        SegmentStatus status,
        int chunkCount,
        long elapsedMs,
        String error
) {

    public SegmentResult {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("status must be terminal, got: " + status);
        }
    }

    public boolean success() {
        return status == SegmentStatus.SUCCEEDED;
    }
}
