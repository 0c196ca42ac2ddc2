package com.phillippitts.dialoguetts.service.orchestration;

import com.phillippitts.dialoguetts.domain.DialogueSegment;

import java.util.List;

/**
 * Result of a synthesis batch.
 *
 * @param succeeded segments that carry audio, sorted by index
 * @param results   one entry per input segment, sorted by index
 */
public record SynthesisOutcome(List<DialogueSegment> succeeded, List<SegmentResult> results) {

    public SynthesisOutcome {
        succeeded = List.copyOf(succeeded);
        results = List.copyOf(results);
    }

    public static SynthesisOutcome empty() {
        return new SynthesisOutcome(List.of(), List.of());
    }

    public int succeededCount() {
        return succeeded.size();
    }

    public long failedCount() {
        return count(SegmentStatus.FAILED);
    }

    public long timedOutCount() {
        return count(SegmentStatus.TIMED_OUT);
    }

    /** Chunks synthesized for successful segments. */
    public int totalChunks() {
        return results.stream().filter(SegmentResult::success).mapToInt(SegmentResult::chunkCount).sum();
    }

    private long count(SegmentStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }
}
