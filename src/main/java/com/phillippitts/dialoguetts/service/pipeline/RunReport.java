package com.phillippitts.dialoguetts.service.pipeline;

import com.phillippitts.dialoguetts.service.orchestration.SegmentResult;
import com.phillippitts.dialoguetts.service.orchestration.SynthesisOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * Processing statistics of one pipeline run.
 *
 * @param outcome         overall outcome
 * @param totalSegments   segments parsed from the script
 * @param succeeded       segments synthesized successfully
 * @param failed          segments that failed
 * @param timedOut        segments that timed out
 * @param totalChunks     synthesis chunks of the successful segments
 * @param characters      characters of text in the successful segments, in code points
 * @param outputFile      written artifact, null unless outcome is {@link Outcome#COMPLETED}
 * @param audioDurationMs duration of the written artifact
 * @param segments        per-segment results sorted by index
 */
public record RunReport(
        Outcome outcome,
        int totalSegments,
        int succeeded,
        long failed,
        long timedOut,
        int totalChunks,
        long characters,
        Path outputFile,
        long audioDurationMs,
        List<SegmentResult> segments
) {

    public enum Outcome {
        /** At least one segment synthesized and the output was written. */
        COMPLETED,
        /** The script contained no speaker-labeled text, or the document no text at all. */
        NO_SEGMENTS,
        /** Every segment failed or timed out; nothing was written. */
        ALL_FAILED
    }

    public RunReport {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    static RunReport noSegments() {
        return new RunReport(Outcome.NO_SEGMENTS, 0, 0, 0, 0, 0, 0, null, 0, List.of());
    }

    static RunReport of(SynthesisOutcome synthesis, int totalSegments, Path outputFile, long audioDurationMs) {
        Outcome outcome = synthesis.succeededCount() > 0 ? Outcome.COMPLETED : Outcome.ALL_FAILED;
        long characters = synthesis.succeeded().stream()
                .mapToLong(s -> s.text().codePointCount(0, s.text().length()))
                .sum();
        return new RunReport(outcome, totalSegments, synthesis.succeededCount(), synthesis.failedCount(),
                synthesis.timedOutCount(), synthesis.totalChunks(), characters, outputFile, audioDurationMs,
                synthesis.results());
    }

    public boolean isSuccess() {
        return outcome == Outcome.COMPLETED;
    }
}
