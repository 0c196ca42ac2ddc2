package com.phillippitts.dialoguetts.exception;

/**
 * Thrown when a segment's synthesis work does not complete within the per-task timeout.
 * Reported separately from {@link SynthesisException} so timeouts can be told apart from engine errors.
 */
public class SynthesisTimeoutException extends DialogueTtsException {

    private final int segmentIndex;
    private final long timeoutMs;

    public SynthesisTimeoutException(int segmentIndex, long timeoutMs) {
        super("Segment " + segmentIndex + " timed out after " + timeoutMs + " ms");
        this.segmentIndex = segmentIndex;
        this.timeoutMs = timeoutMs;
    }

    public int getSegmentIndex() {
        return segmentIndex;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
