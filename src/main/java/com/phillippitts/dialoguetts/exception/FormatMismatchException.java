package com.phillippitts.dialoguetts.exception;

import com.phillippitts.dialoguetts.domain.PcmFormat;

/**
 * Thrown when audio fragments with different PCM formats are combined.
 * Raw concatenation of mixed formats is unsafe, so assembly stops without producing output.
 */
public class FormatMismatchException extends DialogueTtsException {

    private final PcmFormat expected;
    private final PcmFormat actual;

    public FormatMismatchException(int segmentIndex, PcmFormat expected, PcmFormat actual) {
        super("Audio format mismatch at segment " + segmentIndex + ": expected " + expected
                + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public PcmFormat getExpected() {
        return expected;
    }

    public PcmFormat getActual() {
        return actual;
    }
}
