package com.phillippitts.dialoguetts.exception;

/**
 * Thrown when synthesizing a chunk or segment fails.
 * Failures are isolated to the segment that produced them and never abort the batch.
 */
public class SynthesisException extends DialogueTtsException {

    private final String speaker;

    public SynthesisException(String message) {
        super(message);
        this.speaker = "unknown";
    }

    public SynthesisException(String message, String speaker) {
        super(message + " (speaker: " + speaker + ")");
        this.speaker = speaker;
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
        this.speaker = "unknown";
    }

    public SynthesisException(String message, String speaker, Throwable cause) {
        super(message + " (speaker: " + speaker + ")", cause);
        this.speaker = speaker;
    }

    public String getSpeaker() {
        return speaker;
    }
}
