package com.phillippitts.dialoguetts.exception;

/**
 * Thrown when WAV bytes cannot be decoded: not RIFF/WAVE, missing chunks, truncated data or a
 * non-PCM encoding.
 */
public class InvalidAudioException extends DialogueTtsException {

    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
