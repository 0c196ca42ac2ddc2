package com.phillippitts.dialoguetts.exception;

/**
 * Base exception for all dialogue-tts application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DialogueTtsException extends RuntimeException {

    public DialogueTtsException(String message) {
        super(message);
    }

    public DialogueTtsException(String message, Throwable cause) {
        super(message, cause);
    }

    public DialogueTtsException(Throwable cause) {
        super(cause);
    }
}
