package com.phillippitts.dialoguetts.exception;

import java.nio.file.Path;

/**
 * Thrown when reading the script or configuration, or writing audio output, fails.
 * Fatal for the run.
 */
public class DialogueIoException extends DialogueTtsException {

    private final Path path;

    public DialogueIoException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
