package com.phillippitts.dialoguetts.exception;

/**
 * Thrown when the character configuration is missing, malformed, or cannot provide a usable voice.
 * This is a fatal error that aborts the run.
 */
public class ConfigurationException extends DialogueTtsException {

    private final String source;

    public ConfigurationException(String message) {
        super(message);
        this.source = "unknown";
    }

    public ConfigurationException(String message, String source) {
        super(message + " (config: " + source + ")");
        this.source = source;
    }

    public ConfigurationException(String message, String source, Throwable cause) {
        super(message + " (config: " + source + ")", cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
