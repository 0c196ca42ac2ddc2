package com.phillippitts.dialoguetts.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing SynthesisException with rich contextual information.
 *
 * <p>Gives the process adapter and the orchestrator one consistent format for failure
 * messages, so every failure in the processing report names the segment, speaker and cause.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw SynthesisExceptionBuilder.create("Synthesis failed")
 *         .speaker("Naomi")
 *         .build();
 *
 * // External process failure
 * throw SynthesisExceptionBuilder.create("Process failed")
 *         .speaker("Naomi")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("segment", 3)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String speaker;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    /**
     * Sets the speaker label the failing work belonged to.
     *
     * @param speaker raw speaker label from the script
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder speaker(String speaker) {
        this.speaker = speaker;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the process exit code (for external process failures).
     *
     * @param exitCode process exit code
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * <p>Common metadata keys: segment, chunk, binaryPath, spkId, stderr.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the SynthesisException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (speaker: {speaker})
     * </pre>
     *
     * @return constructed SynthesisException
     */
    public SynthesisException build() {
        String detailedMessage = buildDetailedMessage();
        String who = speaker != null ? speaker : "unknown";

        if (cause != null) {
            return new SynthesisException(detailedMessage, who, cause);
        }
        return new SynthesisException(detailedMessage, who);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
