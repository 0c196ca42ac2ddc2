package com.phillippitts.dialoguetts.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external speech synthesis tool.
 * Binds to properties prefixed with "synthesis.engine".
 *
 * <p>Example application.properties:
 * <pre>
 * synthesis.engine.binary-path=paddlespeech
 * synthesis.engine.language=zh
 * synthesis.engine.timeout-seconds=90
 * synthesis.engine.max-stderr-bytes=65536
 * </pre>
 *
 * @param binaryPath     executable to run; a bare name is looked up on the PATH
 * @param language       language code passed as {@code --lang}
 * @param timeoutSeconds maximum time one synthesis call may run before the process is killed
 * @param maxStderrBytes cap on captured stderr kept for error messages
 */
@ConfigurationProperties(prefix = "synthesis.engine")
@Validated
public record SynthesisEngineProperties(
        @NotBlank(message = "Synthesis binary path must not be blank")
        String binaryPath,

        @NotBlank(message = "Language code must not be blank")
        String language,

        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {
    /**
     * Defaults for a PaddleSpeech install on the PATH.
     */
    public static SynthesisEngineProperties defaults() {
        return new SynthesisEngineProperties("paddlespeech", "zh", 90, 65536);
    }
}
