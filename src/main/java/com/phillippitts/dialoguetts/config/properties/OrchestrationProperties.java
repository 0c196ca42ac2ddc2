package com.phillippitts.dialoguetts.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for synthesis orchestration defaults.
 */
@Validated
@ConfigurationProperties(prefix = "synthesis.orchestration")
public class OrchestrationProperties {

    public static final int DEFAULT_TASK_TIMEOUT_SECONDS = 120;
    public static final String DEFAULT_TEST_VOICE_TEMPLATE = "你好，我是{name}，这是我的声音。";

    /**
     * Per-segment timeout used when a run configuration does not set
     * {@code processing.task_timeout_seconds}.
     */
    @Positive
    private final int defaultTaskTimeoutSeconds;

    /**
     * Sentence spoken by the test-voice operation; {@code {name}} is replaced with the
     * character's name.
     */
    @NotBlank
    private final String testVoiceTemplate;

    @ConstructorBinding
    public OrchestrationProperties(Integer defaultTaskTimeoutSeconds, String testVoiceTemplate) {
        this.defaultTaskTimeoutSeconds = defaultTaskTimeoutSeconds == null
                ? DEFAULT_TASK_TIMEOUT_SECONDS : defaultTaskTimeoutSeconds;
        this.testVoiceTemplate = testVoiceTemplate == null ? DEFAULT_TEST_VOICE_TEMPLATE : testVoiceTemplate;
    }

    public int getDefaultTaskTimeoutSeconds() {
        return defaultTaskTimeoutSeconds;
    }

    public String getTestVoiceTemplate() {
        return testVoiceTemplate;
    }

    public String testVoiceText(String characterName) {
        return testVoiceTemplate.replace("{name}", characterName);
    }
}
