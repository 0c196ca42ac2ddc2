package com.phillippitts.dialoguetts.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SynthesisPropertiesValidationTest {

    private Validator validator;

    @BeforeEach
    void setup() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaultsShouldBeValid() {
        SynthesisEngineProperties defaults = SynthesisEngineProperties.defaults();

        assertThat(validator.validate(defaults)).isEmpty();
        assertThat(defaults.binaryPath()).isEqualTo("paddlespeech");
        assertThat(defaults.timeoutSeconds()).isEqualTo(90);
    }

    @Test
    void shouldRejectBlankBinaryPath() {
        Set<ConstraintViolation<SynthesisEngineProperties>> violations =
                validator.validate(new SynthesisEngineProperties(" ", "zh", 90, 1024));

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("binary path must not be blank");
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        Set<ConstraintViolation<SynthesisEngineProperties>> violations =
                validator.validate(new SynthesisEngineProperties("paddlespeech", "zh", 0, -1));

        assertThat(violations).hasSize(2);
    }

    @Test
    void orchestrationPropertiesShouldFallBackToDefaults() {
        OrchestrationProperties props = new OrchestrationProperties(null, null);

        assertThat(props.getDefaultTaskTimeoutSeconds()).isEqualTo(OrchestrationProperties.DEFAULT_TASK_TIMEOUT_SECONDS);
        assertThat(props.testVoiceText("基翁")).isEqualTo("你好，我是基翁，这是我的声音。");
        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    void orchestrationPropertiesShouldRejectNonPositiveTimeout() {
        assertThat(validator.validate(new OrchestrationProperties(0, "{name}"))).hasSize(1);
    }
}
