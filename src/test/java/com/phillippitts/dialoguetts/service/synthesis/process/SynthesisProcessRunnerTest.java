package com.phillippitts.dialoguetts.service.synthesis.process;

import com.phillippitts.dialoguetts.config.properties.SynthesisEngineProperties;
import com.phillippitts.dialoguetts.exception.SynthesisException;
import com.phillippitts.dialoguetts.service.synthesis.process.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.dialoguetts.service.synthesis.process.ProcessTestDoubles.ScriptedProcessFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Hermetic tests for running the synthesis tool: no real binary is started.
 */
class SynthesisProcessRunnerTest {

    private static final List<String> COMMAND = List.of("paddlespeech", "tts", "--input", "你好");

    @TempDir
    Path tempDir;

    private final SynthesisEngineProperties props = new SynthesisEngineProperties("paddlespeech", "zh", 1, 65_536);

    @Test
    void shouldCompleteOnZeroExit() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ProcessBehavior.ok(), null);
        SynthesisProcessRunner runner = new SynthesisProcessRunner(factory, props);

        assertThatCode(() -> runner.run(COMMAND, tempDir, "spk_id=1")).doesNotThrowAnyException();
        assertThat(factory.commands()).containsExactly(COMMAND);
    }

    @Test
    void shouldReportNonZeroExitWithStderr() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(
                ProcessBehavior.exit(2, "Traceback (most recent call last):\nValueError: bad spk_id"), null);
        SynthesisProcessRunner runner = new SynthesisProcessRunner(factory, props);

        assertThatThrownBy(() -> runner.run(COMMAND, tempDir, "spk_id=999"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Non-zero exit: 2")
                .hasMessageContaining("exitCode=2")
                .hasMessageContaining("binaryPath=paddlespeech")
                .hasMessageContaining("context=spk_id=999")
                .hasMessageContaining("ValueError: bad spk_id");
    }

    @Test
    void shouldKeepTailOfLongStderr() {
        String stderr = "x".repeat(5_000) + "\nRuntimeError: model not found";
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ProcessBehavior.exit(1, stderr), null);
        SynthesisProcessRunner runner = new SynthesisProcessRunner(factory, props);

        assertThatThrownBy(() -> runner.run(COMMAND, tempDir, "ctx"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("RuntimeError: model not found")
                .satisfies(e -> assertThat(e.getMessage().length())
                        .isLessThan(SynthesisProcessRunner.ERROR_SNIPPET_MAX_CHARS + 300));
    }

    @Test
    void shouldKillProcessOnTimeout() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ProcessBehavior.hang(), null);
        SynthesisProcessRunner runner = new SynthesisProcessRunner(factory, props);

        assertThatThrownBy(() -> runner.run(COMMAND, tempDir, "ctx"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Timeout after 1s")
                .hasMessageContaining("exitCode=-1");
        assertThat(factory.lastProcess().wasDestroyCalled()).isTrue();
        assertThat(factory.lastProcess().isAlive()).isFalse();
    }

    @Test
    void shouldWrapStartFailure() {
        IOException cause = new IOException("Cannot run program \"paddlespeech\"");
        ScriptedProcessFactory factory = new ScriptedProcessFactory(ProcessBehavior.ok(), null).failingToStart(cause);
        SynthesisProcessRunner runner = new SynthesisProcessRunner(factory, props);

        assertThatThrownBy(() -> runner.run(COMMAND, tempDir, "ctx"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("I/O failure")
                .hasCause(cause);
    }

    @Test
    void closeShouldBeIdempotent() {
        SynthesisProcessRunner runner = new SynthesisProcessRunner(
                new ScriptedProcessFactory(ProcessBehavior.ok(), null), props);

        assertThatCode(() -> {
            runner.close();
            runner.close();
        }).doesNotThrowAnyException();
    }
}
