package com.phillippitts.dialoguetts.service.synthesis.process;

import com.phillippitts.dialoguetts.domain.AudioFragment;
import com.phillippitts.dialoguetts.service.audio.WavWriter;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Shared test doubles for synthesis process tests.
 * Fake Process implementations for hermetic testing without a real PaddleSpeech install.
 */
final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Test process behavior.
     *
     * @param stdout            stdout content to return
     * @param stderr            stderr content to return
     * @param exitCode          process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior ok() {
            return new ProcessBehavior("", "", 0, 0);
        }

        static ProcessBehavior exit(int code, String stderr) {
            return new ProcessBehavior("", stderr, code, 0);
        }

        static ProcessBehavior hang() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /**
     * Records every command and starts a {@link TestProcess}. Optionally plays the part of the
     * synthesis tool by writing a WAV to the path following {@code --output}.
     */
    static final class ScriptedProcessFactory implements ProcessFactory {
        private final ProcessBehavior behavior;
        private final AudioFragment output;
        private final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());
        private volatile IOException startFailure;
        private volatile TestProcess lastProcess;

        /**
         * @param behavior process behavior
         * @param output   audio written to the {@code --output} path, or null to write nothing
         */
        ScriptedProcessFactory(ProcessBehavior behavior, AudioFragment output) {
            this.behavior = behavior;
            this.output = output;
        }

        ScriptedProcessFactory failingToStart(IOException e) {
            this.startFailure = e;
            return this;
        }

        @Override
        public Process start(List<String> command, Path workingDir) throws IOException {
            commands.add(List.copyOf(command));
            if (startFailure != null) {
                throw startFailure;
            }
            if (output != null) {
                int i = command.indexOf("--output");
                WavWriter.write(output, Path.of(command.get(i + 1)));
            }
            lastProcess = new TestProcess(behavior);
            return lastProcess;
        }

        List<List<String>> commands() {
            synchronized (commands) {
                return List.copyOf(commands);
            }
        }

        TestProcess lastProcess() {
            return lastProcess;
        }
    }

    /**
     * Minimal fake Process with scripted stdout/stderr, exit code and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            if (finishAfterMillis == 0) {
                this.alive = false;
            }
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis >= 0 && finishAfterMillis <= ms) {
                Thread.sleep(finishAfterMillis);
                this.alive = false;
                return true;
            }
            Thread.sleep(ms);
            return false;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
