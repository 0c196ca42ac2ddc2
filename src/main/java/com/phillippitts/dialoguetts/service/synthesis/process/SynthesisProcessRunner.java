package com.phillippitts.dialoguetts.service.synthesis.process;

import com.phillippitts.dialoguetts.config.properties.SynthesisEngineProperties;
import com.phillippitts.dialoguetts.exception.SynthesisException;
import com.phillippitts.dialoguetts.exception.SynthesisExceptionBuilder;
import com.phillippitts.dialoguetts.util.LogSanitizer;
import com.phillippitts.dialoguetts.util.ProcessTimeouts;
import com.phillippitts.dialoguetts.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one invocation of the external synthesis tool to completion.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Drain stdout and stderr concurrently so a chatty tool never blocks on a full pipe
 * - Enforce {@code synthesis.engine.timeout-seconds} and terminate runaway processes
 * - Turn timeouts, non-zero exits and I/O failures into a {@link SynthesisException} carrying
 *   exit code, duration and a stderr snippet
 * - Idempotent {@link #close()} for cleanup
 *
 * <p>One runner belongs to one synthesizer handle and runs one process at a time.
 */
final class SynthesisProcessRunner implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(SynthesisProcessRunner.class);

    static final int ERROR_SNIPPET_MAX_CHARS = 800;

    private final ProcessFactory processFactory;
    private final SynthesisEngineProperties properties;

    private volatile Process current;
    private volatile Thread outGobbler;
    private volatile Thread errGobbler;

    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stderr
    ) {}

    SynthesisProcessRunner(ProcessFactory processFactory, SynthesisEngineProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Runs the command and waits for it to exit successfully.
     *
     * @param command    full command line, executable first
     * @param workingDir working directory
     * @param context    short description of the work for error messages (e.g. "spk_id=5")
     * @throws SynthesisException on timeout, non-zero exit, I/O failure or interruption
     */
    void run(List<String> command, Path workingDir, String context) {
        Objects.requireNonNull(command, "command");
        long startTime = System.nanoTime();
        StringBuilder stderr = null;
        try {
            ProcessExecution exec = start(command, workingDir);
            stderr = exec.stderr();

            boolean finished = exec.process().waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                destroyProcess(exec.process());
                throw processError("Timeout after " + properties.timeoutSeconds() + "s",
                        -1, stderr, startTime, context, null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw processError("Non-zero exit: " + exitCode, exitCode, stderr, startTime, context, null);
            }
            LOG.debug("Synthesis process finished in {} ms ({})", TimeUtils.elapsedMillis(startTime), context);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw processError("I/O failure: " + e.getMessage(), -1, stderr, startTime, context, e);
        } finally {
            close();
        }
    }

    private ProcessExecution start(List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);
        this.current = process;

        // Start gobblers before waiting to avoid deadlock
        Thread out = startGobbler(process.getInputStream(), stdout, "synthesis-out", properties.maxStderrBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "synthesis-err", properties.maxStderrBytes());
        this.outGobbler = out;
        this.errGobbler = err;
        return new ProcessExecution(process, out, err, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a bounded buffer. Past the cap it keeps draining without storing, so
     * the child process never stalls on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.debug("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private SynthesisException processError(String msg, int exitCode, StringBuilder stderr, long startNano,
                                            String context, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = tail(stderr, ERROR_SNIPPET_MAX_CHARS);
            }
        }

        SynthesisExceptionBuilder builder = SynthesisExceptionBuilder.create(msg)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", properties.binaryPath())
                .metadata("context", context)
                .metadata("stderr", LogSanitizer.preview(stderrSnippet, ERROR_SNIPPET_MAX_CHARS));
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    // Python tools print the actual error last, after the traceback
    private static String tail(StringBuilder sb, int maxChars) {
        int start = Math.max(0, sb.length() - maxChars);
        return sb.substring(start);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Synthesis process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying synthesis process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying synthesis process: {}", e.toString());
        }
    }

    /**
     * Idempotent cleanup of any running process and gobbler threads.
     */
    @Override
    public void close() {
        Process process = this.current;
        this.current = null;
        if (process != null && process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        outGobbler = null;
        errGobbler = null;
    }
}
