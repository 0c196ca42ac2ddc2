package com.phillippitts.dialoguetts.service.synthesis.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam over {@link ProcessBuilder} so the synthesis adapter can be tested without a real binary.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub returning a fake
 * {@link Process} with scripted output, exit code and side effects.
 */
interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command    full command line, executable first
     * @param workingDir working directory for the process (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
