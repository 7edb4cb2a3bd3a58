package com.eyelevel.pdftoolkit.common.processexec;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command in its own process and reports how it ended.
 *
 * <p>Every external binary the engine uses (Ghostscript, LibreOffice) is launched through this
 * seam, so tests can substitute a fake runner and assert on the commands that were chosen.
 */
public interface CommandRunner {

    /**
     * Executes a command and waits for it to finish.
     *
     * @param command     The executable followed by its arguments. Never passed through a shell.
     * @param contextInfo A string for logging context (e.g., the request id).
     * @param timeout     The maximum time the process may run before it is killed.
     * @param processName A short name for log lines (e.g., "gs").
     * @return The exit code and a bounded capture of stdout and stderr.
     * @throws IOException if the executable cannot be started.
     * @throws InterruptedException if the waiting thread is interrupted.
     * @throws com.eyelevel.pdftoolkit.exception.ToolTimeoutException if the timeout elapses.
     */
    ProcessResult run(List<String> command, String contextInfo, Duration timeout, String processName)
    throws IOException, InterruptedException;

    /**
     * The result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 typically means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    record ProcessResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
