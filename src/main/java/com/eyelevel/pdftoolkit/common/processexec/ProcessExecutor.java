package com.eyelevel.pdftoolkit.common.processexec;

import com.eyelevel.pdftoolkit.exception.ToolTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor implements CommandRunner {

    /**
     * A safe limit for the amount of stdout/stderr to capture in memory.
     * 16 KB is enough to capture most error messages without risking OutOfMemoryError.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;
    private static final long STREAM_DRAIN_SECONDS = 5;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     * The process is started directly, without a shell, so arguments are never re-interpreted.
     */
    @Override
    public ProcessResult run(List<String> command, String contextInfo, Duration timeout, String processName)
    throws IOException, InterruptedException {
        log.debug("[{}] Executing {}: {}", contextInfo, processName, String.join(" ", command));

        Process process = new ProcessBuilder(command).start();
        StringBuffer stdoutCapture = new StringBuffer();
        StringBuffer stderrCapture = new StringBuffer();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            StreamConsumer stdoutConsumer = new StreamConsumer(process.getInputStream(), stdoutCapture::append, null);
            StreamConsumer stderrConsumer = new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                                                               line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)
            );

            Future<?> stdoutFuture = executor.submit(stdoutConsumer);
            Future<?> stderrFuture = executor.submit(stderrConsumer);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolTimeoutException(processName + " process timed out after " + timeout.toSeconds() + " seconds.");
            }

            awaitDrain(stdoutFuture, contextInfo, processName);
            awaitDrain(stderrFuture, contextInfo, processName);
        } finally {
            executor.shutdownNow();
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    private void awaitDrain(Future<?> future, String contextInfo, String processName) throws InterruptedException {
        try {
            future.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[{}] Output of {} was not fully drained: {}", contextInfo, processName, e.getMessage());
        }
    }

    /**
     * A Runnable that consumes an InputStream, captures its content up to a limit,
     * and optionally logs each line. This prevents both deadlocks and OutOfMemoryErrors.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }
}
