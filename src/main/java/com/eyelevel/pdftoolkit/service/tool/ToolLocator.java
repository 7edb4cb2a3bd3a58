package com.eyelevel.pdftoolkit.service.tool;

import com.eyelevel.pdftoolkit.common.processexec.CommandRunner;
import com.eyelevel.pdftoolkit.common.processexec.CommandRunner.ProcessResult;
import com.eyelevel.pdftoolkit.exception.ToolTimeoutException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds which of several candidate executable names is installed for a given tool.
 *
 * <p>Each tool is probed at most once per process lifetime; the outcome, found or not, is cached.
 * Concurrent callers asking for the same tool wait for the single probe in flight. An interrupted
 * probe caches nothing, so the next caller probes again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolLocator {

    private static final String PROBE_CONTEXT = "tool-probe";

    private final CommandRunner commandRunner;
    private final Map<String, Optional<String>> resolved = new ConcurrentHashMap<>();

    /**
     * Returns the first candidate that answers {@code <candidate> --version} with exit code 0.
     *
     * @param tool         Cache key and log name, e.g. "ghostscript".
     * @param candidates   Executable names to try, in order.
     * @param probeTimeout Timeout for each probe invocation.
     * @return The working executable name, or empty when none of the candidates is installed.
     * @throws ToolUnavailableException if the probing thread is interrupted.
     */
    public Optional<String> locate(String tool, List<String> candidates, Duration probeTimeout) {
        return resolved.computeIfAbsent(tool, key -> probe(key, candidates, probeTimeout));
    }

    /**
     * Forgets every cached probe result.
     */
    public void reset() {
        resolved.clear();
    }

    private Optional<String> probe(String tool, List<String> candidates, Duration probeTimeout) {
        for (String candidate : candidates) {
            try {
                ProcessResult result = commandRunner.run(List.of(candidate, "--version"), PROBE_CONTEXT, probeTimeout,
                                                         candidate);
                if (result.isSuccess()) {
                    log.info("Using '{}' for {} (version: {}).", candidate, tool, firstLine(result.stdout()));
                    return Optional.of(candidate);
                }
                log.debug("Candidate '{}' for {} exited with code {}.", candidate, tool, result.exitCode());
            } catch (IOException e) {
                log.debug("Candidate '{}' for {} is not installed: {}", candidate, tool, e.getMessage());
            } catch (ToolTimeoutException e) {
                log.warn("Probing '{}' for {} timed out.", candidate, tool);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while probing {}.", tool);
                throw new ToolUnavailableException("Interrupted while probing " + tool + ".", e);
            }
        }
        log.warn("{} not found. Tried: {}", tool, candidates);
        return Optional.empty();
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
