package com.eyelevel.pdftoolkit.service.tool;

import com.eyelevel.pdftoolkit.common.processexec.CommandRunner;
import com.eyelevel.pdftoolkit.common.processexec.CommandRunner.ProcessResult;
import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.FileProtectedException;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import com.eyelevel.pdftoolkit.model.GhostscriptPreset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rewrites a PDF through Ghostscript's {@code pdfwrite} device with a given quality preset.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GhostscriptReducer {

    static final String TOOL_NAME = "ghostscript";

    private static final Pattern PASSWORD_ERROR_PATTERN = Pattern.compile("This file requires a password for access",
                                                                          Pattern.CASE_INSENSITIVE);

    private final ToolkitProcessingConfig config;
    private final CommandRunner commandRunner;
    private final ToolLocator toolLocator;

    public boolean isAvailable() {
        return executable().isPresent();
    }

    /**
     * Runs one Ghostscript pass.
     *
     * @param input       The PDF to reduce.
     * @param output      Where the candidate is written. Must not exist yet.
     * @param preset      The {@code -dPDFSETTINGS} preset.
     * @param contextInfo A string for logging context.
     * @return Size in bytes of the produced candidate.
     * @throws ToolUnavailableException if no Ghostscript executable is installed.
     * @throws FileProtectedException   if the input requires a password.
     * @throws ToolExecutionException   if Ghostscript fails or produces no output.
     */
    public long reduce(Path input, Path output, GhostscriptPreset preset, String contextInfo) {
        String gs = executable().orElseThrow(() -> new ToolUnavailableException("Ghostscript is not installed."));
        List<String> command = List.of(gs, "-sDEVICE=pdfwrite", "-dCompatibilityLevel=1.4", preset.toSwitch(),
                                       "-dNOPAUSE", "-dQUIET", "-dBATCH",
                                       "-sOutputFile=" + PathSanitizer.forCommandLine(output),
                                       PathSanitizer.forCommandLine(input));

        log.info("[{}] Running Ghostscript with preset {}.", contextInfo, preset.getPdfSettings());
        ProcessResult result;
        try {
            result = commandRunner.run(command, contextInfo, config.getGhostscript().getTimeout(), "gs");
        } catch (IOException e) {
            throw new ToolExecutionException("Ghostscript could not be started.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for Ghostscript.", e);
        }

        if (PASSWORD_ERROR_PATTERN.matcher(result.stderr()).find()
                || PASSWORD_ERROR_PATTERN.matcher(result.stdout()).find()) {
            throw new FileProtectedException("PDF is password protected");
        }
        if (!result.isSuccess()) {
            throw new ToolExecutionException(
                    String.format("Ghostscript preset %s failed with exit code %d.", preset.getPdfSettings(),
                                  result.exitCode()));
        }

        try {
            long size = Files.exists(output) ? Files.size(output) : 0;
            if (size == 0) {
                throw new ToolExecutionException(
                        "Ghostscript preset " + preset.getPdfSettings() + " produced no output.");
            }
            log.debug("[{}] Preset {} produced {} bytes.", contextInfo, preset.getPdfSettings(), size);
            return size;
        } catch (IOException e) {
            throw new ToolExecutionException("Could not inspect Ghostscript output.", e);
        }
    }

    private Optional<String> executable() {
        ToolkitProcessingConfig.Ghostscript gs = config.getGhostscript();
        return toolLocator.locate(TOOL_NAME, gs.getCandidates(), gs.getProbeTimeout());
    }
}
