package com.eyelevel.pdftoolkit.service.tool;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import com.eyelevel.pdftoolkit.exception.ToolUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Converts PDF documents to Word using a headless LibreOffice process.
 *
 * <p>Each call runs with its own throw-away user profile so that concurrent conversions never share
 * LibreOffice's profile lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LibreOfficeConverter {

    static final String TOOL_NAME = "libreoffice";

    private final ToolkitProcessingConfig config;
    private final ToolLocator toolLocator;
    private final LibreOfficeConversionService conversionService;

    public boolean isAvailable() {
        return executable().isPresent();
    }

    /**
     * Converts a PDF into a {@code .docx} file.
     *
     * @param input       The PDF to convert.
     * @param outputDir   Directory that receives the converted document.
     * @param contextInfo A string for logging context.
     * @return Path of the produced {@code .docx} file.
     * @throws ToolUnavailableException if LibreOffice is not installed.
     */
    public Path convertToWord(Path input, Path outputDir, String contextInfo) {
        String soffice = executable().orElseThrow(
                () -> new ToolUnavailableException("PDF to Word conversion requires LibreOffice, which is not installed."));

        Path profileDir = null;
        try {
            profileDir = Files.createTempDirectory("lo-profile-");
            log.debug("[{}] Created LibreOffice profile directory: {}", contextInfo, profileDir);
            return conversionService.convert(soffice, input, outputDir, profileDir, contextInfo);
        } catch (IOException e) {
            throw new ToolExecutionException("Could not prepare the LibreOffice profile directory.", e);
        } finally {
            if (profileDir != null) {
                try {
                    FileUtils.deleteDirectory(profileDir.toFile());
                } catch (IOException e) {
                    log.warn("[{}] Failed to delete LibreOffice profile directory {}: {}", contextInfo, profileDir,
                             e.getMessage());
                }
            }
        }
    }

    private Optional<String> executable() {
        ToolkitProcessingConfig.LibreOffice lo = config.getLibreoffice();
        return toolLocator.locate(TOOL_NAME, lo.getCandidates(), lo.getProbeTimeout());
    }
}
