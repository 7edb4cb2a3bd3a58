package com.eyelevel.pdftoolkit.service.tool;

import com.eyelevel.pdftoolkit.common.processexec.CommandRunner;
import com.eyelevel.pdftoolkit.common.processexec.CommandRunner.ProcessResult;
import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.DocumentProcessingException;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LibreOfficeConversionService {

    private final ToolkitProcessingConfig config;
    private final CommandRunner commandRunner;

    /**
     * Runs one {@code soffice --convert-to docx} invocation. Failed runs are retried; timeouts are not.
     */
    @Retryable(retryFor = {ToolExecutionException.class},
               maxAttemptsExpression = "#{${app.processing.libreoffice.retry.attempts:1} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.processing.libreoffice.retry.delay-ms:1000}}"),
               listeners = {"libreOfficeRetryListener"})
    public Path convert(String soffice, Path input, Path outputDir, Path profileDir, String contextInfo) {
        List<String> command = List.of(soffice,
                                       "-env:UserInstallation=" + PathSanitizer.asFileUrl(profileDir),
                                       "--headless",
                                       "--infilter=writer_pdf_import",
                                       "--convert-to", "docx",
                                       "--outdir", PathSanitizer.forCommandLine(outputDir),
                                       PathSanitizer.forCommandLine(input));

        log.info("[{}] Attempting LibreOffice conversion for '{}'.", contextInfo, input.getFileName());
        ProcessResult result;
        try {
            result = commandRunner.run(command, contextInfo, config.getLibreoffice().getTimeout(), "soffice");
        } catch (IOException e) {
            throw new ToolExecutionException("LibreOffice could not be started.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for LibreOffice.", e);
        }

        if (!result.isSuccess()) {
            log.error("[{}] LibreOffice conversion failed with exit code {}.", contextInfo, result.exitCode());
            throw new ToolExecutionException("LibreOffice conversion failed with exit code " + result.exitCode() + ".");
        }

        Path docx = outputDir.resolve(FilenameUtils.getBaseName(input.getFileName().toString()) + ".docx");
        try {
            if (!Files.exists(docx) || Files.size(docx) == 0) {
                log.error("[{}] LibreOffice completed, but '{}' was not found or is empty.", contextInfo,
                          docx.getFileName());
                throw new ToolExecutionException("Conversion resulted in an empty or missing file.");
            }
        } catch (IOException e) {
            throw new ToolExecutionException("Could not inspect LibreOffice output.", e);
        }

        log.info("[{}] Successfully converted '{}' to Word.", contextInfo, input.getFileName());
        return docx;
    }

    @Recover
    public Path recover(DocumentProcessingException e, String soffice, Path input, Path outputDir, Path profileDir,
                        String contextInfo) {
        log.error("[{}] LibreOffice conversion failed for '{}' after all retry attempts.", contextInfo,
                  input.getFileName());
        throw e;
    }
}
