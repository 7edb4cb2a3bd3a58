package com.eyelevel.pdftoolkit.service.compression;

import com.eyelevel.pdftoolkit.config.ToolkitProcessingConfig;
import com.eyelevel.pdftoolkit.exception.CompressionFailedException;
import com.eyelevel.pdftoolkit.exception.OperationException;
import com.eyelevel.pdftoolkit.exception.ToolExecutionException;
import com.eyelevel.pdftoolkit.model.Artifact;
import com.eyelevel.pdftoolkit.model.CompressionAttempt;
import com.eyelevel.pdftoolkit.model.CompressionResult;
import com.eyelevel.pdftoolkit.model.GhostscriptPreset;
import com.eyelevel.pdftoolkit.model.InputDocument;
import com.eyelevel.pdftoolkit.service.document.PdfDocumentAdapter;
import com.eyelevel.pdftoolkit.service.storage.ArtifactStore;
import com.eyelevel.pdftoolkit.service.tool.GhostscriptReducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Reduces PDF size, aiming for a target size when one is given.
 *
 * <p>With Ghostscript installed, presets are tried from highest to lowest quality and the first
 * candidate that fits the target wins; otherwise the smallest candidate is returned. Without
 * Ghostscript the document is only rewritten by PDFBox and the result carries a warning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PdfCompressionService {

    static final String ALREADY_SMALL_MESSAGE = "File was already under target size (original quality preserved)";
    static final String FALLBACK_WARNING = "Basic optimization only. Install Ghostscript for maximum compression.";

    private final ToolkitProcessingConfig config;
    private final GhostscriptReducer ghostscriptReducer;
    private final PdfDocumentAdapter documentAdapter;
    private final ArtifactStore artifactStore;

    /**
     * Compresses a document and stores the result as an artifact.
     *
     * @param document    The uploaded PDF.
     * @param targetSize  Desired maximum size in bytes, or null to run only the default preset.
     *                    A non-positive target never counts as met, so every preset is tried.
     * @param contextInfo A string for logging context.
     * @return The stored result together with the preset that produced it.
     * @throws CompressionFailedException if no preset produced a usable candidate.
     */
    public CompressionResult compress(InputDocument document, Long targetSize, String contextInfo) {
        long originalSize = document.size();
        String artifactName = "compressed_" + document.getOriginalName();

        if (targetSize != null && originalSize <= targetSize) {
            log.info("[{}] Skipping compression: {} bytes is already within the target of {} bytes.", contextInfo,
                     originalSize, targetSize);
            Artifact artifact = artifactStore.put(document.getContent(), artifactName);
            return new CompressionResult(artifact, originalSize, null, null, ALREADY_SMALL_MESSAGE);
        }

        if (!ghostscriptReducer.isAvailable()) {
            log.warn("[{}] Ghostscript not found. Using in-process optimization only.", contextInfo);
            byte[] rewritten = documentAdapter.resave(document.getContent());
            Artifact artifact = artifactStore.put(rewritten, artifactName);
            return new CompressionResult(artifact, originalSize, null, FALLBACK_WARNING, null);
        }

        Path scratchDir = createScratchDirectory();
        try {
            Path input = scratchDir.resolve("input.pdf");
            Files.write(input, document.getContent());

            List<GhostscriptPreset> presets = targetSize == null
                    ? List.of(config.getGhostscript().getDefaultPreset())
                    : config.getGhostscript().getPresets();
            CompressionAttempt best = search(input, scratchDir, presets, targetSize, contextInfo);

            if (best == null) {
                throw new CompressionFailedException("Could not compress file");
            }
            log.info("[{}] Compression finished with preset {}: {} -> {} bytes.", contextInfo,
                     best.preset().getPdfSettings(), originalSize, best.size());
            Artifact artifact = artifactStore.put(best.candidate(), artifactName);
            return new CompressionResult(artifact, originalSize, best.preset(), null, null);
        } catch (IOException e) {
            throw new OperationException("Failed to prepare the document for compression.", e);
        } finally {
            try {
                FileUtils.deleteDirectory(scratchDir.toFile());
            } catch (IOException e) {
                log.warn("[{}] Failed to clean up scratch directory {}: {}", contextInfo, scratchDir, e.getMessage());
            }
        }
    }

    /**
     * Greedy search over the presets. Returns the first attempt within {@code targetSize}, or the
     * smallest attempt when none fits. Superseded candidates are deleted as soon as they lose.
     */
    private CompressionAttempt search(Path input, Path scratchDir, List<GhostscriptPreset> presets, Long targetSize,
                                      String contextInfo) {
        CompressionAttempt best = null;
        for (GhostscriptPreset preset : presets) {
            Path candidate = scratchDir.resolve("candidate-" + preset.name().toLowerCase(Locale.ROOT) + ".pdf");
            long size;
            try {
                size = ghostscriptReducer.reduce(input, candidate, preset, contextInfo);
            } catch (ToolExecutionException e) {
                log.warn("[{}] Preset {} failed and is skipped: {}", contextInfo, preset.getPdfSettings(),
                         e.getMessage());
                deleteQuietly(candidate, contextInfo);
                continue;
            }

            CompressionAttempt attempt = new CompressionAttempt(preset, candidate, size);
            if (targetSize != null && targetSize > 0 && size <= targetSize) {
                log.debug("[{}] Preset {} met the target ({} <= {}).", contextInfo, preset.getPdfSettings(), size,
                          targetSize);
                if (best != null) {
                    deleteQuietly(best.candidate(), contextInfo);
                }
                return attempt;
            }
            if (best == null || size < best.size()) {
                if (best != null) {
                    deleteQuietly(best.candidate(), contextInfo);
                }
                best = attempt;
            } else {
                deleteQuietly(candidate, contextInfo);
            }
        }
        return best;
    }

    private Path createScratchDirectory() {
        try {
            return Files.createTempDirectory("pdf-compress-");
        } catch (IOException e) {
            throw new OperationException("Failed to create a scratch directory for compression.", e);
        }
    }

    private void deleteQuietly(Path candidate, String contextInfo) {
        try {
            Files.deleteIfExists(candidate);
        } catch (IOException e) {
            log.warn("[{}] Failed to delete candidate {}: {}", contextInfo, candidate.getFileName(), e.getMessage());
        }
    }
}
