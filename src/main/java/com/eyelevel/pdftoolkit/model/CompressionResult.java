package com.eyelevel.pdftoolkit.model;

/**
 * What the compression engine produced.
 *
 * @param artifact     The promoted output file.
 * @param originalSize Size of the uploaded document.
 * @param preset       The winning preset, or null when no Ghostscript preset ran.
 * @param warning      Set when the result came from the degraded fallback path.
 * @param message      Informational note, e.g. when compression was skipped.
 */
public record CompressionResult(Artifact artifact, long originalSize, GhostscriptPreset preset, String warning,
                                String message) {
}
