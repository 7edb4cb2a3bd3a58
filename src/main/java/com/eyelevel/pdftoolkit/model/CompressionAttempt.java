package com.eyelevel.pdftoolkit.model;

import java.nio.file.Path;

/**
 * A candidate produced by one Ghostscript preset while searching for the best compression.
 */
public record CompressionAttempt(GhostscriptPreset preset, Path candidate, long size) {
}
