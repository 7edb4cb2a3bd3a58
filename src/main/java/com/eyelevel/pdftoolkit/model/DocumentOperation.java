package com.eyelevel.pdftoolkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Operations offered by the toolkit, with the path segment each is exposed under.
 */
@Getter
@RequiredArgsConstructor
public enum DocumentOperation {
    COMPRESS("compress", "compressed"),
    MERGE("merge", "merged"),
    SPLIT("split", "split"),
    ORGANISE("organise", "organised"),
    ROTATE("rotate", "rotated"),
    IMAGE_TO_PDF("image-to-pdf", "converted"),
    METADATA("metadata", "meta"),
    VALIDATE("validate", "validated"),
    PDF_TO_WORD("pdf-to-word", "word"),
    RENAME("rename", "renamed");

    private final String path;

    /**
     * Prefix used when naming the artifacts this operation produces.
     */
    private final String artifactPrefix;
}
