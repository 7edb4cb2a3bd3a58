package com.eyelevel.pdftoolkit.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Normalized outcome of a successful operation. Optional fields are null when they do not apply.
 */
@Getter
@Builder
public class OperationResult {

    /**
     * Name under which the artifact can be downloaded; null for operations that produce no file.
     */
    private final String artifactRef;
    private final String filename;
    private final long size;
    private final Long originalSize;
    private final Integer pageCount;
    private final String warning;
    private final String message;
    private final ValidationStatus status;
}
