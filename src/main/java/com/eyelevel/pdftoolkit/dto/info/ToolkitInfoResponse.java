package com.eyelevel.pdftoolkit.dto.info;

import lombok.Builder;
import lombok.Getter;

/**
 * Describes the running service: which external tools were found and the limits in force.
 */
@Getter
@Builder
public class ToolkitInfoResponse {
    private final String service;
    private final boolean ghostscriptAvailable;
    private final boolean libreOfficeAvailable;
    private final long maxUploadSize;
    private final long artifactTtlSeconds;
}
