package com.eyelevel.pdftoolkit.dto.common;

import com.eyelevel.pdftoolkit.model.OperationResult;
import com.eyelevel.pdftoolkit.model.ValidationStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * The flat JSON body returned by every operation endpoint, for both successful and failed calls.
 * Fields that do not apply are omitted.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolkitResponse {

    public static final String DOWNLOAD_PATH = "/download/";

    /**
     * Relative download URL of the produced artifact.
     */
    private final String url;
    private final String filename;
    private final Long size;
    private final Long originalSize;
    private final Integer pageCount;

    /**
     * Set when the operation succeeded in a degraded mode, e.g. compression without Ghostscript.
     */
    private final String warning;
    private final String message;
    private final ValidationStatus status;

    /**
     * The failure reason. Only present on error responses.
     */
    private final String error;

    public static ToolkitResponse from(OperationResult result) {
        return ToolkitResponse.builder()
                              .url(result.getArtifactRef() == null ? null : DOWNLOAD_PATH + result.getArtifactRef())
                              .filename(result.getFilename())
                              .size(result.getSize())
                              .originalSize(result.getOriginalSize())
                              .pageCount(result.getPageCount())
                              .warning(result.getWarning())
                              .message(result.getMessage())
                              .status(result.getStatus())
                              .build();
    }

    public static ToolkitResponse error(String error) {
        return ToolkitResponse.builder().error(error).build();
    }

    public static ToolkitResponse error(String error, String message) {
        return ToolkitResponse.builder().error(error).message(message).build();
    }
}
