package com.eyelevel.pdftoolkit.model;

import lombok.Getter;

/**
 * An uploaded file as received by the engine: raw bytes plus the declared media type.
 * Content is copied on the way in and on the way out so that the document stays immutable
 * for the lifetime of the request.
 */
@Getter
public class InputDocument {
    private static final String DEFAULT_NAME = "document.pdf";

    private final String originalName;
    private final String mediaType;
    private final byte[] content;

    public InputDocument(String originalName, String mediaType, byte[] content) {
        this.originalName = originalName == null || originalName.isBlank() ? DEFAULT_NAME : originalName;
        this.mediaType = mediaType;
        this.content = content == null ? new byte[0] : content.clone();
    }

    public byte[] getContent() {
        return content.clone();
    }

    public long size() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }
}
