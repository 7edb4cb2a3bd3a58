package com.eyelevel.pdftoolkit.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Document information fields a user may overwrite. Null or blank fields leave the existing value alone.
 */
@Getter
@Builder
public class DocumentMetadata {
    private final String title;
    private final String author;
    private final String subject;
    private final String keywords;
}
