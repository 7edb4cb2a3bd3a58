package com.eyelevel.pdftoolkit.model;

import lombok.Builder;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * The parts of a standardized submission file name: {@code rollNo_subject_type_date.pdf}.
 */
@Getter
@Builder
public class SubmissionName {

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^a-zA-Z0-9_.-]");

    private final String rollNo;
    private final String subject;
    private final String type;
    private final String date;

    /**
     * Joins the parts and strips every character outside {@code [a-zA-Z0-9_.-]}, which also removes
     * path separators.
     */
    public String toFileName() {
        String raw = String.join("_", rollNo, subject, type, date) + ".pdf";
        return UNSAFE_CHARACTERS.matcher(raw).replaceAll("");
    }
}
