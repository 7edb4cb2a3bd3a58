package com.eyelevel.pdftoolkit.model;

/**
 * Outcome of the validate operation. Derived once per request and never stored.
 */
public record ValidationReport(ValidationStatus status, int pageCount, long size, String message) {

    public static ValidationReport invalid(long size, String message) {
        return new ValidationReport(ValidationStatus.INVALID, 0, size, message);
    }
}
