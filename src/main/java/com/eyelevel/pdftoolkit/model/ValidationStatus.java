package com.eyelevel.pdftoolkit.model;

/**
 * Pre-flight verdict for an uploaded PDF.
 */
public enum ValidationStatus {
    /**
     * Loadable, unencrypted and within the size threshold.
     */
    READY,
    /**
     * Loadable and unencrypted, but larger than submission portals usually accept.
     */
    RISKY,
    /**
     * Corrupt, not a PDF, or password protected.
     */
    INVALID
}
