package com.eyelevel.pdftoolkit.service.tool;

import java.nio.file.Path;

/**
 * Renders paths for external tool command lines.
 */
final class PathSanitizer {

    private PathSanitizer() {
    }

    /**
     * Absolute, normalized and with forward slashes, which Ghostscript and LibreOffice accept on every platform.
     */
    static String forCommandLine(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    /**
     * A {@code file://} URL for LibreOffice's {@code -env:UserInstallation} switch.
     */
    static String asFileUrl(Path path) {
        String sanitized = forCommandLine(path);
        return sanitized.startsWith("/") ? "file://" + sanitized : "file:///" + sanitized;
    }
}
