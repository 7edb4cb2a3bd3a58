package com.eyelevel.pdftoolkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Ghostscript {@code -dPDFSETTINGS} presets, declared in descending output quality.
 */
@Getter
@RequiredArgsConstructor
public enum GhostscriptPreset {
    PREPRESS("/prepress"),
    PRINTER("/printer"),
    EBOOK("/ebook"),
    SCREEN("/screen");

    private final String pdfSettings;

    public String toSwitch() {
        return "-dPDFSETTINGS=" + pdfSettings;
    }
}
