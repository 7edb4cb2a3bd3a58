package com.eyelevel.pdftoolkit.model;

/**
 * How a page range specification is resolved into page numbers.
 */
public enum PageSelectionMode {
    /**
     * Pages are de-duplicated and sorted ascending; used to extract a subset of pages.
     */
    SELECTION,
    /**
     * Pages keep the exact order given and may repeat; used to rearrange a document.
     */
    REORDER
}
