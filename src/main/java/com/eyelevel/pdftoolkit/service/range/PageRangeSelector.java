package com.eyelevel.pdftoolkit.service.range;

import com.eyelevel.pdftoolkit.model.PageSelectionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Resolves a textual page specification such as {@code "1-3, 5"} into page numbers.
 *
 * <p>Input is forgiving: tokens that cannot be parsed, reversed ranges and pages outside the
 * document are dropped without failing. An empty result is returned when nothing resolves, and it
 * is up to the caller to treat that as a bad request.
 */
@Slf4j
@Component
public class PageRangeSelector {

    /**
     * Parses a page specification against a document of {@code pageCount} pages.
     *
     * @param spec      Comma-separated integers and {@code start-end} ranges.
     * @param pageCount Number of pages in the document.
     * @param mode      {@link PageSelectionMode#SELECTION} sorts and de-duplicates,
     *                  {@link PageSelectionMode#REORDER} keeps the given order and repeats.
     * @return 1-based page numbers, each within {@code [1, pageCount]}.
     */
    public List<Integer> parse(String spec, int pageCount, PageSelectionMode mode) {
        List<Integer> pages = new ArrayList<>();
        if (!StringUtils.hasText(spec) || pageCount <= 0) {
            return pages;
        }

        for (String rawToken : spec.split(",")) {
            String token = rawToken.trim();
            if (token.isEmpty()) {
                continue;
            }
            if (token.contains("-")) {
                expandRange(token, pageCount, pages);
            } else {
                Integer page = parseInt(token);
                if (page != null && page >= 1 && page <= pageCount) {
                    pages.add(page);
                } else {
                    log.debug("Dropping page token '{}' (document has {} pages).", token, pageCount);
                }
            }
        }

        if (mode == PageSelectionMode.SELECTION) {
            return new ArrayList<>(new TreeSet<>(pages));
        }
        return pages;
    }

    /**
     * Converts 1-based page numbers into the 0-based indices used by the document adapter.
     */
    public List<Integer> toZeroBased(List<Integer> pageNumbers) {
        return pageNumbers.stream().map(page -> page - 1).toList();
    }

    private void expandRange(String token, int pageCount, List<Integer> pages) {
        String[] bounds = token.split("-");
        if (bounds.length != 2) {
            log.debug("Dropping malformed range '{}'.", token);
            return;
        }
        Integer start = parseInt(bounds[0].trim());
        Integer end = parseInt(bounds[1].trim());
        if (start == null || end == null || start > end) {
            log.debug("Dropping range '{}'.", token);
            return;
        }
        for (int page = Math.max(start, 1); page <= Math.min(end, pageCount); page++) {
            pages.add(page);
        }
    }

    private Integer parseInt(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
