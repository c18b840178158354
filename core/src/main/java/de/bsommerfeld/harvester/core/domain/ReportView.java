package de.bsommerfeld.harvester.core.domain;

import java.util.Locale;

/**
 * Output shape requested by the renderer.
 */
public enum ReportView {

    /** Assets bucketed by folder path, paths and names sorted lexicographically. */
    GROUPED,

    /** Flat list, most recently commented asset first. */
    RECENT_FIRST;

    /**
     * Parses the CLI spelling ({@code grouped}, {@code recent}) as well as the
     * constant names.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ReportView parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "grouped":
                return GROUPED;
            case "recent":
            case "recent_first":
            case "recent-first":
                return RECENT_FIRST;
            default:
                throw new IllegalArgumentException("Unknown report view: " + value);
        }
    }
}
