package de.bsommerfeld.harvester.core.domain;

import java.util.Locale;

/**
 * Classification of a remote item as returned in the {@code type} field of the
 * Frame.io API. Containers are walked, leaf kinds are eligible for feedback.
 */
public enum ItemKind {

    FOLDER(true),
    REVIEW_LINK(true),
    FILE(false),
    VERSION_STACK(false),
    VIDEO(false),
    IMAGE(false),
    PDF(false),
    AUDIO(false),
    REVIEW(false),
    UNKNOWN(false);

    private final boolean container;

    ItemKind(boolean container) {
        this.container = container;
    }

    public boolean isContainer() {
        return container;
    }

    /** Returns {@code true} for kinds that carry feedback of their own. */
    public boolean isLeaf() {
        return !container && this != UNKNOWN;
    }

    /**
     * Maps the API's type string to a kind. Matching is case-insensitive and
     * tolerates both {@code version_stack} and {@code version-stack}. Anything
     * not recognized maps to {@link #UNKNOWN}.
     */
    public static ItemKind fromApiType(String type) {
        if (type == null || type.isBlank())
            return UNKNOWN;
        String normalized = type.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ItemKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
