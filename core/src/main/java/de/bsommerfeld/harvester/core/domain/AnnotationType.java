package de.bsommerfeld.harvester.core.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Shapes a reviewer can draw on a frame. The API reports them under several
 * names depending on the client that created the annotation.
 */
public enum AnnotationType {

    RECTANGLE("rectangle", "rect", "box", "square"),
    CIRCLE("circle", "ellipse", "oval"),
    ARROW("arrow"),
    LINE("line"),
    FREEHAND("freehand", "pen", "draw", "path", "brush");

    private final String[] aliases;

    AnnotationType(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolves a raw type or tool name. Returns empty for shapes the report
     * cannot render.
     */
    public static Optional<AnnotationType> fromRaw(String raw) {
        if (raw == null)
            return Optional.empty();
        String needle = raw.trim().toLowerCase(Locale.ROOT);
        for (AnnotationType type : values()) {
            for (String alias : type.aliases) {
                if (alias.equals(needle))
                    return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
