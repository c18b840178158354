package de.bsommerfeld.harvester.core.domain;

import java.util.Collections;
import java.util.List;

/**
 * A single normalized comment as handed to the renderer.
 *
 * @param text             comment body
 * @param author           resolved display name, never {@code null}
 * @param displayTimestamp human-readable creation time
 * @param rawTimestamp     original ISO-8601 value, used for sorting
 * @param annotations      normalized drawings attached to the comment
 * @param colorTag         palette color assigned to the comment
 */
public record CommentEntry(
        String text,
        String author,
        String displayTimestamp,
        String rawTimestamp,
        List<NormalizedAnnotation> annotations,
        String colorTag) {

    public CommentEntry {
        text = text != null ? text : "";
        annotations = annotations != null ? List.copyOf(annotations) : Collections.emptyList();
    }
}
