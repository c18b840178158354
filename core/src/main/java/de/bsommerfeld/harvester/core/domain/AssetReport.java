package de.bsommerfeld.harvester.core.domain;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;

/**
 * Feedback collected for one leaf asset.
 *
 * @param assetId      identifier of the asset
 * @param name         asset name
 * @param kind         API type of the asset (e.g. {@code video})
 * @param thumbnailUrl preview image, {@code null} if none could be resolved
 * @param viewUrl      link that opens the asset in the review service
 * @param folderPath   resolved container path, {@code /} for the project root
 * @param comments     comments in creation order
 */
public record AssetReport(
        String assetId,
        String name,
        String kind,
        String thumbnailUrl,
        String viewUrl,
        String folderPath,
        List<CommentEntry> comments) {

    public AssetReport {
        comments = comments != null ? List.copyOf(comments) : Collections.emptyList();
    }

    /**
     * Instant of the most recent comment, {@link Instant#EPOCH} when there are
     * no comments or none of the timestamps can be parsed.
     */
    public Instant latestActivity() {
        Instant latest = Instant.EPOCH;
        for (CommentEntry comment : comments) {
            Instant instant = parseInstant(comment.rawTimestamp());
            if (instant.isAfter(latest))
                latest = instant;
        }
        return latest;
    }

    /**
     * Lenient ISO-8601 parsing. Values without an offset are read as UTC.
     */
    public static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank())
            return Instant.EPOCH;
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return Instant.EPOCH;
            }
        }
    }
}
