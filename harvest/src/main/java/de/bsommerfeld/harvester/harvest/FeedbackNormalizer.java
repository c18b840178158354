package de.bsommerfeld.harvester.harvest;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.harvester.core.config.GlobalConfig;
import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import de.bsommerfeld.harvester.core.domain.CommentEntry;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the report entry of one asset from its raw comments.
 *
 * <p>
 * Comments are ordered oldest first and colored by position from the
 * {@link ColorPalette}; each comment's annotations share its color. Only
 * the comment listing itself may fail the asset: author, timestamp,
 * thumbnail and annotation problems fall back to defaults.
 */
@Singleton
public class FeedbackNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(FeedbackNormalizer.class);
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final FrameioApi api;
    private final FolderPathResolver pathResolver;
    private final Clock clock;
    private final HarvestConfig config;
    private final ZoneId displayZone;
    private final ColorPalette palette;
    private final AuthorResolver authorResolver = new AuthorResolver();
    private final ThumbnailResolver thumbnailResolver;
    private final AnnotationNormalizer annotationNormalizer;

    @Inject
    public FeedbackNormalizer(FrameioApi api, FolderPathResolver pathResolver, GlobalConfig globalConfig, Clock clock) {
        this.api = api;
        this.pathResolver = pathResolver;
        this.clock = clock;
        this.config = globalConfig.getHarvest();
        this.displayZone = ZoneId.of(config.getDisplayZone());
        this.palette = new ColorPalette(config.getPalette());
        this.thumbnailResolver = new ThumbnailResolver(api);
        this.annotationNormalizer = new AnnotationNormalizer(config.getFrameWidth(), config.getFrameHeight());
    }

    /**
     * Normalizes the feedback of {@code asset}.
     *
     * @return the report entry, or empty if the asset has no usable comments
     * @throws FrameioApiException if the comments could not be listed
     */
    public Optional<AssetReport> normalize(HarvestContext ctx, Item asset) throws FrameioApiException {
        List<JsonNode> rawComments = api.listComments(asset.id());

        List<RawComment> comments = new ArrayList<>();
        for (JsonNode node : rawComments) {
            if (!node.isObject()) {
                LOG.warn("Skipping malformed comment on '{}': {}", asset.name(), node);
                continue;
            }
            comments.add(readComment(node));
        }
        if (comments.isEmpty()) {
            LOG.debug("No feedback on '{}'", asset.name());
            return Optional.empty();
        }
        comments.sort(Comparator.comparing(RawComment::instant));

        List<CommentEntry> entries = new ArrayList<>(comments.size());
        for (int i = 0; i < comments.size(); i++) {
            RawComment comment = comments.get(i);
            String color = palette.colorFor(i);
            entries.add(new CommentEntry(
                    comment.text(),
                    authorResolver.resolve(comment.node()),
                    formatDisplay(comment.rawTimestamp()),
                    comment.rawTimestamp(),
                    annotationNormalizer.normalize(comment.node(), color),
                    color));
        }

        return Optional.of(new AssetReport(
                asset.id(),
                asset.name(),
                asset.kind().name().toLowerCase(Locale.ROOT),
                thumbnailResolver.resolve(asset),
                viewUrl(ctx.projectId(), asset.id()),
                pathResolver.resolve(ctx, asset.parentId()),
                entries));
    }

    private RawComment readComment(JsonNode node) {
        String raw = firstText(node, "created_at", "inserted_at");
        if (raw == null)
            raw = clock.instant().toString();
        String text = node.path("text").isTextual() ? node.get("text").asText() : "";
        return new RawComment(node, text, raw, AssetReport.parseInstant(raw));
    }

    String formatDisplay(String raw) {
        try {
            return OffsetDateTime.parse(raw).atZoneSameInstant(displayZone).format(DISPLAY_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw).atOffset(ZoneOffset.UTC)
                        .atZoneSameInstant(displayZone).format(DISPLAY_FORMAT);
            } catch (DateTimeParseException notIso) {
                return raw;
            }
        }
    }

    private String viewUrl(String projectId, String assetId) {
        return config.getViewUrlTemplate()
                .replace("{projectId}", projectId)
                .replace("{assetId}", assetId);
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank())
                return value.asText();
        }
        return null;
    }

    private record RawComment(JsonNode node, String text, String rawTimestamp, Instant instant) {
    }
}
