package de.bsommerfeld.harvester.harvest;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Finds a thumbnail URL for an asset. The item metadata is searched first;
 * only when it has none is the preview endpoint called.
 */
final class ThumbnailResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ThumbnailResolver.class);

    private static final List<String> SIZES = List.of("small", "medium", "large");
    private static final List<String> URL_FIELDS = List.of("thumbnail_url", "thumb", "thumb_540", "cover_url");

    private static final List<Function<JsonNode, Optional<String>>> STRATEGIES = List.of(
            ThumbnailResolver::fromSizeMap,
            ThumbnailResolver::fromList,
            ThumbnailResolver::fromUrlFields);

    private final FrameioApi api;

    ThumbnailResolver(FrameioApi api) {
        this.api = api;
    }

    /** Thumbnail URL of the asset, {@code null} when none can be found. */
    String resolve(Item asset) {
        for (Function<JsonNode, Optional<String>> strategy : STRATEGIES) {
            Optional<String> url = strategy.apply(asset.attributes());
            if (url.isPresent())
                return url.get();
        }
        try {
            return api.fetchPreviewUrl(asset.id()).orElse(null);
        } catch (FrameioApiException e) {
            LOG.warn("Preview lookup failed for '{}': {}", asset.name(), e.getMessage());
            return null;
        }
    }

    private static Optional<String> fromSizeMap(JsonNode attributes) {
        JsonNode thumbnails = attributes.path("thumbnails");
        if (!thumbnails.isObject())
            return Optional.empty();
        for (String size : SIZES) {
            Optional<String> url = text(thumbnails.path(size));
            if (url.isPresent())
                return url;
        }
        return Optional.empty();
    }

    private static Optional<String> fromList(JsonNode attributes) {
        JsonNode thumbnails = attributes.path("thumbnails");
        if (!thumbnails.isArray() || thumbnails.isEmpty())
            return Optional.empty();
        for (JsonNode entry : thumbnails) {
            if (entry.isTextual())
                return text(entry);
        }
        return text(thumbnails.get(0).path("url"));
    }

    private static Optional<String> fromUrlFields(JsonNode attributes) {
        for (String field : URL_FIELDS) {
            Optional<String> url = text(attributes.path(field));
            if (url.isPresent())
                return url;
        }
        return Optional.empty();
    }

    private static Optional<String> text(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank())
            return Optional.empty();
        return Optional.of(node.asText());
    }
}
