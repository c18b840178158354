package de.bsommerfeld.harvester.harvest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.harvester.core.domain.AnnotationType;
import de.bsommerfeld.harvester.core.domain.NormalizedAnnotation;
import de.bsommerfeld.harvester.core.domain.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts drawing annotations from frame pixel coordinates into
 * percentages of the frame, {@code raw * 100 / dimension}. Horizontal
 * values scale by the frame width, vertical values by the frame height.
 *
 * <p>
 * Rectangles and circles keep their bounding box, arrows and lines their
 * first and last point, freehand strokes the full path. Unrecognized
 * shapes and incomplete geometry are dropped.
 */
final class AnnotationNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotationNormalizer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final double frameWidth;
    private final double frameHeight;

    AnnotationNormalizer(double frameWidth, double frameHeight) {
        if (frameWidth <= 0 || frameHeight <= 0)
            throw new IllegalArgumentException("Frame dimensions must be positive: " + frameWidth + "x" + frameHeight);
        this.frameWidth = frameWidth;
        this.frameHeight = frameHeight;
    }

    List<NormalizedAnnotation> normalize(JsonNode comment, String color) {
        List<NormalizedAnnotation> result = new ArrayList<>();
        for (JsonNode raw : rawAnnotations(comment)) {
            toAnnotation(raw, color).ifPresentOrElse(result::add,
                    () -> LOG.debug("Dropping unsupported annotation {}", raw));
        }
        return result;
    }

    private List<JsonNode> rawAnnotations(JsonNode comment) {
        JsonNode node = comment.path("annotations");
        if (node.isMissingNode() || node.isNull())
            node = comment.path("annotation");
        if (node.isTextual()) {
            try {
                node = MAPPER.readTree(node.asText());
            } catch (JsonProcessingException e) {
                LOG.debug("Annotation payload is not valid JSON: {}", e.getOriginalMessage());
                return List.of();
            }
        }
        List<JsonNode> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(out::add);
        } else if (node.isObject()) {
            out.add(node);
        }
        return out;
    }

    private Optional<NormalizedAnnotation> toAnnotation(JsonNode raw, String color) {
        if (!raw.isObject())
            return Optional.empty();
        String typeName = raw.hasNonNull("type") ? raw.get("type").asText() : raw.path("tool").asText(null);
        Optional<AnnotationType> type = AnnotationType.fromRaw(typeName);
        if (type.isEmpty())
            return Optional.empty();

        switch (type.get()) {
            case RECTANGLE:
            case CIRCLE:
                return box(type.get(), raw, color);
            case ARROW:
            case LINE: {
                List<Point> points = points(raw);
                if (points.size() < 2)
                    return Optional.empty();
                return Optional.of(NormalizedAnnotation.path(type.get(), color,
                        List.of(points.get(0), points.get(points.size() - 1))));
            }
            case FREEHAND: {
                List<Point> points = points(raw);
                if (points.isEmpty())
                    return Optional.empty();
                return Optional.of(NormalizedAnnotation.path(type.get(), color, points));
            }
            default:
                return Optional.empty();
        }
    }

    private Optional<NormalizedAnnotation> box(AnnotationType type, JsonNode raw, String color) {
        Optional<Double> x = number(raw, "x");
        Optional<Double> y = number(raw, "y");
        Optional<Double> width = number(raw, "width").or(() -> number(raw, "w"));
        Optional<Double> height = number(raw, "height").or(() -> number(raw, "h"));
        if (x.isEmpty() || y.isEmpty() || width.isEmpty() || height.isEmpty())
            return Optional.empty();
        return Optional.of(NormalizedAnnotation.box(type, color,
                scaleX(x.get()), scaleY(y.get()), scaleX(width.get()), scaleY(height.get())));
    }

    private List<Point> points(JsonNode raw) {
        JsonNode node = raw.path("points");
        if (!node.isArray())
            node = raw.path("path");
        List<Point> points = new ArrayList<>();
        if (!node.isArray())
            return points;
        for (JsonNode entry : node) {
            Optional<Double> x;
            Optional<Double> y;
            if (entry.isArray() && entry.size() >= 2) {
                x = number(entry.get(0));
                y = number(entry.get(1));
            } else {
                x = number(entry, "x");
                y = number(entry, "y");
            }
            if (x.isEmpty() || y.isEmpty())
                return List.of();
            points.add(new Point(scaleX(x.get()), scaleY(y.get())));
        }
        return points;
    }

    private double scaleX(double value) {
        return value * 100.0 / frameWidth;
    }

    private double scaleY(double value) {
        return value * 100.0 / frameHeight;
    }

    private static Optional<Double> number(JsonNode node, String field) {
        return number(node.path(field));
    }

    private static Optional<Double> number(JsonNode value) {
        if (value.isNumber())
            return Optional.of(value.asDouble());
        if (value.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
