package de.bsommerfeld.harvester.core.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Annotation geometry expressed in percent of the frame, independent of the
 * resolution it was drawn at.
 *
 * <p>
 * Box shapes ({@link AnnotationType#RECTANGLE}, {@link AnnotationType#CIRCLE})
 * populate {@code x}, {@code y}, {@code width} and {@code height}. Line shapes
 * ({@link AnnotationType#ARROW}, {@link AnnotationType#LINE}) carry exactly two
 * points (start, end); {@link AnnotationType#FREEHAND} carries the full path.
 *
 * @param type   shape of the annotation
 * @param color  color tag inherited from the owning comment
 * @param x      left edge in percent of frame width
 * @param y      top edge in percent of frame height
 * @param width  width in percent of frame width
 * @param height height in percent of frame height
 * @param points scaled points for line and path shapes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedAnnotation(
        AnnotationType type,
        String color,
        Double x,
        Double y,
        Double width,
        Double height,
        List<Point> points) {

    public NormalizedAnnotation {
        points = points != null ? List.copyOf(points) : null;
    }

    public static NormalizedAnnotation box(AnnotationType type, String color,
            double x, double y, double width, double height) {
        return new NormalizedAnnotation(type, color, x, y, width, height, null);
    }

    public static NormalizedAnnotation path(AnnotationType type, String color, List<Point> points) {
        return new NormalizedAnnotation(type, color, null, null, null, null, points);
    }
}
