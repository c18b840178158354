package de.bsommerfeld.harvester.core.domain;

/**
 * A coordinate pair. Inside a {@link NormalizedAnnotation} both values are
 * percentages of the frame.
 */
public record Point(double x, double y) {
}
