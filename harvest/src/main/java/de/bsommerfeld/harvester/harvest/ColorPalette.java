package de.bsommerfeld.harvester.harvest;

import de.bsommerfeld.harvester.core.config.HarvestConfig;

import java.util.List;

/**
 * Cyclic list of highlight colors assigned to comments by position.
 */
public final class ColorPalette {

    private final List<String> colors;

    public ColorPalette(List<String> colors) {
        this.colors = colors == null || colors.isEmpty() ? HarvestConfig.DEFAULT_PALETTE : List.copyOf(colors);
    }

    public String colorFor(int index) {
        return colors.get(Math.floorMod(index, colors.size()));
    }

    public int size() {
        return colors.size();
    }
}
