package de.bsommerfeld.harvester.harvest;

import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.core.domain.HarvestRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Name-based inclusion rules of a run. Asset names must contain every filter
 * term; container names matching a historical marker are pruned unless
 * historical containers were requested.
 */
public final class AssetFilter {

    private final List<String> terms;
    private final List<String> historicalMarkers;

    AssetFilter(List<String> terms, List<String> historicalMarkers) {
        this.terms = List.copyOf(terms);
        this.historicalMarkers = List.copyOf(historicalMarkers);
    }

    public static AssetFilter of(HarvestRequest request, HarvestConfig config) {
        List<String> markers = request.includeHistoricalContainers()
                ? List.of()
                : lowerCased(config.getHistoricalMarkers());
        return new AssetFilter(parseTerms(request.nameFilter()), markers);
    }

    /** Splits a comma-separated filter into lower-cased terms, dropping blanks. */
    static List<String> parseTerms(String nameFilter) {
        List<String> terms = new ArrayList<>();
        if (nameFilter == null)
            return terms;
        for (String part : nameFilter.split(",")) {
            String term = part.trim().toLowerCase(Locale.ROOT);
            if (!term.isEmpty())
                terms.add(term);
        }
        return terms;
    }

    public boolean acceptsAsset(String name) {
        if (terms.isEmpty())
            return true;
        String haystack = name.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (!haystack.contains(term))
                return false;
        }
        return true;
    }

    public boolean excludesContainer(String name) {
        String haystack = name.toLowerCase(Locale.ROOT);
        for (String marker : historicalMarkers) {
            if (haystack.contains(marker))
                return true;
        }
        return false;
    }

    private static List<String> lowerCased(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null)
            return out;
        for (String value : values) {
            if (value != null && !value.isBlank())
                out.add(value.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
