package de.bsommerfeld.harvester.checkpoint;

import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.util.HashUtil;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derives the checkpoint key of a run.
 *
 * <p>
 * The key covers the project and every input that changes which assets are
 * harvested: the name filter and the historical-container flag. Changing either
 * between invocations starts a fresh run instead of resuming with a partial
 * report that was built under different assumptions. The filter is normalized
 * first (terms trimmed, lower-cased, sorted, blanks dropped) because matching
 * is case-insensitive and order-independent.
 */
public final class RunIdentity {

    private static final int HASH_LENGTH = 16;

    private RunIdentity() {
    }

    public static String of(HarvestRequest request) {
        return of(request.projectId(), request.nameFilter(), request.includeHistoricalContainers());
    }

    public static String of(String projectId, String nameFilter, boolean includeHistorical) {
        String canonical = projectId + "|" + normalizeFilter(nameFilter) + "|" + includeHistorical;
        return sanitize(projectId) + "-" + HashUtil.sha256(canonical).substring(0, HASH_LENGTH);
    }

    static String normalizeFilter(String nameFilter) {
        if (nameFilter == null)
            return "";
        return Arrays.stream(nameFilter.split(","))
                .map(term -> term.trim().toLowerCase(Locale.ROOT))
                .filter(term -> !term.isEmpty())
                .sorted()
                .collect(Collectors.joining(","));
    }

    /** Restricts the readable prefix to characters safe in file names. */
    private static String sanitize(String projectId) {
        String cleaned = projectId.replaceAll("[^A-Za-z0-9_-]", "_");
        return cleaned.length() > 64 ? cleaned.substring(0, 64) : cleaned;
    }
}
