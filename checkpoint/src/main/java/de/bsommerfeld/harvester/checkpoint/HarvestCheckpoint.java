package de.bsommerfeld.harvester.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import de.bsommerfeld.harvester.core.domain.AssetReport;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted progress of one run.
 *
 * @param runId         run identity the checkpoint belongs to
 * @param partialReport reports of processed assets that had feedback
 * @param processedIds  every processed asset ID, with or without feedback
 * @param savedAt       ISO-8601 time of the save, {@code null} for a fresh run
 */
public record HarvestCheckpoint(
        String runId,
        List<AssetReport> partialReport,
        Set<String> processedIds,
        String savedAt) {

    public HarvestCheckpoint {
        partialReport = partialReport != null ? List.copyOf(partialReport) : Collections.emptyList();
        processedIds = processedIds != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(processedIds))
                : Collections.emptySet();
    }

    /** A checkpoint with no progress, used for fresh runs and discarded state. */
    public static HarvestCheckpoint empty(String runId) {
        return new HarvestCheckpoint(runId, List.of(), Set.of(), null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return processedIds.isEmpty() && partialReport.isEmpty();
    }
}
