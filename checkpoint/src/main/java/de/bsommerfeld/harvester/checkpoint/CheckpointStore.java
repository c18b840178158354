package de.bsommerfeld.harvester.checkpoint;

import de.bsommerfeld.harvester.core.domain.AssetReport;

import java.util.List;
import java.util.Set;

/**
 * Persistence contract for harvest progress, keyed by run identity.
 *
 * <p>
 * The set of processed IDs only grows during a run. Once an ID is in the set
 * the harvester never processes that asset again for the run, even if no
 * report entry exists for it (the asset simply had no feedback).
 */
public interface CheckpointStore {

    /**
     * Restores the progress of {@code runId}. Missing, unreadable or corrupt
     * state yields {@link HarvestCheckpoint#empty(String)}; this method never
     * fails the run.
     */
    HarvestCheckpoint load(String runId);

    /**
     * Persists progress synchronously. Implementations must replace the
     * previous state atomically so an interrupted save leaves the last good
     * checkpoint intact.
     *
     * @throws CheckpointException if the state could not be written
     */
    void save(String runId, List<AssetReport> partialReport, Set<String> processedIds)
            throws CheckpointException;

    /**
     * Removes the state of a completed run. Missing state is not an error.
     */
    void clear(String runId);
}
