/**
 * Persistence of harvest progress.
 *
 * <p>
 * A run is identified by {@link de.bsommerfeld.harvester.checkpoint.RunIdentity},
 * which hashes every input that changes the set of harvested assets. After each
 * processed asset the harvester saves the accumulated report together with the
 * IDs it has processed so far; an interrupted run resumes from the last save.
 *
 * <p>
 * Two implementations of {@link de.bsommerfeld.harvester.checkpoint.CheckpointStore}
 * exist: {@link de.bsommerfeld.harvester.checkpoint.FileCheckpointStore} for
 * production and {@link de.bsommerfeld.harvester.checkpoint.InMemoryCheckpointStore}
 * for TEST mode.
 */
package de.bsommerfeld.harvester.checkpoint;
