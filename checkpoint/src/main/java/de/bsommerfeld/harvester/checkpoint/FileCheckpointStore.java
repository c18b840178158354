package de.bsommerfeld.harvester.checkpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * {@link CheckpointStore} that keeps one JSON file per run identity.
 *
 * <h3>Atomic replace</h3>
 * A save writes the complete state to a temp file in the checkpoint directory
 * and then moves it over the previous file. The move is atomic where the file
 * system supports it; an interruption mid-write therefore leaves either the old
 * or the new checkpoint, never a truncated one. Temp files live in the same
 * directory so the move never crosses file systems.
 *
 * <h3>Corruption</h3>
 * A checkpoint that cannot be parsed is logged and treated as absent. The
 * stale progress is lost, but the run proceeds from scratch instead of
 * aborting.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileCheckpointStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileCheckpointStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public HarvestCheckpoint load(String runId) {
        Path file = fileFor(runId);
        if (!Files.exists(file)) {
            LOG.debug("No checkpoint for run {}", runId);
            return HarvestCheckpoint.empty(runId);
        }
        try {
            HarvestCheckpoint checkpoint = mapper.readValue(file.toFile(), HarvestCheckpoint.class);
            if (checkpoint == null || !runId.equals(checkpoint.runId())) {
                LOG.warn("Checkpoint {} belongs to a different run, discarding it", file);
                return HarvestCheckpoint.empty(runId);
            }
            LOG.info("Resuming run {} from checkpoint saved at {} ({} assets already processed)",
                    runId, checkpoint.savedAt(), checkpoint.processedIds().size());
            return checkpoint;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Checkpoint {} is unreadable, starting fresh: {}", file, e.getMessage());
            return HarvestCheckpoint.empty(runId);
        }
    }

    @Override
    public void save(String runId, List<AssetReport> partialReport, Set<String> processedIds)
            throws CheckpointException {
        HarvestCheckpoint checkpoint = new HarvestCheckpoint(runId, partialReport, processedIds,
                clock.instant().toString());
        Path target = fileFor(runId);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, runId + "-", ".tmp");
            mapper.writeValue(temp.toFile(), checkpoint);
            moveIntoPlace(temp, target);
            LOG.debug("Saved checkpoint {} ({} processed)", runId, processedIds.size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CheckpointException("Failed to save checkpoint for run " + runId, e);
        }
    }

    @Override
    public void clear(String runId) {
        Path file = fileFor(runId);
        try {
            if (Files.deleteIfExists(file)) {
                LOG.info("Cleared checkpoint for completed run {}", runId);
            }
        } catch (IOException e) {
            LOG.warn("Could not delete checkpoint {}: {}", file, e.getMessage());
        }
    }

    Path fileFor(String runId) {
        return directory.resolve(runId + SUFFIX);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported, falling back to replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null)
            return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debug("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
