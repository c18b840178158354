package de.bsommerfeld.harvester.checkpoint;

import com.google.inject.Singleton;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link CheckpointStore} for TEST mode. Nothing touches the
 * disk; state survives only as long as the store instance.
 */
@Singleton
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final Map<String, HarvestCheckpoint> checkpoints = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public HarvestCheckpoint load(String runId) {
        return checkpoints.getOrDefault(runId, HarvestCheckpoint.empty(runId));
    }

    @Override
    public void save(String runId, List<AssetReport> partialReport, Set<String> processedIds) {
        checkpoints.put(runId, new HarvestCheckpoint(runId, partialReport, processedIds,
                clock.instant().toString()));
        LOG.trace("Checkpoint {} now holds {} processed IDs", runId, processedIds.size());
    }

    @Override
    public void clear(String runId) {
        checkpoints.remove(runId);
    }
}
