package de.bsommerfeld.harvester.cli;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.harvester.core.event.HarvestEvents.AssetProcessedEvent;
import de.bsommerfeld.harvester.core.event.HarvestEvents.ContainerSkippedEvent;
import de.bsommerfeld.harvester.core.event.HarvestEvents.HarvestCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs harvest progress posted on the application event bus.
 */
public class ProgressListener {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressListener.class);

    private int skippedContainers;
    private int failedContainers;

    @Subscribe
    public void onAssetProcessed(AssetProcessedEvent event) {
        LOG.info("[{}/{}] {}{}", event.processed(), event.total(), event.assetName(),
                event.hadFeedback() ? "" : " (no feedback)");
    }

    @Subscribe
    public void onContainerSkipped(ContainerSkippedEvent event) {
        skippedContainers++;
        LOG.debug("Skipped '{}' ({})", event.containerName(), event.reason());
    }

    @Subscribe
    public void onHarvestCompleted(HarvestCompletedEvent event) {
        failedContainers = event.failedContainers();
        if (failedContainers > 0) {
            LOG.warn("{} containers could not be listed; the report is missing their assets",
                    event.failedContainers());
        }
        if (event.remaining() == 0) {
            LOG.info("Harvest finished: {} assets with feedback, {} containers skipped",
                    event.assetsWithFeedback(), skippedContainers);
        } else {
            LOG.info("Harvest paused with {} assets remaining; run the same command again to resume",
                    event.remaining());
        }
    }

    int skippedContainers() {
        return skippedContainers;
    }

    int failedContainers() {
        return failedContainers;
    }
}
