package de.bsommerfeld.harvester.core.event;

/**
 * Progress events published during a harvest run.
 */
public final class HarvestEvents {

    private HarvestEvents() {
    }

    /**
     * A container was not descended into, either because it was already
     * visited, matched a historical marker or could not be fetched.
     */
    public record ContainerSkippedEvent(String runId, String containerId, String containerName, String reason) {
    }

    /**
     * One asset finished processing and its progress was checkpointed.
     *
     * @param processed number of assets processed in this invocation so far
     * @param total     number of assets this invocation set out to process
     */
    public record AssetProcessedEvent(String runId, String assetName, boolean hadFeedback,
            int processed, int total) {
    }

    /**
     * The run finished. {@code remaining} is zero when the checkpoint was cleared.
     * {@code failedContainers} counts folders and review links whose contents
     * could not be listed; their assets are missing from the report.
     */
    public record HarvestCompletedEvent(String runId, int assetsWithFeedback, int remaining,
            int failedContainers) {
    }
}
