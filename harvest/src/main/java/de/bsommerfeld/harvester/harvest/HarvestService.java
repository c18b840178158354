package de.bsommerfeld.harvester.harvest;

import com.google.common.collect.Lists;
import com.google.inject.Singleton;
import de.bsommerfeld.harvester.checkpoint.CheckpointException;
import de.bsommerfeld.harvester.checkpoint.CheckpointStore;
import de.bsommerfeld.harvester.checkpoint.HarvestCheckpoint;
import de.bsommerfeld.harvester.checkpoint.RunIdentity;
import de.bsommerfeld.harvester.core.config.GlobalConfig;
import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import de.bsommerfeld.harvester.core.domain.HarvestReport;
import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import de.bsommerfeld.harvester.core.event.ApplicationEventBus;
import de.bsommerfeld.harvester.core.event.HarvestEvents.AssetProcessedEvent;
import de.bsommerfeld.harvester.core.event.HarvestEvents.HarvestCompletedEvent;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import de.bsommerfeld.harvester.frameio.ProjectInfo;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a complete, resumable harvest of one project.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 * harvest()
 *   ├ getProject()            → root folder (fatal on failure)
 *   ├ TreeWalker.walk()       → root folder and review links
 *   ├ CheckpointStore.load()  → skip already processed assets
 *   ├ FeedbackNormalizer      → one asset at a time, checkpoint after each
 *   └ ReportAggregator        → ordered report
 * </pre>
 *
 * <h3>Resumption</h3>
 * Progress is saved after every asset. An asset whose comments cannot be
 * listed is left unprocessed and picked up by the next invocation with the
 * same request. The checkpoint is cleared once nothing remains.
 */
@Singleton
public class HarvestService {

    private static final Logger LOG = LoggerFactory.getLogger(HarvestService.class);

    private final FrameioApi api;
    private final TreeWalker walker;
    private final FeedbackNormalizer normalizer;
    private final ReportAggregator aggregator;
    private final CheckpointStore checkpointStore;
    private final ApplicationEventBus eventBus;
    private final HarvestConfig config;

    @Inject
    public HarvestService(FrameioApi api, TreeWalker walker, FeedbackNormalizer normalizer,
            ReportAggregator aggregator, CheckpointStore checkpointStore,
            ApplicationEventBus eventBus, GlobalConfig globalConfig) {
        this.api = api;
        this.walker = walker;
        this.normalizer = normalizer;
        this.aggregator = aggregator;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.config = globalConfig.getHarvest();
    }

    public HarvestReport harvest(HarvestRequest request) throws HarvestException {
        String runId = RunIdentity.of(request);
        HarvestContext ctx = new HarvestContext(runId, request, AssetFilter.of(request, config));
        LOG.info("Starting run {} for {}", runId, request);

        ProjectInfo project;
        try {
            project = api.getProject(request.projectId());
        } catch (FrameioApiException e) {
            throw new HarvestException("Could not load project " + request.projectId(), e);
        }
        ctx.setRootFolderId(project.rootFolderId());

        List<Item> assets = discover(ctx, project);

        HarvestCheckpoint checkpoint = checkpointStore.load(runId);
        List<AssetReport> reports = new ArrayList<>(checkpoint.partialReport());
        Set<String> processed = new LinkedHashSet<>(checkpoint.processedIds());
        if (!checkpoint.isEmpty()) {
            LOG.info("Resuming run {} from {}: {} assets already processed",
                    runId, checkpoint.savedAt(), processed.size());
        }

        List<Item> remaining = new ArrayList<>();
        for (Item asset : assets) {
            if (!processed.contains(asset.id()))
                remaining.add(asset);
        }
        int limit = config.getMaxAssetsPerRun() > 0
                ? Math.min(config.getMaxAssetsPerRun(), remaining.size())
                : remaining.size();
        List<Item> batch = remaining.subList(0, limit);
        LOG.info("{} assets found, {} remaining, processing {} in this invocation",
                assets.size(), remaining.size(), batch.size());

        int done = 0;
        for (List<Item> chunk : Lists.partition(batch, Math.max(1, config.getChunkSize()))) {
            for (Item asset : chunk) {
                Optional<AssetReport> report;
                try {
                    report = normalizer.normalize(ctx, asset);
                } catch (FrameioApiException e) {
                    LOG.warn("Could not read feedback for '{}', leaving it for the next run: {}",
                            asset.name(), e.getMessage());
                    continue;
                }
                report.ifPresent(reports::add);
                processed.add(asset.id());
                save(runId, reports, processed);
                done++;
                eventBus.post(new AssetProcessedEvent(runId, asset.name(), report.isPresent(), done, batch.size()));
            }
            LOG.debug("Chunk finished, {}/{} processed", done, batch.size());
        }

        int unprocessed = 0;
        for (Item asset : assets) {
            if (!processed.contains(asset.id()))
                unprocessed++;
        }
        boolean complete = unprocessed == 0;
        if (complete) {
            checkpointStore.clear(runId);
            LOG.info("Run {} complete: {} assets with feedback", runId, reports.size());
        } else {
            LOG.info("Run {} paused: {} assets remain, rerun to continue", runId, unprocessed);
        }
        if (ctx.failedContainers() > 0) {
            LOG.warn("Run {} could not list {} containers; their assets are missing from the report",
                    runId, ctx.failedContainers());
        }
        eventBus.post(new HarvestCompletedEvent(runId, reports.size(), unprocessed, ctx.failedContainers()));

        return aggregator.aggregate(reports, request.view(), complete);
    }

    private List<Item> discover(HarvestContext ctx, ProjectInfo project) {
        String rootName = project.name() != null ? project.name() : "root";
        List<Item> found = new ArrayList<>(walker.walk(ctx, project.rootFolderId(), rootName, ItemKind.FOLDER));

        if (config.isIncludeReviewLinks()) {
            List<Item> links;
            try {
                links = api.listReviewLinks(project.id() != null ? project.id() : ctx.projectId());
            } catch (FrameioApiException e) {
                LOG.warn("Could not list review links, continuing with folder assets only: {}", e.getMessage());
                links = List.of();
            }
            for (Item link : links) {
                found.addAll(walker.walk(ctx, link.id(), link.name(), ItemKind.REVIEW_LINK));
            }
        }

        Map<String, Item> unique = new LinkedHashMap<>();
        for (Item asset : found) {
            unique.putIfAbsent(asset.id(), asset);
        }
        if (unique.size() < found.size())
            LOG.debug("Dropped {} duplicate assets", found.size() - unique.size());
        return new ArrayList<>(unique.values());
    }

    private void save(String runId, List<AssetReport> reports, Set<String> processed) throws HarvestException {
        try {
            checkpointStore.save(runId, reports, processed);
        } catch (CheckpointException e) {
            throw new HarvestException("Could not checkpoint progress of run " + runId, e);
        }
    }
}
