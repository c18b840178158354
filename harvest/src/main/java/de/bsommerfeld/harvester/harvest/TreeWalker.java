package de.bsommerfeld.harvester.harvest;

import com.google.inject.Singleton;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import de.bsommerfeld.harvester.core.event.ApplicationEventBus;
import de.bsommerfeld.harvester.core.event.HarvestEvents.ContainerSkippedEvent;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Collects the leaf assets below a container.
 *
 * <p>
 * The traversal is depth-first with an explicit stack of child iterators,
 * so deep folder hierarchies never grow the call stack. Leaves come out in
 * the same order a recursive walk would produce: API child order, with each
 * subfolder fully expanded before its next sibling.
 *
 * <p>
 * A container is fetched at most once per run. Containers pruned by the
 * historical markers are never fetched; the project root folder is exempt
 * from that check since its name is the project name. A container whose children cannot
 * be fetched contributes nothing; its siblings are still walked.
 */
@Singleton
public class TreeWalker {

    private static final Logger LOG = LoggerFactory.getLogger(TreeWalker.class);

    private final FrameioApi api;
    private final ApplicationEventBus eventBus;

    @Inject
    public TreeWalker(FrameioApi api, ApplicationEventBus eventBus) {
        this.api = api;
        this.eventBus = eventBus;
    }

    public List<Item> walk(HarvestContext ctx, String containerId, String containerName, ItemKind kind) {
        Item start = new Item(containerId, containerName, kind, null);
        ctx.registerContainer(start);

        List<Item> assets = new ArrayList<>();
        Deque<Iterator<Item>> stack = new ArrayDeque<>();
        Iterator<Item> rootChildren = expand(ctx, start);
        if (rootChildren != null)
            stack.push(rootChildren);

        while (!stack.isEmpty()) {
            Iterator<Item> current = stack.peek();
            if (!current.hasNext()) {
                stack.pop();
                continue;
            }
            Item child = current.next();
            if (child.kind().isContainer()) {
                ctx.registerContainer(child);
                Iterator<Item> grandChildren = expand(ctx, child);
                if (grandChildren != null)
                    stack.push(grandChildren);
            } else if (child.kind().isLeaf()) {
                if (ctx.filter().acceptsAsset(child.name())) {
                    assets.add(child);
                } else {
                    LOG.debug("Asset '{}' does not match the name filter", child.name());
                }
            } else {
                LOG.debug("Ignoring '{}' of unrecognized type", child.name());
            }
        }

        LOG.info("Walked '{}': {} matching assets", containerName, assets.size());
        return assets;
    }

    /**
     * Fetches the children of a container, or returns {@code null} if the
     * container contributes nothing.
     */
    private Iterator<Item> expand(HarvestContext ctx, Item container) {
        if (!ctx.markVisited(container.id())) {
            LOG.debug("Container '{}' already visited", container.name());
            return null;
        }
        if (!container.id().equals(ctx.rootFolderId()) && ctx.filter().excludesContainer(container.name())) {
            LOG.info("Skipping historical container '{}'", container.name());
            eventBus.post(new ContainerSkippedEvent(ctx.runId(), container.id(), container.name(), "historical"));
            return null;
        }
        try {
            List<Item> children = api.listChildren(container.id(), container.kind());
            LOG.debug("Container '{}' has {} children", container.name(), children.size());
            return children.iterator();
        } catch (FrameioApiException e) {
            LOG.warn("Could not list contents of '{}' ({}), skipping subtree: {}",
                    container.name(), container.id(), e.getMessage());
            ctx.recordFailedContainer();
            eventBus.post(new ContainerSkippedEvent(ctx.runId(), container.id(), container.name(), "fetch-failed"));
            return null;
        }
    }
}
