package de.bsommerfeld.harvester.harvest;

import com.google.inject.Singleton;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a container ID into a slash-separated folder path such as
 * {@code /Edits/Round 2}. The project root and parentless containers map to
 * {@code /}. Ancestors not seen during the walk are looked up once and
 * registered in the run context.
 */
@Singleton
public class FolderPathResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FolderPathResolver.class);
    private static final String ROOT = "/";

    private final FrameioApi api;

    @Inject
    public FolderPathResolver(FrameioApi api) {
        this.api = api;
    }

    public String resolve(HarvestContext ctx, String containerId) {
        if (containerId == null)
            return ROOT;
        String cached = ctx.cachedPath(containerId);
        if (cached != null)
            return cached;

        List<String> segments = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String base = ROOT;
        String current = containerId;
        boolean cyclic = false;

        while (current != null && !current.equals(ctx.rootFolderId())) {
            if (!seen.add(current)) {
                LOG.warn("Cyclic parent chain at {} while resolving {}", current, containerId);
                cyclic = true;
                break;
            }
            String known = ctx.cachedPath(current);
            if (known != null) {
                base = known;
                break;
            }
            Item container = ctx.container(current).orElse(null);
            if (container == null)
                container = lookup(ctx, current);
            if (container == null || container.parentId() == null)
                break;
            segments.add(container.name());
            ids.add(current);
            current = container.parentId();
        }

        Collections.reverse(segments);
        Collections.reverse(ids);
        String path = join(base, segments);
        if (cyclic) {
            ctx.cachePath(containerId, path);
            return path;
        }
        // Every ancestor on the chain gets its path too, so siblings resolve without another climb.
        for (int i = 0; i < ids.size(); i++)
            ctx.cachePath(ids.get(i), join(base, segments.subList(0, i + 1)));
        ctx.cachePath(containerId, path);
        return path;
    }

    private Item lookup(HarvestContext ctx, String containerId) {
        try {
            Item item = api.getItem(containerId);
            ctx.registerContainer(item);
            return item;
        } catch (FrameioApiException e) {
            LOG.warn("Could not resolve ancestor {}: {}", containerId, e.getMessage());
            return null;
        }
    }

    private static String join(String base, List<String> segments) {
        if (segments.isEmpty())
            return base;
        String joined = String.join("/", segments);
        return base.endsWith("/") ? base + joined : base + "/" + joined;
    }
}
