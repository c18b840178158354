package de.bsommerfeld.harvester.harvest;

import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.domain.Item;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State scoped to a single harvest run: visited containers, the container
 * registry used for folder paths, and the path cache. A new context is
 * created for every run, so repeated or concurrent runs never share
 * visitation state.
 */
public final class HarvestContext {

    private final String runId;
    private final String projectId;
    private final AssetFilter filter;

    private final Set<String> visited = new HashSet<>();
    private final Map<String, Item> containers = new HashMap<>();
    private final Map<String, String> paths = new HashMap<>();

    private String rootFolderId;
    private int failedContainers;

    public HarvestContext(String runId, HarvestRequest request, AssetFilter filter) {
        this.runId = runId;
        this.projectId = request.projectId();
        this.filter = filter;
    }

    public String runId() {
        return runId;
    }

    public String projectId() {
        return projectId;
    }

    public AssetFilter filter() {
        return filter;
    }

    public String rootFolderId() {
        return rootFolderId;
    }

    public void setRootFolderId(String rootFolderId) {
        this.rootFolderId = rootFolderId;
    }

    /**
     * Marks a container as visited.
     *
     * @return {@code false} if it had already been visited in this run
     */
    public boolean markVisited(String containerId) {
        return visited.add(containerId);
    }

    boolean isVisited(String containerId) {
        return visited.contains(containerId);
    }

    /** Remembers a container's name and parent link; the first registration wins. */
    public void registerContainer(Item container) {
        containers.putIfAbsent(container.id(), container);
    }

    public Optional<Item> container(String containerId) {
        return Optional.ofNullable(containers.get(containerId));
    }

    public String cachedPath(String containerId) {
        return paths.get(containerId);
    }

    public void cachePath(String containerId, String path) {
        paths.put(containerId, path);
    }

    public void recordFailedContainer() {
        failedContainers++;
    }

    public int failedContainers() {
        return failedContainers;
    }
}
