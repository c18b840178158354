package de.bsommerfeld.harvester.frameio;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.harvester.core.config.EndpointConfig;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed operations on the review service. Operations with unstable paths
 * go through the {@link EndpointProber}; the stable team and project
 * endpoints are requested directly.
 */
public class FrameioApi {

    private static final Logger LOG = LoggerFactory.getLogger(FrameioApi.class);
    private static final List<String> PREVIEW_FIELDS = List.of("url", "preview_url", "thumbnail_url", "thumb", "original");

    private final RateLimitedClient client;
    private final EndpointProber prober;
    private final EndpointConfig endpoints;

    public FrameioApi(RateLimitedClient client, EndpointProber prober, EndpointConfig endpoints) {
        this.client = client;
        this.prober = prober;
        this.endpoints = endpoints;
    }

    // =====================================================================
    // Account
    // =====================================================================

    public List<Team> listTeams() throws FrameioApiException {
        JsonNode response = client.get(prober.resolve("/teams", ""));
        List<Team> teams = new ArrayList<>();
        for (JsonNode node : ResponseParser.elements(response)) {
            teams.add(new Team(ResponseParser.text(node, "id"), ResponseParser.text(node, "name")));
        }
        return teams;
    }

    public List<ProjectInfo> listProjects(String teamId) throws FrameioApiException {
        JsonNode response = client.get(prober.resolve("/teams/{id}/projects", teamId));
        List<ProjectInfo> projects = new ArrayList<>();
        for (JsonNode node : ResponseParser.elements(response)) {
            projects.add(toProject(node));
        }
        return projects;
    }

    /**
     * Looks up a project and its root folder.
     *
     * @throws FrameioApiException if the project cannot be read or has no root folder
     */
    public ProjectInfo getProject(String projectId) throws FrameioApiException {
        ProjectInfo project = toProject(client.get(prober.resolve("/projects/{id}", projectId)));
        if (project.rootFolderId() == null) {
            throw new FrameioApiException("Project " + projectId + " has no root folder", 200);
        }
        return project;
    }

    // =====================================================================
    // Tree
    // =====================================================================

    /**
     * Direct children of a folder or review link. Children without a
     * parent link are attributed to the container.
     */
    public List<Item> listChildren(String containerId, ItemKind kind) throws FrameioApiException {
        JsonNode response = kind == ItemKind.REVIEW_LINK
                ? prober.probe("review-link-items", containerId, endpoints.getReviewLinkItems())
                : prober.probe("folder-children", containerId, endpoints.getFolderChildren());

        List<Item> children = new ArrayList<>();
        for (JsonNode node : ResponseParser.elements(response)) {
            Item child = ResponseParser.toItem(node);
            if (child.id() == null) {
                LOG.debug("Skipping child without id in {}", containerId);
                continue;
            }
            if (child.parentId() == null) {
                child = new Item(child.id(), child.name(), child.kind(), containerId, child.attributes());
            }
            children.add(child);
        }
        return children;
    }

    public List<Item> listReviewLinks(String projectId) throws FrameioApiException {
        JsonNode response = prober.probe("project-review-links", projectId, endpoints.getProjectReviewLinks());
        List<Item> links = new ArrayList<>();
        for (JsonNode node : ResponseParser.elements(response)) {
            Item link = ResponseParser.toItem(node, ItemKind.REVIEW_LINK);
            if (link.id() != null) {
                links.add(link);
            }
        }
        return links;
    }

    public Item getItem(String itemId) throws FrameioApiException {
        return ResponseParser.toItem(prober.probe("item", itemId, endpoints.getItem()));
    }

    // =====================================================================
    // Feedback
    // =====================================================================

    public List<JsonNode> listComments(String assetId) throws FrameioApiException {
        return ResponseParser.elements(prober.probe("asset-comments", assetId, endpoints.getAssetComments()));
    }

    /**
     * Preview image URL of an asset. Missing previews (404 on every
     * candidate) are not an error; other failures propagate.
     */
    public Optional<String> fetchPreviewUrl(String assetId) throws FrameioApiException {
        JsonNode response;
        try {
            response = prober.probe("asset-preview", assetId, endpoints.getAssetPreview());
        } catch (EndpointProbeException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
        if (response.isTextual() && !response.asText().isBlank()) {
            return Optional.of(response.asText());
        }
        for (String field : PREVIEW_FIELDS) {
            String value = ResponseParser.text(response, field);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static ProjectInfo toProject(JsonNode node) {
        return new ProjectInfo(
                ResponseParser.text(node, "id"),
                ResponseParser.text(node, "name"),
                ResponseParser.text(node, "root_folder_id") != null
                        ? ResponseParser.text(node, "root_folder_id")
                        : ResponseParser.text(node, "root_asset_id"));
    }
}
