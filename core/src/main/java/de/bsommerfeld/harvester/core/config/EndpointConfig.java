package de.bsommerfeld.harvester.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate endpoint templates per logical operation, tried in order.
 * {@code {id}} is replaced with the target identifier; templates are relative
 * to the client's base URL.
 */
public class EndpointConfig {

    @JsonProperty("folder-children")
    private List<String> folderChildren = new ArrayList<>(List.of(
            "/assets/{id}/children",
            "/items/{id}/children"));

    @JsonProperty("review-link-items")
    private List<String> reviewLinkItems = new ArrayList<>(List.of(
            "/review_links/{id}/items",
            "/review_links/{id}/assets"));

    @JsonProperty("project-review-links")
    private List<String> projectReviewLinks = new ArrayList<>(List.of(
            "/projects/{id}/review_links"));

    @JsonProperty("asset-comments")
    private List<String> assetComments = new ArrayList<>(List.of(
            "/assets/{id}/comments",
            "/items/{id}/comments"));

    @JsonProperty("asset-preview")
    private List<String> assetPreview = new ArrayList<>(List.of(
            "/assets/{id}/preview"));

    @JsonProperty("item")
    private List<String> item = new ArrayList<>(List.of(
            "/assets/{id}",
            "/items/{id}"));

    public List<String> getFolderChildren() {
        return folderChildren;
    }

    public void setFolderChildren(List<String> folderChildren) {
        this.folderChildren = folderChildren;
    }

    public List<String> getReviewLinkItems() {
        return reviewLinkItems;
    }

    public List<String> getProjectReviewLinks() {
        return projectReviewLinks;
    }

    public List<String> getAssetComments() {
        return assetComments;
    }

    public void setAssetComments(List<String> assetComments) {
        this.assetComments = assetComments;
    }

    public List<String> getAssetPreview() {
        return assetPreview;
    }

    public List<String> getItem() {
        return item;
    }
}
