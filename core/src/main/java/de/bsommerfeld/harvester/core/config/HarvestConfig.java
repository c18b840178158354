package de.bsommerfeld.harvester.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Traversal, batching and normalization parameters.
 */
public class HarvestConfig {

    /** Comment highlight colors used when the configuration names none. */
    public static final List<String> DEFAULT_PALETTE = List.of(
            "#FF6B6B", "#4ECDC4", "#FFD166", "#6A4C93",
            "#1982C4", "#8AC926", "#FF924C", "#C5CA30");

    /**
     * Case-insensitive name fragments that mark a container as historical.
     * Only applied when a run does not ask for historical containers.
     */
    @JsonProperty("historical-markers")
    private List<String> historicalMarkers = new ArrayList<>(List.of("old", "archive"));

    @JsonProperty("include-review-links")
    private boolean includeReviewLinks = true;

    @JsonProperty("chunk-size")
    private int chunkSize = 10;

    /** Upper bound of assets processed per invocation, 0 for no limit. */
    @JsonProperty("max-assets-per-run")
    private int maxAssetsPerRun = 0;

    @JsonProperty("frame-width")
    private double frameWidth = 200;

    @JsonProperty("frame-height")
    private double frameHeight = 112;

    @JsonProperty("palette")
    private List<String> palette = new ArrayList<>(DEFAULT_PALETTE);

    @JsonProperty("display-zone")
    private String displayZone = "UTC";

    @JsonProperty("view-url-template")
    private String viewUrlTemplate = "https://app.frame.io/presentation/{projectId}?item={assetId}";

    /** Directory for checkpoint files. Empty resolves to the app data directory. */
    @JsonProperty("checkpoint-dir")
    private String checkpointDir = "";

    public List<String> getHistoricalMarkers() {
        return historicalMarkers;
    }

    public void setHistoricalMarkers(List<String> historicalMarkers) {
        this.historicalMarkers = historicalMarkers;
    }

    public boolean isIncludeReviewLinks() {
        return includeReviewLinks;
    }

    public void setIncludeReviewLinks(boolean includeReviewLinks) {
        this.includeReviewLinks = includeReviewLinks;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getMaxAssetsPerRun() {
        return maxAssetsPerRun;
    }

    public void setMaxAssetsPerRun(int maxAssetsPerRun) {
        this.maxAssetsPerRun = maxAssetsPerRun;
    }

    public double getFrameWidth() {
        return frameWidth;
    }

    public void setFrameWidth(double frameWidth) {
        this.frameWidth = frameWidth;
    }

    public double getFrameHeight() {
        return frameHeight;
    }

    public void setFrameHeight(double frameHeight) {
        this.frameHeight = frameHeight;
    }

    public List<String> getPalette() {
        return palette;
    }

    public void setPalette(List<String> palette) {
        this.palette = palette;
    }

    public String getDisplayZone() {
        return displayZone;
    }

    public void setDisplayZone(String displayZone) {
        this.displayZone = displayZone;
    }

    public String getViewUrlTemplate() {
        return viewUrlTemplate;
    }

    public String getCheckpointDir() {
        return checkpointDir;
    }

    public void setCheckpointDir(String checkpointDir) {
        this.checkpointDir = checkpointDir;
    }
}
