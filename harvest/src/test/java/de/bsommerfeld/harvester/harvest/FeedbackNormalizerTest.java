package de.bsommerfeld.harvester.harvest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.harvester.core.config.GlobalConfig;
import de.bsommerfeld.harvester.core.domain.AssetReport;
import de.bsommerfeld.harvester.core.domain.CommentEntry;
import de.bsommerfeld.harvester.core.domain.HarvestRequest;
import de.bsommerfeld.harvester.core.domain.Item;
import de.bsommerfeld.harvester.core.domain.ItemKind;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.FrameioApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FeedbackNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private FrameioApi api;
    private GlobalConfig config;
    private HarvestContext ctx;
    private Item asset;

    @BeforeEach
    void setUp() throws Exception {
        api = mock(FrameioApi.class);
        when(api.fetchPreviewUrl(anyString())).thenReturn(Optional.empty());
        config = new GlobalConfig();
        HarvestRequest request = new HarvestRequest("t", "p1", null, false, null);
        ctx = new HarvestContext("run", request, AssetFilter.of(request, config.getHarvest()));
        ctx.setRootFolderId("root");
        ctx.registerContainer(new Item("root", "Project", ItemKind.FOLDER, null));
        ctx.registerContainer(new Item("f1", "Edits", ItemKind.FOLDER, "root"));
        asset = new Item("a1", "Spot.mov", ItemKind.VIDEO, "f1");
    }

    private FeedbackNormalizer normalizer() {
        return new FeedbackNormalizer(api, new FolderPathResolver(api), config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void comments(String json) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        MAPPER.readTree(json).forEach(nodes::add);
        when(api.listComments("a1")).thenReturn(nodes);
    }

    @Test
    void normalize_shouldOrderCommentsAndAssignPaletteColors() throws Exception {
        comments("[{\"text\":\"second\",\"created_at\":\"2024-03-02T10:00:00Z\",\"author\":{\"name\":\"B\"}},"
                + "{\"text\":\"first\",\"created_at\":\"2024-03-01T10:00:00Z\",\"author\":{\"name\":\"A\"},"
                + "\"annotations\":[{\"type\":\"rect\",\"x\":0,\"y\":0,\"width\":20,\"height\":11.2}]}]");

        AssetReport report = normalizer().normalize(ctx, asset).orElseThrow();

        List<CommentEntry> entries = report.comments();
        assertEquals("first", entries.get(0).text());
        assertEquals("#FF6B6B", entries.get(0).colorTag());
        assertEquals("#FF6B6B", entries.get(0).annotations().get(0).color());
        assertEquals("second", entries.get(1).text());
        assertEquals("#4ECDC4", entries.get(1).colorTag());
        assertEquals("2024-03-01 10:00", entries.get(0).displayTimestamp());
        assertEquals("2024-03-01T10:00:00Z", entries.get(0).rawTimestamp());
    }

    @Test
    void normalize_shouldFillAssetMetadata() throws Exception {
        comments("[{\"text\":\"hi\",\"inserted_at\":\"2024-03-01T10:00:00Z\"}]");

        AssetReport report = normalizer().normalize(ctx, asset).orElseThrow();

        assertEquals("a1", report.assetId());
        assertEquals("video", report.kind());
        assertEquals("/Edits", report.folderPath());
        assertEquals("https://app.frame.io/presentation/p1?item=a1", report.viewUrl());
        assertEquals("Unknown User", report.comments().get(0).author());
    }

    @Test
    void normalize_shouldUseClockForMissingTimestamp() throws Exception {
        comments("[{\"text\":\"undated\"}]");

        CommentEntry entry = normalizer().normalize(ctx, asset).orElseThrow().comments().get(0);

        assertEquals(NOW.toString(), entry.rawTimestamp());
        assertEquals("2024-05-01 12:00", entry.displayTimestamp());
    }

    @Test
    void normalize_shouldConvertToDisplayZone() throws Exception {
        config.getHarvest().setDisplayZone("Europe/Berlin");
        comments("[{\"text\":\"x\",\"created_at\":\"2024-01-15T08:30:00Z\"}]");

        CommentEntry entry = normalizer().normalize(ctx, asset).orElseThrow().comments().get(0);

        assertEquals("2024-01-15 09:30", entry.displayTimestamp());
    }

    @Test
    void normalize_shouldSkipMalformedCommentsAndReturnEmptyWithoutFeedback() throws Exception {
        comments("[\"garbage\", 42]");

        assertTrue(normalizer().normalize(ctx, asset).isEmpty());
    }

    @Test
    void normalize_shouldPropagateCommentListingFailure() throws Exception {
        when(api.listComments("a1")).thenThrow(new FrameioApiException("down", 503));

        assertThrows(FrameioApiException.class, () -> normalizer().normalize(ctx, asset));
    }

    @Test
    void formatDisplay_shouldKeepUnparseableValues() {
        assertEquals("yesterday", normalizer().formatDisplay("yesterday"));
        assertEquals("2024-02-03 04:05", normalizer().formatDisplay("2024-02-03T04:05:06"));
    }
}
