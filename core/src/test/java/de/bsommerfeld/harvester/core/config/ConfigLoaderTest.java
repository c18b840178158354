package de.bsommerfeld.harvester.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults_shouldBeReasonable() {
        GlobalConfig config = new GlobalConfig();

        assertEquals("https://api.frame.io/v2", config.getClient().getBaseUrl());
        assertEquals(500, config.getClient().getRequestDelayMillis());
        assertEquals(3, config.getClient().getMaxRetries());
        assertEquals(5000, config.getClient().getBaseRetryDelayMillis());
        assertEquals(2.0, config.getClient().getBackoffMultiplier(), 0.0001);
        assertEquals(List.of("old", "archive"), config.getHarvest().getHistoricalMarkers());
        assertEquals(200, config.getHarvest().getFrameWidth(), 0.0001);
        assertEquals(112, config.getHarvest().getFrameHeight(), 0.0001);
        assertEquals(8, config.getHarvest().getPalette().size());
        assertFalse(config.getEndpoints().getFolderChildren().isEmpty());
    }

    @Test
    void parse_shouldOverrideOnlyGivenKeys() throws Exception {
        GlobalConfig config = ConfigLoader.parse("""
                [client]
                request-delay-millis = 250
                backoff-multiplier = 4.0

                [harvest]
                historical-markers = ["legacy"]
                chunk-size = 3
                """);

        assertEquals(250, config.getClient().getRequestDelayMillis());
        assertEquals(4.0, config.getClient().getBackoffMultiplier(), 0.0001);
        assertEquals(3, config.getClient().getMaxRetries());
        assertEquals(List.of("legacy"), config.getHarvest().getHistoricalMarkers());
        assertEquals(3, config.getHarvest().getChunkSize());
    }

    @Test
    void parse_shouldIgnoreUnknownKeys() throws Exception {
        GlobalConfig config = ConfigLoader.parse("""
                [client]
                removed-option = true
                max-retries = 5
                """);

        assertEquals(5, config.getClient().getMaxRetries());
    }

    @Test
    void parse_shouldReadEndpointOverrides() throws Exception {
        GlobalConfig config = ConfigLoader.parse("""
                [endpoints]
                folder-children = ["/v3/folders/{id}/children"]
                """);

        assertEquals(List.of("/v3/folders/{id}/children"), config.getEndpoints().getFolderChildren());
        assertFalse(config.getEndpoints().getAssetComments().isEmpty());
    }

    @Test
    void load_shouldUseDefaultsAndWriteTemplateWhenMissing() throws Exception {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = ConfigLoader.load(file);

        assertEquals(10, config.getHarvest().getChunkSize());
        assertTrue(Files.exists(file));
    }

    @Test
    void load_shouldReadExistingFile() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[harvest]\nmax-assets-per-run = 25\n");

        GlobalConfig config = ConfigLoader.load(file);

        assertEquals(25, config.getHarvest().getMaxAssetsPerRun());
    }
}
