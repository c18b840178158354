package de.bsommerfeld.harvester.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.harvester.checkpoint.CheckpointStore;
import de.bsommerfeld.harvester.checkpoint.InMemoryCheckpointStore;
import de.bsommerfeld.harvester.core.config.GlobalConfig;
import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.harvest.HarvestService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppModuleTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void resetMode() {
        System.clearProperty("harvester.mode");
    }

    @Test
    void injector_shouldWireHarvestServiceInTestMode() throws Exception {
        System.setProperty("harvester.mode", "TEST");
        Path config = tempDir.resolve("config.toml");
        Files.writeString(config, """
                [harvest]
                chunk-size = 4
                """);

        Injector injector = Guice.createInjector(new AppModule(config, "token"));

        assertNotNull(injector.getInstance(HarvestService.class));
        assertNotNull(injector.getInstance(FrameioApi.class));
        assertInstanceOf(InMemoryCheckpointStore.class, injector.getInstance(CheckpointStore.class));
        assertEquals(4, injector.getInstance(GlobalConfig.class).getHarvest().getChunkSize());
        assertSame(injector.getInstance(HarvestService.class), injector.getInstance(HarvestService.class));
    }

    @Test
    void injector_shouldWriteDefaultConfigWhenMissing() {
        System.setProperty("harvester.mode", "TEST");
        Path config = tempDir.resolve("nested/config.toml");

        Guice.createInjector(new AppModule(config, "token"));

        assertTrue(Files.exists(config));
    }

    @Test
    void checkpointDir_shouldHonorConfiguredDirectory() {
        HarvestConfig harvest = new HarvestConfig();
        harvest.setCheckpointDir(tempDir.toString());

        assertEquals(tempDir, AppModule.checkpointDir(harvest));
    }

    @Test
    void checkpointDir_shouldDefaultToAppData() {
        assertTrue(AppModule.checkpointDir(new HarvestConfig()).endsWith("checkpoints"));
    }
}
