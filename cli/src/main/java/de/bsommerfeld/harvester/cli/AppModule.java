package de.bsommerfeld.harvester.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.harvester.checkpoint.CheckpointStore;
import de.bsommerfeld.harvester.checkpoint.FileCheckpointStore;
import de.bsommerfeld.harvester.checkpoint.InMemoryCheckpointStore;
import de.bsommerfeld.harvester.core.config.ApplicationMode;
import de.bsommerfeld.harvester.core.config.ClientConfig;
import de.bsommerfeld.harvester.core.config.ConfigLoader;
import de.bsommerfeld.harvester.core.config.GlobalConfig;
import de.bsommerfeld.harvester.core.config.HarvestConfig;
import de.bsommerfeld.harvester.core.util.StorageUtils;
import de.bsommerfeld.harvester.frameio.EndpointProber;
import de.bsommerfeld.harvester.frameio.FrameioApi;
import de.bsommerfeld.harvester.frameio.RateLimitedClient;
import de.bsommerfeld.harvester.frameio.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Guice wiring for the command line harvester.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;
    private final String token;

    /**
     * @param configPath configuration file, {@code null} for the default in
     *                   the app data directory
     * @param token      API token used for every request of this process
     */
    public AppModule(Path configPath, String token) {
        this.configPath = configPath;
        this.token = token;
    }

    @Override
    protected void configure() {
        Path path = configPath != null ? configPath : StorageUtils.getConfigFile(StorageUtils.APP_NAME);
        LOG.debug("Configuration path: {}", path.toAbsolutePath());

        GlobalConfig config;
        try {
            config = ConfigLoader.load(path);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + path, e);
        }

        bind(GlobalConfig.class).toInstance(config);
        bind(ClientConfig.class).toInstance(config.getClient());
        bind(HarvestConfig.class).toInstance(config.getHarvest());
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Sleeper.class).toInstance(Sleeper.system());

        ApplicationMode mode = ApplicationMode.get();
        LOG.info("Application mode: {}", mode);

        if (mode.isTest()) {
            // No checkpoint files in TEST mode
            bind(CheckpointStore.class).to(InMemoryCheckpointStore.class);
        } else {
            bind(CheckpointStore.class).toInstance(new FileCheckpointStore(checkpointDir(config.getHarvest())));
        }
    }

    static Path checkpointDir(HarvestConfig harvest) {
        String configured = harvest.getCheckpointDir();
        if (configured == null || configured.isBlank())
            return StorageUtils.getCheckpointDir(StorageUtils.APP_NAME);
        return Path.of(configured);
    }

    @Provides
    @Singleton
    HttpClient httpClient(ClientConfig config) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.requestTimeout().toSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides
    @Singleton
    RateLimitedClient rateLimitedClient(HttpClient httpClient, ClientConfig config, Sleeper sleeper) {
        return new RateLimitedClient(httpClient, config, token, sleeper);
    }

    @Provides
    @Singleton
    FrameioApi frameioApi(RateLimitedClient client, GlobalConfig config) {
        EndpointProber prober = new EndpointProber(client, config.getClient().getBaseUrl());
        return new FrameioApi(client, prober, config.getEndpoints());
    }
}
