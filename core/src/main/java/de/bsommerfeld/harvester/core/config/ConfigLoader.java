package de.bsommerfeld.harvester.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@code config.toml} into a {@link GlobalConfig}.
 *
 * <p>
 * A missing file is not an error: defaults are used and written to the given
 * path so the user has a template to edit. Unknown keys are ignored, which
 * keeps older config files loadable after keys are removed.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static GlobalConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
            GlobalConfig defaults = new GlobalConfig();
            writeDefaults(path, defaults);
            return defaults;
        }
        LOG.info("Loading configuration from {}", path.toAbsolutePath());
        return MAPPER.readValue(path.toFile(), GlobalConfig.class);
    }

    /**
     * Parses configuration from TOML text. Used for tests and embedded setups.
     */
    public static GlobalConfig parse(String toml) throws IOException {
        return MAPPER.readValue(toml, GlobalConfig.class);
    }

    private static void writeDefaults(Path path, GlobalConfig defaults) {
        try {
            if (path.getParent() != null)
                Files.createDirectories(path.getParent());
            MAPPER.writeValue(path.toFile(), defaults);
        } catch (IOException e) {
            // Defaults are already in memory; an unwritable template is not fatal
            LOG.warn("Could not write default configuration to {}: {}", path, e.getMessage());
        }
    }
}
