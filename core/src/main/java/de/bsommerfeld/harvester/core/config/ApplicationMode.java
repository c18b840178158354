package de.bsommerfeld.harvester.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the harvester. {@link #TEST} keeps checkpoints in memory so
 * dry runs leave nothing on disk.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code harvester.mode} system property or the
     * {@code HARVESTER_MODE} environment variable. Defaults to PROD.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("harvester.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("HARVESTER_MODE");
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isEmpty()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown harvester mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
