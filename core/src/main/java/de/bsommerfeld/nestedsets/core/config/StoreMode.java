package de.bsommerfeld.nestedsets.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Which storage backs a tree. {@code SQL} persists through JDBC, {@code MEMORY}
 * keeps rows on the heap and forgets them on shutdown.
 */
public enum StoreMode {

    SQL,
    MEMORY;

    private static final Logger LOG = LoggerFactory.getLogger(StoreMode.class);

    /**
     * Resolves the effective mode. The system property
     * {@code nestedsets.store} wins over the environment variable
     * {@code NESTEDSETS_STORE}, which wins over {@code configured}. Unknown
     * values fall back to {@code configured}.
     */
    public static StoreMode resolve(StoreMode configured) {
        String mode = System.getProperty("nestedsets.store");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("NESTEDSETS_STORE");
        }

        if (mode == null || mode.isEmpty()) {
            return configured;
        }

        try {
            return StoreMode.valueOf(mode.toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown store mode '{}'. Using {}.", mode, configured);
            return configured;
        }
    }

    public boolean isMemory() {
        return this == MEMORY;
    }
}
