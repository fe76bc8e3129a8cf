package de.bsommerfeld.nestedsets.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Every value has a default, so a missing file or
 * missing keys still yield a usable configuration.
 *
 * <pre>
 * store-mode = 'SQL'
 *
 * [database]
 * url = 'jdbc:sqlite:/path/to/nested-sets.db'
 * busy-timeout-millis = 5000
 * wal = true
 *
 * [tree]
 * max-boundary = 2147483647
 * create-table = true
 * </pre>
 */
public class NestedSetConfig {

    @JsonProperty("store-mode")
    private StoreMode storeMode = StoreMode.SQL;

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("tree")
    private TreeConfig tree = new TreeConfig();

    public StoreMode getStoreMode() {
        return storeMode;
    }

    public void setStoreMode(StoreMode storeMode) {
        this.storeMode = storeMode;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public TreeConfig getTree() {
        return tree;
    }
}
