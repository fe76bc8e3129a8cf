package de.bsommerfeld.nestedsets.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.nestedsets.core.config.ConfigurationLoader;
import de.bsommerfeld.nestedsets.core.config.DatabaseConfig;
import de.bsommerfeld.nestedsets.core.config.NestedSetConfig;
import de.bsommerfeld.nestedsets.core.config.TreeConfig;
import de.bsommerfeld.nestedsets.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for nested set trees. Loads {@code config.toml} (defaults to
 * the platform app-data directory), binds it with its sections, and binds the
 * SQLite {@link ConnectionProvider}. Inject {@link NestedSetTreeFactory} to
 * obtain trees.
 */
public class NestedSetModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(NestedSetModule.class);

    private final Path configPath;

    public NestedSetModule() {
        this(StorageUtils.getConfigFile());
    }

    public NestedSetModule(Path configPath) {
        this.configPath = configPath;
    }

    @Override
    protected void configure() {
        NestedSetConfig config;
        try {
            LOG.info("Loading Configuration from: {}", configPath.toAbsolutePath());
            config = ConfigurationLoader
                    .from(configPath)
                    .load(NestedSetConfig::new);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Failed to load nested set configuration", e);
        }

        bind(NestedSetConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(TreeConfig.class).toInstance(config.getTree());

        bind(ConnectionProvider.class).to(SqliteConnectionFactory.class);
    }
}
