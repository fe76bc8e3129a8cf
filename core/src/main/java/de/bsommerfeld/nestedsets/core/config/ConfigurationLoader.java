package de.bsommerfeld.nestedsets.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads a configuration POJO from a TOML file.
 *
 * <pre>
 * NestedSetConfig config = ConfigurationLoader
 *         .from(configPath)
 *         .load(NestedSetConfig::new);
 * </pre>
 *
 * If the file does not exist, the defaults from the supplier are returned and
 * written to the path, so users find a complete file to edit. Keys missing
 * from an existing file keep their defaults; unknown keys are ignored.
 */
public final class ConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final Path path;
    private final TomlMapper mapper;
    private boolean writeDefaults = true;

    private ConfigurationLoader(Path path) {
        this.path = path;
        this.mapper = TomlMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ConfigurationLoader from(Path path) {
        return new ConfigurationLoader(path);
    }

    /** Skips writing the defaults file when {@code path} does not exist. */
    public ConfigurationLoader withoutDefaultsFile() {
        this.writeDefaults = false;
        return this;
    }

    public <C> C load(Supplier<C> defaults) {
        C config = defaults.get();
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults.", path.toAbsolutePath());
            if (writeDefaults) {
                save(config);
            }
            return config;
        }

        try {
            C loaded = mapper.readerForUpdating(config).readValue(path.toFile());
            LOG.info("Configuration loaded from {}", path.toAbsolutePath());
            return loaded;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration: " + path, e);
        }
    }

    public void save(Object config) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), config);
            LOG.debug("Configuration written to {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration: " + path, e);
        }
    }
}
