package de.bsommerfeld.nestedsets.db;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.google.inject.Singleton;
import de.bsommerfeld.nestedsets.core.boundary.BoundaryAllocator;
import de.bsommerfeld.nestedsets.core.config.NestedSetConfig;
import de.bsommerfeld.nestedsets.core.config.StoreMode;
import de.bsommerfeld.nestedsets.core.event.TreeEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link NestedSetTree}s for caller-supplied table mappings. The store
 * behind each tree follows {@link StoreMode#resolve}: {@code SQL} uses the
 * shared {@link ConnectionProvider}, {@code MEMORY} creates a fresh
 * {@link InMemoryNestedSetStore} per call.
 *
 * <p>
 * The connection provider is resolved lazily, so {@code MEMORY} mode never
 * touches the database file.
 */
@Singleton
public class NestedSetTreeFactory {

    private static final Logger LOG = LoggerFactory.getLogger(NestedSetTreeFactory.class);

    private final NestedSetConfig config;
    private final Provider<ConnectionProvider> connections;
    private final TreeEventBus events;

    @Inject
    public NestedSetTreeFactory(NestedSetConfig config, Provider<ConnectionProvider> connections,
            TreeEventBus events) {
        this.config = config;
        this.connections = connections;
        this.events = events;
    }

    public <T> NestedSetTree<T> create(TableMapping<T> mapping) {
        StoreMode mode = StoreMode.resolve(config.getStoreMode());
        BoundaryAllocator allocator = new BoundaryAllocator(config.getTree().getMaxBoundary());

        NestedSetStore<T> store;
        if (mode.isMemory()) {
            LOG.warn("Store mode MEMORY: tree {} will not be persisted.", mapping.table());
            store = new InMemoryNestedSetStore<>(mapping.table(), config.getDatabase().getBusyTimeoutMillis());
        } else {
            SqlNestedSetStore<T> sqlStore = new SqlNestedSetStore<>(connections.get(), mapping);
            if (config.getTree().isCreateTable()) {
                sqlStore.createTable();
            }
            store = sqlStore;
        }
        LOG.info("Tree {} ready ({} store, max boundary {})", mapping.table(), mode, allocator.getCeiling());
        return new NestedSetTree<>(store, allocator, events);
    }
}
