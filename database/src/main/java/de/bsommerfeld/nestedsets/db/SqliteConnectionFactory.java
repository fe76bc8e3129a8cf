package de.bsommerfeld.nestedsets.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.nestedsets.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * SQLite {@link ConnectionProvider}.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per unit of work and closed right after.
 * SQLite serializes writers at the file level, so a pool adds nothing.
 *
 * <h3>Locking</h3>
 * Write connections use transaction mode {@code IMMEDIATE}: the reserved
 * lock is taken by {@code BEGIN}, before the first boundary is read. Two
 * inserts under the same parent therefore cannot plan against the same
 * numbering. A writer that cannot get the lock within the busy timeout fails
 * with {@code SQLITE_BUSY}. Read connections stay {@code DEFERRED}; in WAL
 * mode they read a snapshot without blocking the writer.
 */
@Singleton
public class SqliteConnectionFactory implements ConnectionProvider {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteConnectionFactory.class);
    private static final String PREFIX = "jdbc:sqlite:";

    private final String url;
    private final Properties writeProperties;
    private final Properties readProperties;

    @Inject
    public SqliteConnectionFactory(DatabaseConfig config) {
        this(config.getUrl(), config.getBusyTimeoutMillis(), config.isWal());
    }

    public SqliteConnectionFactory(String url, int busyTimeoutMillis, boolean wal) {
        this.url = url;
        this.writeProperties = properties(SQLiteConfig.TransactionMode.IMMEDIATE, busyTimeoutMillis, wal);
        this.readProperties = properties(SQLiteConfig.TransactionMode.DEFERRED, busyTimeoutMillis, wal);
        ensureParentDirectory(url);
        LOG.info("SQLite connections for {} (busy timeout {} ms, WAL {})", url, busyTimeoutMillis, wal);
    }

    @Override
    public Connection openForWrite() throws SQLException {
        return DriverManager.getConnection(url, writeProperties);
    }

    @Override
    public Connection openForRead() throws SQLException {
        return DriverManager.getConnection(url, readProperties);
    }

    private static Properties properties(SQLiteConfig.TransactionMode mode, int busyTimeoutMillis, boolean wal) {
        SQLiteConfig config = new SQLiteConfig();
        config.setTransactionMode(mode);
        config.setBusyTimeout(busyTimeoutMillis);
        if (wal) {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        return config.toProperties();
    }

    private static void ensureParentDirectory(String url) {
        if (!url.startsWith(PREFIX)) {
            return;
        }
        String file = url.substring(PREFIX.length());
        if (file.isEmpty() || file.startsWith(":memory:") || file.startsWith("file:")) {
            return;
        }
        Path parent = Paths.get(file).toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            LOG.error("Failed to create database directory {}", parent, e);
        }
    }
}
