package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.error.NestedSetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * JDBC-backed {@link NestedSetStore}.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} templates rendered for the store's
 * {@link TableMapping}. {@link #createTable()} applies {@code schema.sql},
 * which only uses {@code IF NOT EXISTS} and is safe to re-run; callers that
 * manage their own schema simply skip it.
 *
 * <h3>Transaction boundaries</h3>
 * Every unit of work runs on its own connection with auto-commit off. The
 * work commits when it returns normally; any exception, from the work or
 * from the commit itself, rolls back before it propagates. A failed
 * rollback is attached to the original exception as suppressed.
 *
 * @see SqliteConnectionFactory
 */
public class SqlNestedSetStore<T> implements NestedSetStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SqlNestedSetStore.class);

    private final ConnectionProvider connections;
    private final TableMapping<T> mapping;

    public SqlNestedSetStore(ConnectionProvider connections, TableMapping<T> mapping) {
        this.connections = connections;
        this.mapping = mapping;
    }

    @Override
    public String name() {
        return mapping.table();
    }

    /**
     * Creates the table and its boundary indexes if missing. Splits the
     * rendered schema on statement-terminating semicolons and runs all of it
     * in one transaction.
     */
    public void createTable() {
        try (Connection conn = connections.openForWrite()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : mapping.sql("schema").split(";\\s*(\\r?\\n|$)")) {
                    if (!sql.trim().isEmpty()) {
                        stmt.execute(sql.trim());
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.info("Schema for {} applied.", mapping.table());
        } catch (SQLException e) {
            throw SqlErrors.translate("Schema application failed for " + mapping.table(), e);
        }
    }

    @Override
    public <R> R inTransaction(TransactionWork<T, R> work) {
        try (Connection conn = connections.openForWrite()) {
            conn.setAutoCommit(false);
            return runAndCommit(conn, work, false);
        } catch (SQLException e) {
            throw SqlErrors.translate("Could not open a write transaction on " + mapping.table(), e);
        }
    }

    @Override
    public <R> R readSnapshot(TransactionWork<T, R> work) {
        try (Connection conn = connections.openForRead()) {
            conn.setAutoCommit(false);
            return runAndCommit(conn, work, true);
        } catch (SQLException e) {
            throw SqlErrors.translate("Could not open a read transaction on " + mapping.table(), e);
        }
    }

    private <R> R runAndCommit(Connection conn, TransactionWork<T, R> work, boolean readOnly) {
        try {
            R result = work.execute(new SqlTreeSession<>(conn, mapping, readOnly));
            conn.commit();
            return result;
        } catch (SQLException e) {
            NestedSetException translated = SqlErrors.translate("Commit failed on " + mapping.table(), e);
            rollback(conn, translated);
            throw translated;
        } catch (RuntimeException e) {
            rollback(conn, e);
            throw e;
        }
    }

    private void rollback(Connection conn, RuntimeException cause) {
        try {
            conn.rollback();
            LOG.debug("Rolled back transaction on {}: {}", mapping.table(), cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
