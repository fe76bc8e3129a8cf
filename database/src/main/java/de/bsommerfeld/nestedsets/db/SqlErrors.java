package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.error.ConcurrencyConflictException;
import de.bsommerfeld.nestedsets.core.error.NestedSetException;
import de.bsommerfeld.nestedsets.core.error.StorageException;

import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Maps JDBC failures onto the tree's error kinds.
 *
 * <p>
 * Retryable conflicts are SQLite's {@code SQLITE_BUSY} (5) and
 * {@code SQLITE_LOCKED} (6), extended result codes included, plus the
 * standard SQLState class {@code 40} (transaction rollback: serialization
 * failure {@code 40001}, deadlock {@code 40P01}) that other drivers report.
 * Result codes are only read from {@link SQLiteException}s; other drivers'
 * vendor codes mean something else entirely.
 */
final class SqlErrors {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private SqlErrors() {
    }

    static NestedSetException translate(String message, SQLException e) {
        if (isConflict(e)) {
            return new ConcurrencyConflictException(message + ": " + e.getMessage(), e);
        }
        return new StorageException(message, e);
    }

    static boolean isConflict(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (current instanceof SQLiteException) {
                // low byte is the primary result code
                int primary = current.getErrorCode() & 0xFF;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            String state = current.getSQLState();
            if (state != null && state.startsWith("40")) {
                return true;
            }
        }
        return false;
    }
}
