package de.bsommerfeld.nestedsets.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections for {@link SqlNestedSetStore}. Callers close what
 * they open.
 */
public interface ConnectionProvider {

    /**
     * A connection whose transactions take the write lock when they begin,
     * so boundaries read inside them cannot change underneath.
     */
    Connection openForWrite() throws SQLException;

    /** A connection for snapshot reads that never blocks writers. */
    Connection openForRead() throws SQLException;
}
