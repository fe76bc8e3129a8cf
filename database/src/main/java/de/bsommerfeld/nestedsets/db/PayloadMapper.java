package de.bsommerfeld.nestedsets.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Converts the caller's record type to and from its table columns. The
 * boundary and id columns are handled by the store; a mapper only sees its
 * own columns.
 *
 * @param <T> the caller's record type
 */
public interface PayloadMapper<T> {

    /** The record's columns, in the order {@link #bind} fills them. */
    List<PayloadColumn> columns();

    /**
     * Binds {@code payload} to consecutive parameters starting at
     * {@code firstIndex}, one per entry of {@link #columns()}.
     */
    void bind(PreparedStatement statement, int firstIndex, T payload) throws SQLException;

    /** Reads the record from the current row. Columns are addressed by name. */
    T map(ResultSet row) throws SQLException;
}
