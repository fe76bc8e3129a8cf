package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.boundary.Boundaries;
import de.bsommerfeld.nestedsets.core.boundary.Shift;
import de.bsommerfeld.nestedsets.core.domain.TreeNode;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link TreeSession} over one open JDBC connection. Every
 * {@link SQLException} leaves through {@link SqlErrors#translate}.
 */
class SqlTreeSession<T> implements TreeSession<T> {

    private final Connection conn;
    private final TableMapping<T> mapping;
    private final boolean readOnly;

    SqlTreeSession(Connection conn, TableMapping<T> mapping, boolean readOnly) {
        this.conn = conn;
        this.mapping = mapping;
        this.readOnly = readOnly;
    }

    @Override
    public Optional<TreeNode<T>> findById(long id) {
        List<TreeNode<T>> rows = query("select-node", ps -> ps.setLong(1, id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public long highestBoundary() {
        return scalar("select-highest-boundary", ps -> {
        });
    }

    @Override
    public List<TreeNode<T>> findAncestors(Boundaries of) {
        return query("select-ancestors", bindRange(of));
    }

    @Override
    public int countAncestors(Boundaries of) {
        return (int) scalar("count-ancestors", bindRange(of));
    }

    @Override
    public List<TreeNode<T>> findDescendants(Boundaries of) {
        return query("select-descendants", bindRange(of));
    }

    @Override
    public List<TreeNode<T>> findRoots() {
        return query("select-roots", ps -> {
        });
    }

    @Override
    public List<TreeNode<T>> findAll() {
        return query("select-all-nodes", ps -> {
        });
    }

    @Override
    public TreeNode<T> insert(Boundaries at, T payload) {
        requireWritable();
        String sql = mapping.sql("insert-node");
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, at.left());
            ps.setLong(2, at.right());
            mapping.payloadMapper().bind(ps, 3, payload);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No key generated for new row in " + mapping.table());
                }
                return new TreeNode<>(keys.getLong(1), at.left(), at.right(), payload);
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Insert into " + mapping.table() + " failed", e);
        }
    }

    @Override
    public int applyShift(Shift shift) {
        if (shift.isNoop()) {
            return 0;
        }
        return update("shift-boundaries", ps -> {
            ps.setLong(1, shift.threshold());
            ps.setLong(2, shift.amount());
            ps.setLong(3, shift.amount());
            ps.setLong(4, shift.threshold());
        });
    }

    @Override
    public int deleteRange(Boundaries range) {
        return update("delete-range", bindRange(range));
    }

    @Override
    public int parkRange(Boundaries range) {
        return update("park-range", bindRange(range));
    }

    @Override
    public int restoreParked(long offset) {
        return update("restore-parked", ps -> {
            ps.setLong(1, offset);
            ps.setLong(2, offset);
        });
    }

    private static Binder bindRange(Boundaries range) {
        return ps -> {
            ps.setLong(1, range.left());
            ps.setLong(2, range.right());
        };
    }

    private List<TreeNode<T>> query(String statement, Binder binder) {
        List<TreeNode<T>> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(mapping.sql(statement))) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapNode(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Query " + statement + " on " + mapping.table() + " failed", e);
        }
        return result;
    }

    private long scalar(String statement, Binder binder) {
        try (PreparedStatement ps = conn.prepareStatement(mapping.sql(statement))) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Query " + statement + " on " + mapping.table() + " failed", e);
        }
    }

    private int update(String statement, Binder binder) {
        requireWritable();
        try (PreparedStatement ps = conn.prepareStatement(mapping.sql(statement))) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate("Update " + statement + " on " + mapping.table() + " failed", e);
        }
    }

    /** Maps a row to a {@link TreeNode}; payload columns go through the mapper. */
    private TreeNode<T> mapNode(ResultSet rs) throws SQLException {
        return new TreeNode<>(
                rs.getLong(mapping.idColumn()),
                rs.getLong(mapping.leftColumn()),
                rs.getLong(mapping.rightColumn()),
                mapping.payloadMapper().map(rs));
    }

    private void requireWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("Read snapshot on " + mapping.table() + " cannot write");
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
