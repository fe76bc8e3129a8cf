package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.boundary.Boundaries;
import de.bsommerfeld.nestedsets.core.boundary.Shift;
import de.bsommerfeld.nestedsets.core.domain.TreeNode;

import java.util.List;
import java.util.Optional;

/**
 * Row-level access inside one transaction. Lists are ordered by
 * {@code left} ascending. Write methods return the number of affected rows
 * and fail with {@link UnsupportedOperationException} in a read snapshot.
 */
public interface TreeSession<T> {

    Optional<TreeNode<T>> findById(long id);

    /** Largest {@code right} in the table, 0 when it is empty. */
    long highestBoundary();

    /** Rows with {@code left < of.left AND right > of.right}. */
    List<TreeNode<T>> findAncestors(Boundaries of);

    int countAncestors(Boundaries of);

    /** Rows with {@code left > of.left AND right < of.right}. */
    List<TreeNode<T>> findDescendants(Boundaries of);

    /** Rows not contained in any other row. */
    List<TreeNode<T>> findRoots();

    List<TreeNode<T>> findAll();

    /** Writes a new row and returns it with its assigned id. */
    TreeNode<T> insert(Boundaries at, T payload);

    int applyShift(Shift shift);

    /** Deletes every row inside {@code [range.left, range.right]}. */
    int deleteRange(Boundaries range);

    /**
     * Negates the boundaries of every row inside {@code range}, which takes
     * them out of reach of {@link #applyShift}.
     */
    int parkRange(Boundaries range);

    /** Turns parked rows back into {@code -boundary + offset}. */
    int restoreParked(long offset);
}
