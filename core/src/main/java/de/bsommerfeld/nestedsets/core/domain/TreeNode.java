package de.bsommerfeld.nestedsets.core.domain;

import de.bsommerfeld.nestedsets.core.boundary.Boundaries;

import java.util.Objects;

/**
 * Snapshot of one stored node: its storage-assigned id, its boundaries at the
 * time it was read, and the caller's own record.
 *
 * <p>
 * A {@code TreeNode} is a handle, not a live view. Any structural change may
 * renumber the stored row, so tree operations only take the {@link #id()}
 * from a handle and re-read the rest.
 *
 * @param <T> the caller's record type
 */
public record TreeNode<T>(long id, long left, long right, T payload) {

    public TreeNode {
        Objects.requireNonNull(payload, "payload");
    }

    public Boundaries boundaries() {
        return new Boundaries(left, right);
    }

    /** Number of nodes below this one, derived from the width identity. */
    public long descendantCount() {
        return (right - left - 1) / 2;
    }

    public boolean isLeaf() {
        return right == left + 1;
    }

    public boolean isAncestorOf(TreeNode<?> other) {
        return isAncestorOf(other, false);
    }

    /**
     * Interval containment test. With {@code inclusive} a node counts as its
     * own ancestor.
     */
    public boolean isAncestorOf(TreeNode<?> other, boolean inclusive) {
        if (inclusive) {
            return left <= other.left && other.right <= right;
        }
        return left < other.left && other.right < right;
    }

    public boolean isDescendantOf(TreeNode<?> other) {
        return other.isAncestorOf(this, false);
    }

    public boolean isDescendantOf(TreeNode<?> other, boolean inclusive) {
        return other.isAncestorOf(this, inclusive);
    }

    public TreeNode<T> withBoundaries(Boundaries boundaries) {
        return new TreeNode<>(id, boundaries.left(), boundaries.right(), payload);
    }

    @Override
    public String toString() {
        return "TreeNode(" + id + ", " + left + ", " + right + ", " + payload + ")";
    }
}
