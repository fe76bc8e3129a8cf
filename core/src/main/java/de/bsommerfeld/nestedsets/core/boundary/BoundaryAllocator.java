package de.bsommerfeld.nestedsets.core.boundary;

import de.bsommerfeld.nestedsets.core.error.BoundaryOverflowException;
import de.bsommerfeld.nestedsets.core.error.CycleRejectedException;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes where nodes go and how every other boundary has to move when the
 * forest changes shape. Pure arithmetic over boundary values read by the
 * caller; nothing here touches storage.
 *
 * <h3>Numbering</h3>
 * All roots share one counter: a new root starts right after the highest
 * boundary in use, so an empty forest yields {@code (1, 2)}. Every renumbering
 * is a {@link Shift} and every shift is applied to rows that were read in the
 * same transaction.
 *
 * <h3>Capacity</h3>
 * Boundaries are {@code long} values capped at a ceiling, by default
 * {@link #DEFAULT_CEILING} ({@code Integer.MAX_VALUE}) so the columns also fit
 * a 32-bit {@code INT}. The ceiling can be raised up to {@link #HARD_LIMIT}.
 * Each planning method takes the current highest boundary of the forest and
 * fails with {@link BoundaryOverflowException} before producing a plan that
 * would exceed the ceiling. Moves never change the highest boundary.
 */
public final class BoundaryAllocator {

    /** Largest ceiling accepted; leaves headroom so that shifts cannot wrap. */
    public static final long HARD_LIMIT = Long.MAX_VALUE / 2;
    public static final long DEFAULT_CEILING = Integer.MAX_VALUE;

    private final long ceiling;

    public BoundaryAllocator() {
        this(DEFAULT_CEILING);
    }

    public BoundaryAllocator(long ceiling) {
        if (ceiling < 2 || ceiling > HARD_LIMIT) {
            throw new IllegalArgumentException("Ceiling must be within [2, " + HARD_LIMIT + "]: " + ceiling);
        }
        this.ceiling = ceiling;
    }

    public long getCeiling() {
        return ceiling;
    }

    /**
     * Plans a new root after every existing tree.
     *
     * @param highestBoundary the largest {@code right} in the forest, 0 if empty
     */
    public InsertPlan planRoot(long highestBoundary) {
        ensureCapacity(highestBoundary, 2);
        long left = highestBoundary + 1;
        return new InsertPlan(List.of(new Boundaries(left, left + 1)), Shift.NONE);
    }

    /**
     * Plans a new last child: it takes {@code (parentRight, parentRight + 1)}
     * and everything from the parent's {@code right} onwards moves up by two.
     */
    public InsertPlan planInsertChild(long parentLeft, long parentRight, long highestBoundary) {
        requireNode(parentLeft, parentRight);
        return insertAt(parentRight, 1, highestBoundary);
    }

    /**
     * Plans {@code count} new last children in one go. They are laid out
     * consecutively and share a single shift of {@code 2 * count}.
     */
    public InsertPlan planInsertChildren(long parentLeft, long parentRight, int count, long highestBoundary) {
        requireNode(parentLeft, parentRight);
        if (count < 1) {
            throw new IllegalArgumentException("Child count must be positive: " + count);
        }
        return insertAt(parentRight, count, highestBoundary);
    }

    /** Plans a new first child at {@code (parentLeft + 1, parentLeft + 2)}. */
    public InsertPlan planInsertFirstChild(long parentLeft, long parentRight, long highestBoundary) {
        requireNode(parentLeft, parentRight);
        return insertAt(parentLeft + 1, 1, highestBoundary);
    }

    /** Plans a new node directly after the sibling whose right is {@code siblingRight}. */
    public InsertPlan planInsertSiblingAfter(long siblingRight, long highestBoundary) {
        return insertAt(siblingRight + 1, 1, highestBoundary);
    }

    /** Plans a new node directly before the sibling whose left is {@code siblingLeft}. */
    public InsertPlan planInsertSiblingBefore(long siblingLeft, long highestBoundary) {
        return insertAt(siblingLeft, 1, highestBoundary);
    }

    /**
     * Plans the removal of a node and its whole subtree. Rows inside
     * {@code [nodeLeft, nodeRight]} go away, everything beyond
     * {@code nodeRight} moves down by the subtree's width.
     */
    public DeletePlan planDelete(long nodeLeft, long nodeRight) {
        Boundaries removed = new Boundaries(nodeLeft, nodeRight);
        return new DeletePlan(removed, new Shift(nodeRight, -removed.width()));
    }

    /**
     * Plans moving a subtree to become the last child of a new parent.
     *
     * @throws CycleRejectedException if the new parent is the subtree's root
     *                                or one of its descendants
     */
    public MovePlan planMove(long subtreeLeft, long subtreeRight, long newParentLeft, long newParentRight) {
        return planMove(new Boundaries(subtreeLeft, subtreeRight),
                new Boundaries(newParentLeft, newParentRight), MovePosition.LAST_CHILD);
    }

    /**
     * Plans moving {@code subtree} relative to {@code target}.
     *
     * <p>
     * The insertion point {@code p} is taken in pre-move numbering. Once the
     * origin gap is closed, every boundary past the origin has dropped by the
     * subtree width {@code w}, so a point past the origin becomes
     * {@code p - w}. The gap is opened there and the parked subtree is
     * offset by {@code p' - subtreeLeft}.
     *
     * @throws CycleRejectedException if {@code target} lies inside
     *                                {@code subtree} (or is the subtree root)
     */
    public MovePlan planMove(Boundaries subtree, Boundaries target, MovePosition position) {
        if (subtree.containsOrEquals(target)) {
            throw new CycleRejectedException("Cannot move " + subtree + " " + describe(position)
                    + " " + target + ": the target lies inside the moved subtree");
        }
        long width = subtree.width();
        long point = position.insertionPoint(target);
        long landing = point > subtree.right() ? point - width : point;

        Shift closeGap = new Shift(subtree.right(), -width);
        Shift openGap = new Shift(landing - 1, width);
        return new MovePlan(subtree, closeGap, openGap, landing - subtree.left());
    }

    private InsertPlan insertAt(long position, int count, long highestBoundary) {
        long space = 2L * count;
        ensureCapacity(highestBoundary, space);

        List<Boundaries> nodes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long left = position + 2L * i;
            nodes.add(new Boundaries(left, left + 1));
        }
        return new InsertPlan(nodes, new Shift(position - 1, space));
    }

    private void ensureCapacity(long highestBoundary, long space) {
        if (highestBoundary < 0) {
            throw new IllegalArgumentException("Highest boundary cannot be negative: " + highestBoundary);
        }
        if (highestBoundary > ceiling - space) {
            throw new BoundaryOverflowException(highestBoundary + space, ceiling);
        }
    }

    private static void requireNode(long left, long right) {
        new Boundaries(left, right);
    }

    private static String describe(MovePosition position) {
        return switch (position) {
            case LAST_CHILD, FIRST_CHILD -> "into";
            case BEFORE -> "before";
            case AFTER -> "after";
        };
    }
}
