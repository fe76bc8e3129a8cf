package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.boundary.BoundaryAllocator;
import de.bsommerfeld.nestedsets.core.boundary.DeletePlan;
import de.bsommerfeld.nestedsets.core.boundary.InsertPlan;
import de.bsommerfeld.nestedsets.core.boundary.MovePlan;
import de.bsommerfeld.nestedsets.core.boundary.MovePosition;
import de.bsommerfeld.nestedsets.core.domain.NodeTree;
import de.bsommerfeld.nestedsets.core.domain.TreeNode;
import de.bsommerfeld.nestedsets.core.error.ConcurrencyConflictException;
import de.bsommerfeld.nestedsets.core.error.InvalidStateException;
import de.bsommerfeld.nestedsets.core.error.NestedSetException;
import de.bsommerfeld.nestedsets.core.error.NodeNotFoundException;
import de.bsommerfeld.nestedsets.core.error.StorageException;
import de.bsommerfeld.nestedsets.core.event.TreeEventBus;
import de.bsommerfeld.nestedsets.core.event.TreeEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Node-level operations on one nested set table. This is the single entry
 * point for callers; nobody else reads or writes boundary columns.
 *
 * <h3>Mutations</h3>
 * Every structural change runs as one {@link NestedSetStore#inTransaction}
 * unit: re-read the involved rows by id, let the {@link BoundaryAllocator}
 * plan the renumbering, apply the shifts and the row write or delete,
 * commit. Any failure rolls the whole unit back. Once committed, a
 * {@link TreeEvents} record is posted on the {@link TreeEventBus}.
 *
 * <h3>Handles</h3>
 * {@link TreeNode} arguments are only used for their id. Boundaries are
 * never cached between calls, so passing an outdated handle is fine; passing
 * the handle of a deleted node fails with {@link NodeNotFoundException}.
 *
 * <h3>Ordering</h3>
 * {@link #addChild} appends after existing children, {@link #addFirstChild}
 * prepends. {@link #addSibling} inserts after its reference node,
 * {@link #addSiblingBefore} before it. A sibling of a root is itself a root.
 *
 * @param <T> the caller's record type
 */
public class NestedSetTree<T> {

    private static final Logger LOG = LoggerFactory.getLogger(NestedSetTree.class);
    private static final String INDENT = "    ";

    private final NestedSetStore<T> store;
    private final BoundaryAllocator allocator;
    private final TreeEventBus events;

    public NestedSetTree(NestedSetStore<T> store, BoundaryAllocator allocator, TreeEventBus events) {
        this.store = store;
        this.allocator = allocator;
        this.events = events;
    }

    public String name() {
        return store.name();
    }

    // =====================================================================
    // Insertion
    // =====================================================================

    /** Creates a single-node tree after all existing trees. */
    public TreeNode<T> createRoot(T payload) {
        return mutate("createRoot", session -> {
            InsertPlan plan = allocator.planRoot(session.highestBoundary());
            return inserted(insert(session, plan, List.of(payload)).get(0));
        });
    }

    /** Appends a new node as the last child of {@code parent}. */
    public TreeNode<T> addChild(TreeNode<T> parent, T payload) {
        return mutate("addChild", session -> {
            TreeNode<T> current = require(session, parent.id());
            InsertPlan plan = allocator.planInsertChild(current.left(), current.right(),
                    session.highestBoundary());
            return inserted(insert(session, plan, List.of(payload)).get(0));
        });
    }

    /** Prepends a new node as the first child of {@code parent}. */
    public TreeNode<T> addFirstChild(TreeNode<T> parent, T payload) {
        return mutate("addFirstChild", session -> {
            TreeNode<T> current = require(session, parent.id());
            InsertPlan plan = allocator.planInsertFirstChild(current.left(), current.right(),
                    session.highestBoundary());
            return inserted(insert(session, plan, List.of(payload)).get(0));
        });
    }

    /**
     * Appends all {@code payloads} as last children of {@code parent}, in
     * list order, with a single shift.
     */
    public List<TreeNode<T>> addChildren(TreeNode<T> parent, List<T> payloads) {
        if (payloads.isEmpty()) {
            throw new IllegalArgumentException("No children to add");
        }
        return mutate("addChildren", session -> {
            TreeNode<T> current = require(session, parent.id());
            InsertPlan plan = allocator.planInsertChildren(current.left(), current.right(),
                    payloads.size(), session.highestBoundary());
            List<TreeNode<T>> created = insert(session, plan, payloads);
            return new Mutation<>(created, new TreeEvents.NodesInserted(name(), ids(created)));
        });
    }

    /** Inserts a new node directly after {@code node}. */
    public TreeNode<T> addSibling(TreeNode<T> node, T payload) {
        return mutate("addSibling", session -> {
            TreeNode<T> current = require(session, node.id());
            InsertPlan plan = allocator.planInsertSiblingAfter(current.right(), session.highestBoundary());
            return inserted(insert(session, plan, List.of(payload)).get(0));
        });
    }

    /** Inserts a new node directly before {@code node}. */
    public TreeNode<T> addSiblingBefore(TreeNode<T> node, T payload) {
        return mutate("addSiblingBefore", session -> {
            TreeNode<T> current = require(session, node.id());
            InsertPlan plan = allocator.planInsertSiblingBefore(current.left(), session.highestBoundary());
            return inserted(insert(session, plan, List.of(payload)).get(0));
        });
    }

    private List<TreeNode<T>> insert(TreeSession<T> session, InsertPlan plan, List<T> payloads) {
        session.applyShift(plan.shift());
        List<TreeNode<T>> created = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            created.add(session.insert(plan.nodes().get(i), payloads.get(i)));
        }
        LOG.debug("[{}] Inserted {} node(s) at {} after {}", name(), created.size(), plan.first(), plan.shift());
        return created;
    }

    private Mutation<TreeNode<T>> inserted(TreeNode<T> node) {
        return new Mutation<>(node, new TreeEvents.NodesInserted(name(), List.of(node.id())));
    }

    // =====================================================================
    // Deletion
    // =====================================================================

    /**
     * Removes {@code node} and all its descendants, then closes the gap.
     *
     * @return the removed nodes in pre-order, {@code node} first, with the
     *         boundaries they had before the removal
     */
    public List<TreeNode<T>> deleteSubtree(TreeNode<T> node) {
        return mutate("deleteSubtree", session -> {
            TreeNode<T> current = require(session, node.id());
            DeletePlan plan = allocator.planDelete(current.left(), current.right());

            List<TreeNode<T>> removed = new ArrayList<>();
            removed.add(current);
            removed.addAll(session.findDescendants(plan.removed()));

            int deleted = session.deleteRange(plan.removed());
            if (deleted != plan.removedNodes() || deleted != removed.size()) {
                throw new InvalidStateException("Subtree " + plan.removed() + " of node " + current.id()
                        + " holds " + deleted + " rows, expected " + plan.removedNodes());
            }
            session.applyShift(plan.shift());
            LOG.debug("[{}] Deleted {} node(s) in {} then applied {}", name(), deleted, plan.removed(),
                    plan.shift());
            return new Mutation<>(removed,
                    new TreeEvents.SubtreeDeleted(name(), current.id(), plan.removed(), ids(removed)));
        });
    }

    // =====================================================================
    // Movement
    // =====================================================================

    /** Moves {@code node} with its subtree to become the last child of {@code newParent}. */
    public TreeNode<T> moveSubtree(TreeNode<T> node, TreeNode<T> newParent) {
        return move("moveSubtree", node, newParent, MovePosition.LAST_CHILD);
    }

    /** Moves {@code node} with its subtree to become the first child of {@code newParent}. */
    public TreeNode<T> moveToFirstChild(TreeNode<T> node, TreeNode<T> newParent) {
        return move("moveToFirstChild", node, newParent, MovePosition.FIRST_CHILD);
    }

    /** Moves {@code node} with its subtree to sit directly before {@code target}. */
    public TreeNode<T> moveBefore(TreeNode<T> node, TreeNode<T> target) {
        return move("moveBefore", node, target, MovePosition.BEFORE);
    }

    /** Moves {@code node} with its subtree to sit directly after {@code target}. */
    public TreeNode<T> moveAfter(TreeNode<T> node, TreeNode<T> target) {
        return move("moveAfter", node, target, MovePosition.AFTER);
    }

    private TreeNode<T> move(String operation, TreeNode<T> node, TreeNode<T> target, MovePosition position) {
        return mutate(operation, session -> {
            TreeNode<T> current = require(session, node.id());
            TreeNode<T> anchor = require(session, target.id());
            MovePlan plan = allocator.planMove(current.boundaries(), anchor.boundaries(), position);

            if (!plan.isNoop()) {
                int parked = session.parkRange(plan.origin());
                if (parked != plan.origin().width() / 2) {
                    throw new InvalidStateException("Subtree " + plan.origin() + " of node " + current.id()
                            + " holds " + parked + " rows, expected " + plan.origin().width() / 2);
                }
                session.applyShift(plan.closeGap());
                session.applyShift(plan.openGap());
                session.restoreParked(plan.offset());
            }
            LOG.debug("[{}] Moved node {} from {} to {}", name(), current.id(), plan.origin(),
                    plan.destination());
            return new Mutation<>(current.withBoundaries(plan.destination()),
                    new TreeEvents.SubtreeMoved(name(), current.id(), plan.origin(), plan.destination()));
        });
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /** Returns the current state of the node with {@code id}. */
    public TreeNode<T> find(long id) {
        return read(session -> require(session, id));
    }

    /** Re-reads {@code node}, picking up boundaries changed since it was obtained. */
    public TreeNode<T> refresh(TreeNode<T> node) {
        return find(node.id());
    }

    /** Ancestors from the root down to the parent. */
    public List<TreeNode<T>> ancestorsOf(TreeNode<T> node) {
        return read(session -> session.findAncestors(require(session, node.id()).boundaries()));
    }

    /** Descendants in pre-order. */
    public List<TreeNode<T>> descendantsOf(TreeNode<T> node) {
        return read(session -> session.findDescendants(require(session, node.id()).boundaries()));
    }

    /**
     * Immediate children, left to right. Walks the pre-ordered descendants
     * and skips each child's subtree: the next child starts right after the
     * previous child's {@code right}.
     */
    public List<TreeNode<T>> childrenOf(TreeNode<T> node) {
        return read(session -> {
            TreeNode<T> current = require(session, node.id());
            List<TreeNode<T>> children = new ArrayList<>();
            long next = current.left() + 1;
            for (TreeNode<T> descendant : session.findDescendants(current.boundaries())) {
                if (descendant.left() == next) {
                    children.add(descendant);
                    next = descendant.right() + 1;
                }
            }
            return children;
        });
    }

    /** The nearest ancestor, empty for a root. */
    public Optional<TreeNode<T>> parentOf(TreeNode<T> node) {
        List<TreeNode<T>> ancestors = ancestorsOf(node);
        return ancestors.isEmpty() ? Optional.empty() : Optional.of(ancestors.get(ancestors.size() - 1));
    }

    /** Number of ancestors; 0 for a root. */
    public int depthOf(TreeNode<T> node) {
        return read(session -> session.countAncestors(require(session, node.id()).boundaries()));
    }

    public List<TreeNode<T>> roots() {
        return read(TreeSession::findRoots);
    }

    /** Compares the current boundaries of both nodes. */
    public boolean isAncestorOf(TreeNode<T> ancestor, TreeNode<T> node) {
        return read(session -> require(session, ancestor.id()).isAncestorOf(require(session, node.id())));
    }

    /** Materializes the subtree below {@code node} with one range read. */
    public NodeTree<T> buildTree(TreeNode<T> node) {
        return read(session -> {
            TreeNode<T> current = require(session, node.id());
            return NodeTree.assemble(current, session.findDescendants(current.boundaries()));
        });
    }

    /** Materializes every tree of the forest, roots left to right. */
    public List<NodeTree<T>> buildForest() {
        return read(session -> {
            List<NodeTree<T>> forest = new ArrayList<>();
            List<TreeNode<T>> all = session.findAll();
            int index = 0;
            while (index < all.size()) {
                TreeNode<T> root = all.get(index);
                int end = index + 1;
                while (end < all.size() && all.get(end).left() < root.right()) {
                    end++;
                }
                forest.add(NodeTree.assemble(root, all.subList(index + 1, end)));
                index = end;
            }
            return forest;
        });
    }

    /**
     * Renders the whole forest as text, one node per line in pre-order,
     * indented by depth.
     */
    public List<String> render() {
        return read(session -> {
            List<String> lines = new ArrayList<>();
            Deque<Long> openRights = new ArrayDeque<>();
            for (TreeNode<T> row : session.findAll()) {
                while (!openRights.isEmpty() && openRights.peek() < row.left()) {
                    openRights.pop();
                }
                lines.add(INDENT.repeat(openRights.size()) + row);
                openRights.push(row.right());
            }
            return lines;
        });
    }

    /**
     * Checks every stored row against the nested set invariants: boundaries
     * are exactly {@code 1..2n} without duplicates, intervals never partially
     * overlap, and each width equals twice the subtree's node count.
     *
     * @return the number of rows checked
     * @throws InvalidStateException on the first violation found
     */
    public int verifyIntegrity() {
        return read(session -> {
            List<TreeNode<T>> all = session.findAll();
            long[] values = new long[all.size() * 2];
            long[] lefts = new long[all.size()];
            for (int i = 0; i < all.size(); i++) {
                TreeNode<T> row = all.get(i);
                if (row.left() >= row.right()) {
                    throw new InvalidStateException("Row " + row.id() + " has left >= right: " + row);
                }
                values[2 * i] = row.left();
                values[2 * i + 1] = row.right();
                lefts[i] = row.left();
            }
            Arrays.sort(values);
            for (int i = 0; i < values.length; i++) {
                if (values[i] != i + 1) {
                    throw new InvalidStateException("Boundary values are not 1.." + values.length
                            + " without gaps or duplicates; position " + (i + 1) + " holds " + values[i]);
                }
            }

            Deque<TreeNode<T>> open = new ArrayDeque<>();
            for (TreeNode<T> row : all) {
                while (!open.isEmpty() && open.peek().right() < row.left()) {
                    open.pop();
                }
                if (!open.isEmpty() && row.right() > open.peek().right()) {
                    throw new InvalidStateException(row + " partially overlaps " + open.peek());
                }
                open.push(row);

                int firstInside = Arrays.binarySearch(lefts, row.left()) + 1;
                int pastInside = -Arrays.binarySearch(lefts, row.right()) - 1;
                long descendants = pastInside - firstInside;
                if (row.right() - row.left() + 1 != 2 * (1 + descendants)) {
                    throw new InvalidStateException(row + " has width " + (row.right() - row.left() + 1)
                            + " but " + descendants + " descendants");
                }
            }
            return all.size();
        });
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    private <R> R mutate(String operation, Function<TreeSession<T>, Mutation<R>> work) {
        Mutation<R> mutation = guard(operation, () -> store.inTransaction(work::apply));
        events.post(mutation.event());
        return mutation.result();
    }

    private <R> R read(TransactionWork<T, R> work) {
        return guard("read", () -> store.readSnapshot(work));
    }

    private <R> R guard(String operation, Supplier<R> call) {
        try {
            return call.get();
        } catch (ConcurrencyConflictException e) {
            LOG.warn("[{}] {} hit a lock conflict and was rolled back; safe to retry: {}", name(), operation,
                    e.getMessage());
            throw e;
        } catch (StorageException e) {
            LOG.error("[{}] {} failed in storage", name(), operation, e);
            throw e;
        } catch (NestedSetException e) {
            LOG.debug("[{}] {} rejected: {}", name(), operation, e.getMessage());
            throw e;
        }
    }

    private static <T> TreeNode<T> require(TreeSession<T> session, long id) {
        return session.findById(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    private static List<Long> ids(List<? extends TreeNode<?>> nodes) {
        List<Long> ids = new ArrayList<>(nodes.size());
        for (TreeNode<?> node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }

    private record Mutation<R>(R result, TreeEvents.TreeEvent event) {
    }
}
