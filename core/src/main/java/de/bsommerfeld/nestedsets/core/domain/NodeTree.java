package de.bsommerfeld.nestedsets.core.domain;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * A subtree materialized into parent/child form, children in left-to-right
 * order. Built in one pass over a pre-ordered descendant list, so no extra
 * queries are needed per level.
 *
 * @param <T> the caller's record type
 */
public final class NodeTree<T> {

    private final TreeNode<T> node;
    private final List<NodeTree<T>> children = new ArrayList<>();

    private NodeTree(TreeNode<T> node) {
        this.node = node;
    }

    /**
     * Assembles the tree below {@code root}. {@code descendants} must be the
     * root's descendants ordered by {@code left} ascending.
     *
     * <p>
     * Walks the list with a stack of open ancestors: a node whose
     * {@code left} lies beyond the top's {@code right} closes that ancestor.
     */
    public static <T> NodeTree<T> assemble(TreeNode<T> root, List<TreeNode<T>> descendants) {
        NodeTree<T> tree = new NodeTree<>(root);
        Deque<NodeTree<T>> open = new ArrayDeque<>();
        open.push(tree);
        for (TreeNode<T> descendant : descendants) {
            while (descendant.left() > open.peek().node.right()) {
                open.pop();
                if (open.isEmpty()) {
                    throw new IllegalArgumentException(descendant + " is not inside " + root);
                }
            }
            NodeTree<T> child = new NodeTree<>(descendant);
            open.peek().children.add(child);
            open.push(child);
        }
        return tree;
    }

    public TreeNode<T> node() {
        return node;
    }

    public T payload() {
        return node.payload();
    }

    public List<NodeTree<T>> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Total node count including this one. */
    public int size() {
        int size = 1;
        for (NodeTree<T> child : children) {
            size += child.size();
        }
        return size;
    }

    /** Projects the tree onto another value type, keeping its shape. */
    public <R> Shape<R> map(Function<T, R> mapper) {
        List<Shape<R>> mapped = new ArrayList<>(children.size());
        for (NodeTree<T> child : children) {
            mapped.add(child.map(mapper));
        }
        return new Shape<>(mapper.apply(node.payload()), mapped);
    }

    /**
     * Plain value/children structure, convenient for equality checks of a
     * whole tree shape.
     */
    public record Shape<R>(R value, List<Shape<R>> children) {

        public Shape {
            children = List.copyOf(children);
        }

        @SafeVarargs
        public static <R> Shape<R> of(R value, Shape<R>... children) {
            return new Shape<>(value, List.of(children));
        }
    }
}
