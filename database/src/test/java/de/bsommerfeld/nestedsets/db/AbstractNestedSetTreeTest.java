package de.bsommerfeld.nestedsets.db;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.nestedsets.core.boundary.Boundaries;
import de.bsommerfeld.nestedsets.core.boundary.BoundaryAllocator;
import de.bsommerfeld.nestedsets.core.boundary.Shift;
import de.bsommerfeld.nestedsets.core.domain.NodeTree;
import de.bsommerfeld.nestedsets.core.domain.TreeNode;
import de.bsommerfeld.nestedsets.core.error.BoundaryOverflowException;
import de.bsommerfeld.nestedsets.core.error.CycleRejectedException;
import de.bsommerfeld.nestedsets.core.error.NodeNotFoundException;
import de.bsommerfeld.nestedsets.core.event.TreeEventBus;
import de.bsommerfeld.nestedsets.core.event.TreeEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static de.bsommerfeld.nestedsets.core.domain.NodeTree.Shape.of;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link NestedSetStore} has to show through
 * {@link NestedSetTree}. Subclasses only provide a fresh, empty store.
 */
abstract class AbstractNestedSetTreeTest {

    protected NestedSetStore<Category> store;
    protected TreeEventBus events;
    protected NestedSetTree<Category> tree;

    /** Returns a store holding no rows. Called once per test. */
    protected abstract NestedSetStore<Category> newStore();

    @BeforeEach
    void setUp() {
        store = newStore();
        events = new TreeEventBus();
        tree = new NestedSetTree<>(store, new BoundaryAllocator(), events);
    }

    protected TreeNode<Category> root(String title) {
        return tree.createRoot(new Category(title));
    }

    protected TreeNode<Category> child(TreeNode<Category> parent, String title) {
        return tree.addChild(parent, new Category(title));
    }

    protected Boundaries at(TreeNode<Category> node) {
        return tree.refresh(node).boundaries();
    }

    protected static List<String> titles(List<TreeNode<Category>> nodes) {
        List<String> titles = new ArrayList<>();
        for (TreeNode<Category> node : nodes) {
            titles.add(node.payload().title());
        }
        return titles;
    }

    // =====================================================================
    // Worked examples
    // =====================================================================

    @Nested
    class BasicScenarios {

        private TreeNode<Category> r;
        private TreeNode<Category> a;
        private TreeNode<Category> b;
        private TreeNode<Category> c;

        @BeforeEach
        void buildScenarioThree() {
            r = root("R");
            a = child(r, "A");
            b = child(r, "B");
            c = child(a, "C");
        }

        @Test
        void createRoot_shouldStartAtOne() {
            tree.deleteSubtree(r);
            TreeNode<Category> fresh = root("R");
            assertEquals(new Boundaries(1, 2), fresh.boundaries());
        }

        @Test
        void addChild_shouldRenumberParentAndFollowingNodes() {
            assertEquals(new Boundaries(1, 8), at(r));
            assertEquals(new Boundaries(2, 5), at(a));
            assertEquals(new Boundaries(3, 4), at(c));
            assertEquals(new Boundaries(6, 7), at(b));
        }

        @Test
        void addChild_returnedHandleShouldMatchStoredRow() {
            assertEquals(new Boundaries(3, 4), c.boundaries());
            assertEquals(c, tree.find(c.id()));
        }

        @Test
        void deleteSubtree_shouldRemoveDescendantsAndCloseGap() {
            List<TreeNode<Category>> removed = tree.deleteSubtree(a);

            assertEquals(List.of("A", "C"), titles(removed));
            assertEquals(new Boundaries(1, 4), at(r));
            assertEquals(new Boundaries(2, 3), at(b));
            assertThrows(NodeNotFoundException.class, () -> tree.find(c.id()));
            assertEquals(2, tree.verifyIntegrity());
        }

        @Test
        void ancestorsOf_shouldListRootFirst() {
            assertEquals(List.of("R", "A"), titles(tree.ancestorsOf(c)));
            assertTrue(tree.ancestorsOf(r).isEmpty());
        }

        @Test
        void descendantsOf_shouldBePreOrder() {
            assertEquals(List.of("A", "C", "B"), titles(tree.descendantsOf(r)));
            assertTrue(tree.descendantsOf(c).isEmpty());
        }

        @Test
        void moveSubtree_intoOwnDescendantShouldFailAndChangeNothing() {
            List<String> before = tree.render();

            assertThrows(CycleRejectedException.class, () -> tree.moveSubtree(a, c));
            assertThrows(CycleRejectedException.class, () -> tree.moveSubtree(a, a));
            assertThrows(CycleRejectedException.class, () -> tree.moveSubtree(r, b));

            assertEquals(before, tree.render());
        }

        @Test
        void queries_shouldReflectStructure() {
            assertEquals(List.of("A", "B"), titles(tree.childrenOf(r)));
            assertEquals(List.of("C"), titles(tree.childrenOf(a)));
            assertEquals("A", tree.parentOf(c).orElseThrow().payload().title());
            assertTrue(tree.parentOf(r).isEmpty());
            assertEquals(0, tree.depthOf(r));
            assertEquals(2, tree.depthOf(c));
            assertTrue(tree.isAncestorOf(r, c));
            assertFalse(tree.isAncestorOf(b, c));
            assertFalse(tree.isAncestorOf(c, c));
        }

        @Test
        void reads_shouldNotChangeAnything() {
            List<String> before = tree.render();

            tree.ancestorsOf(c);
            tree.descendantsOf(r);
            tree.childrenOf(a);
            tree.buildTree(r);

            assertEquals(before, tree.render());
            assertEquals(tree.ancestorsOf(c), tree.ancestorsOf(c));
            assertEquals(tree.descendantsOf(r), tree.descendantsOf(r));
            assertEquals(List.of("A", "C", "B"), titles(tree.descendantsOf(r)));
        }

        @Test
        void staleHandle_shouldStillResolveById() {
            // b was captured at (4,5) before c shifted it to (6,7)
            assertEquals(new Boundaries(4, 5), b.boundaries());

            TreeNode<Category> d = child(b, "D");

            assertEquals(new Boundaries(7, 8), d.boundaries());
            assertEquals(5, tree.verifyIntegrity());
        }

        @Test
        void render_shouldIndentByDepth() {
            List<String> expected = List.of(
                    "TreeNode(" + r.id() + ", 1, 8, R)",
                    "    TreeNode(" + a.id() + ", 2, 5, A)",
                    "        TreeNode(" + c.id() + ", 3, 4, C)",
                    "    TreeNode(" + b.id() + ", 6, 7, B)");
            assertEquals(expected, tree.render());
        }

        @Test
        void deleteSubtree_twiceShouldFailWithNotFound() {
            tree.deleteSubtree(a);

            NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> tree.deleteSubtree(a));
            assertEquals(a.id(), e.getNodeId());
            assertThrows(NodeNotFoundException.class, () -> child(c, "orphan"));
            assertEquals(2, tree.verifyIntegrity());
        }
    }

    // =====================================================================
    // Insertion order
    // =====================================================================

    @Test
    void addFirstChild_shouldPrepend() {
        TreeNode<Category> r = root("R");
        child(r, "A");
        TreeNode<Category> z = tree.addFirstChild(r, new Category("Z"));

        assertEquals(new Boundaries(2, 3), z.boundaries());
        assertEquals(List.of("Z", "A"), titles(tree.childrenOf(r)));
        assertEquals(new Boundaries(1, 6), at(r));
    }

    @Test
    void addSibling_shouldInsertAfterAndBefore() {
        TreeNode<Category> r = root("R");
        TreeNode<Category> a = child(r, "A");
        child(r, "B");

        tree.addSibling(a, new Category("X"));
        tree.addSiblingBefore(a, new Category("W"));

        assertEquals(List.of("W", "A", "X", "B"), titles(tree.childrenOf(r)));
        assertEquals(5, tree.verifyIntegrity());
    }

    @Test
    void addSibling_ofRootShouldCreateRoots() {
        TreeNode<Category> r = root("R");
        TreeNode<Category> s = tree.addSibling(r, new Category("S"));
        TreeNode<Category> q = tree.addSiblingBefore(r, new Category("Q"));

        assertEquals(new Boundaries(3, 4), s.boundaries());
        assertEquals(new Boundaries(1, 2), q.boundaries());
        assertEquals(List.of("Q", "R", "S"), titles(tree.roots()));
        assertEquals(new Boundaries(3, 4), at(r));
    }

    @Test
    void addChildren_shouldAppendBatchInOrder() {
        TreeNode<Category> r = root("R");
        child(r, "first");

        List<TreeNode<Category>> added = tree.addChildren(r,
                List.of(new Category("a"), new Category("b"), new Category("c")));

        assertEquals(List.of(new Boundaries(4, 5), new Boundaries(6, 7), new Boundaries(8, 9)),
                List.of(added.get(0).boundaries(), added.get(1).boundaries(), added.get(2).boundaries()));
        assertEquals(List.of("first", "a", "b", "c"), titles(tree.childrenOf(r)));
        assertEquals(new Boundaries(1, 10), at(r));
    }

    @Test
    void addChildren_shouldRejectEmptyBatch() {
        TreeNode<Category> r = root("R");
        assertThrows(IllegalArgumentException.class, () -> tree.addChildren(r, List.of()));
    }

    @Test
    void createRoot_shouldShareNumberingAcrossTrees() {
        TreeNode<Category> r1 = root("R1");
        TreeNode<Category> r2 = root("R2");
        assertEquals(new Boundaries(3, 4), r2.boundaries());

        child(r1, "A");

        assertEquals(new Boundaries(1, 4), at(r1));
        assertEquals(new Boundaries(5, 6), at(r2));
        assertEquals(List.of("R1", "R2"), titles(tree.roots()));
    }

    // =====================================================================
    // Round trips
    // =====================================================================

    @Nested
    class RoundTrips {

        private TreeNode<Category> r;
        private TreeNode<Category> a;
        private TreeNode<Category> b;
        private TreeNode<Category> s;
        private List<String> before;

        @BeforeEach
        void buildForest() {
            r = root("R");
            a = child(r, "A");
            b = child(r, "B");
            child(a, "C");
            s = root("S");
            child(s, "T");
            before = tree.render();
        }

        @Test
        void addChild_thenDelete_shouldRestoreAllBoundaries() {
            TreeNode<Category> x = child(a, "X");
            assertNotEquals(before, tree.render());

            tree.deleteSubtree(x);

            assertEquals(before, tree.render());
        }

        @Test
        void addFirstChild_thenDelete_shouldRestoreAllBoundaries() {
            TreeNode<Category> x = tree.addFirstChild(r, new Category("X"));

            tree.deleteSubtree(x);

            assertEquals(before, tree.render());
        }

        @Test
        void addSiblings_thenDelete_shouldRestoreAllBoundaries() {
            TreeNode<Category> after = tree.addSibling(a, new Category("X"));
            TreeNode<Category> first = tree.addSiblingBefore(r, new Category("Q"));

            tree.deleteSubtree(after);
            tree.deleteSubtree(first);

            assertEquals(before, tree.render());
        }

        @Test
        void moveAfter_thenBack_shouldRestoreAllBoundaries() {
            tree.moveAfter(a, b);
            assertEquals(List.of("B", "A"), titles(tree.childrenOf(r)));

            tree.moveBefore(a, b);

            assertEquals(before, tree.render());
        }

        @Test
        void moveRoots_thenBack_shouldRestoreAllBoundaries() {
            tree.moveBefore(s, r);
            assertEquals(List.of("S", "R"), titles(tree.roots()));

            tree.moveAfter(s, r);

            assertEquals(before, tree.render());
        }
    }

    // =====================================================================
    // Movement
    // =====================================================================

    @Nested
    class Moves {

        private TreeNode<Category> albert;
        private TreeNode<Category> bert;
        private TreeNode<Category> chuck;
        private TreeNode<Category> donna;
        private TreeNode<Category> eddie;
        private TreeNode<Category> fred;

        @BeforeEach
        void buildFamily() {
            albert = root("Albert");
            bert = child(albert, "Bert");
            chuck = child(albert, "Chuck");
            donna = child(chuck, "Donna");
            eddie = child(chuck, "Eddie");
            fred = child(chuck, "Fred");
        }

        @Test
        void family_shouldHaveExpectedShape() {
            NodeTree<Category> built = tree.buildTree(albert);

            assertEquals(of("Albert", of("Bert"), of("Chuck", of("Donna"), of("Eddie"), of("Fred"))),
                    built.map(Category::title));
            assertEquals(new Boundaries(1, 12), at(albert));
        }

        @Test
        void moveAfter_shouldPlaceNextToTarget() {
            TreeNode<Category> moved = tree.moveAfter(bert, eddie);

            assertEquals(at(eddie).right() + 1, at(bert).left());
            assertEquals(moved, tree.refresh(bert));
            assertEquals(List.of("Donna", "Eddie", "Bert", "Fred"), titles(tree.childrenOf(chuck)));
            assertEquals(2, tree.depthOf(bert));
            assertEquals(6, tree.verifyIntegrity());
        }

        @Test
        void moveBefore_shouldPlaceInFrontOfTarget() {
            tree.moveBefore(fred, donna);

            assertEquals(new Boundaries(5, 6), at(fred));
            assertEquals(List.of("Fred", "Donna", "Eddie"), titles(tree.childrenOf(chuck)));
            assertEquals(6, tree.verifyIntegrity());
        }

        @Test
        void moveSubtree_shouldBecomeLastChild() {
            tree.moveSubtree(bert, donna);

            assertEquals(at(donna).left(), at(bert).left() - 1);
            assertEquals(new Boundaries(4, 5), at(bert));
            assertEquals(new Boundaries(3, 6), at(donna));
            assertEquals("Donna", tree.parentOf(bert).orElseThrow().payload().title());
            assertEquals(6, tree.verifyIntegrity());
        }

        @Test
        void moveToFirstChild_shouldPrepend() {
            tree.moveToFirstChild(fred, albert);

            assertEquals(new Boundaries(2, 3), at(fred));
            assertEquals(List.of("Fred", "Bert", "Chuck"), titles(tree.childrenOf(albert)));
            assertEquals(6, tree.verifyIntegrity());
        }

        @Test
        void moveSubtree_shouldCarryDescendants() {
            tree.moveSubtree(chuck, bert);

            assertEquals(of("Albert", of("Bert", of("Chuck", of("Donna"), of("Eddie"), of("Fred")))),
                    tree.buildTree(albert).map(Category::title));
            assertEquals(new Boundaries(3, 10), at(chuck));
            assertEquals(new Boundaries(1, 12), at(albert));
            assertEquals(3, tree.depthOf(fred));
        }

        @Test
        void moveSubtree_shouldReachAnotherRoot() {
            TreeNode<Category> other = root("Other");

            tree.moveSubtree(chuck, other);

            assertEquals(new Boundaries(1, 4), at(albert));
            assertEquals(new Boundaries(5, 14), at(other));
            assertEquals(List.of("Chuck"), titles(tree.childrenOf(other)));
            assertEquals(7, tree.verifyIntegrity());
        }

        @Test
        void moveSubtree_rootUnderAnotherRootShouldLeaveOneRoot() {
            TreeNode<Category> other = root("Other");

            tree.moveSubtree(other, albert);

            assertEquals(List.of("Albert"), titles(tree.roots()));
            assertEquals(List.of("Bert", "Chuck", "Other"), titles(tree.childrenOf(albert)));
            assertEquals(7, tree.verifyIntegrity());
        }

        @Test
        void moveAfter_currentPositionShouldChangeNothing() {
            List<String> before = tree.render();

            TreeNode<Category> moved = tree.moveAfter(eddie, donna);

            assertEquals(new Boundaries(7, 8), moved.boundaries());
            assertEquals(before, tree.render());
        }

        @Test
        void move_cyclesShouldBeRejectedWithoutChanges() {
            List<String> before = tree.render();

            assertThrows(CycleRejectedException.class, () -> tree.moveSubtree(chuck, donna));
            assertThrows(CycleRejectedException.class, () -> tree.moveBefore(chuck, chuck));
            assertThrows(CycleRejectedException.class, () -> tree.moveAfter(albert, fred));
            assertThrows(CycleRejectedException.class, () -> tree.moveToFirstChild(albert, albert));

            assertEquals(before, tree.render());
        }

        @Test
        void move_missingNodeShouldFail() {
            tree.deleteSubtree(eddie);
            assertThrows(NodeNotFoundException.class, () -> tree.moveSubtree(eddie, bert));
            assertThrows(NodeNotFoundException.class, () -> tree.moveSubtree(bert, eddie));
        }

        @Test
        void buildForest_shouldReturnEveryRoot() {
            TreeNode<Category> other = root("Other");
            child(other, "Leaf");

            List<NodeTree<Category>> forest = tree.buildForest();

            assertEquals(2, forest.size());
            assertEquals(6, forest.get(0).size());
            assertEquals(of("Other", of("Leaf")), forest.get(1).map(Category::title));
        }
    }

    // =====================================================================
    // Failures
    // =====================================================================

    @Test
    void find_unknownIdShouldFail() {
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> tree.find(4711));
        assertEquals(4711, e.getNodeId());
    }

    @Test
    void overflow_shouldRejectAndKeepState() {
        NestedSetTree<Category> small = new NestedSetTree<>(store, new BoundaryAllocator(6), events);
        TreeNode<Category> r = small.createRoot(new Category("R"));
        small.addChild(r, new Category("A"));
        small.addChild(r, new Category("B"));
        List<String> before = small.render();

        assertThrows(BoundaryOverflowException.class, () -> small.addChild(r, new Category("C")));
        assertThrows(BoundaryOverflowException.class, () -> small.createRoot(new Category("S")));
        assertThrows(BoundaryOverflowException.class,
                () -> small.addChildren(r, List.of(new Category("x"))));

        assertEquals(before, small.render());
        assertEquals(3, small.verifyIntegrity());
    }

    @Test
    void failingWork_shouldRollBack() {
        TreeNode<Category> r = root("R");
        child(r, "A");
        List<String> before = tree.render();

        assertThrows(IllegalStateException.class, () -> store.inTransaction(session -> {
            session.applyShift(new Shift(0, 10));
            session.insert(new Boundaries(50, 51), new Category("ghost"));
            throw new IllegalStateException("abort");
        }));

        assertEquals(before, tree.render());
        assertEquals(2, tree.verifyIntegrity());
    }

    @Test
    void readSnapshot_shouldRefuseWrites() {
        assertThrows(UnsupportedOperationException.class,
                () -> store.readSnapshot(session -> session.applyShift(new Shift(0, 2))));
    }

    // =====================================================================
    // Events
    // =====================================================================

    @Test
    void mutations_shouldPostEventsAfterCommit() {
        List<Object> received = new CopyOnWriteArrayList<>();
        events.register(new Object() {
            @Subscribe
            public void onInserted(TreeEvents.NodesInserted event) {
                received.add(event);
            }

            @Subscribe
            public void onDeleted(TreeEvents.SubtreeDeleted event) {
                received.add(event);
            }

            @Subscribe
            public void onMoved(TreeEvents.SubtreeMoved event) {
                received.add(event);
            }
        });

        TreeNode<Category> r = root("R");
        List<TreeNode<Category>> kids = tree.addChildren(r, List.of(new Category("a"), new Category("b")));
        tree.moveBefore(kids.get(1), kids.get(0));
        tree.deleteSubtree(kids.get(0));
        assertThrows(CycleRejectedException.class, () -> tree.moveSubtree(r, kids.get(1)));

        assertEquals(4, received.size());
        assertEquals(new TreeEvents.NodesInserted(store.name(), List.of(r.id())), received.get(0));
        assertEquals(new TreeEvents.NodesInserted(store.name(), List.of(kids.get(0).id(), kids.get(1).id())),
                received.get(1));
        assertEquals(new TreeEvents.SubtreeMoved(store.name(), kids.get(1).id(),
                new Boundaries(4, 5), new Boundaries(2, 3)), received.get(2));
        assertEquals(new TreeEvents.SubtreeDeleted(store.name(), kids.get(0).id(),
                new Boundaries(4, 5), List.of(kids.get(0).id())), received.get(3));
    }

    // =====================================================================
    // Invariants
    // =====================================================================

    @Test
    void randomOperations_shouldPreserveInvariants() {
        Random random = new Random(42);
        List<TreeNode<Category>> live = new ArrayList<>();

        for (int step = 0; step < 150; step++) {
            int op = live.isEmpty() ? 0 : random.nextInt(8);
            String title = "n" + step;
            switch (op) {
                case 0 -> live.add(tree.createRoot(new Category(title)));
                case 1 -> live.add(tree.addChild(pick(random, live), new Category(title)));
                case 2 -> live.add(tree.addFirstChild(pick(random, live), new Category(title)));
                case 3 -> live.add(tree.addSibling(pick(random, live), new Category(title)));
                case 4 -> live.add(tree.addSiblingBefore(pick(random, live), new Category(title)));
                case 5 -> {
                    if (live.size() > 5) {
                        List<Long> removed = new ArrayList<>();
                        for (TreeNode<Category> node : tree.deleteSubtree(pick(random, live))) {
                            removed.add(node.id());
                        }
                        live.removeIf(node -> removed.contains(node.id()));
                    }
                }
                default -> {
                    TreeNode<Category> node = pick(random, live);
                    TreeNode<Category> target = pick(random, live);
                    try {
                        switch (random.nextInt(4)) {
                            case 0 -> tree.moveSubtree(node, target);
                            case 1 -> tree.moveToFirstChild(node, target);
                            case 2 -> tree.moveBefore(node, target);
                            default -> tree.moveAfter(node, target);
                        }
                    } catch (CycleRejectedException e) {
                        assertTrue(tree.refresh(node).isAncestorOf(tree.refresh(target), true));
                    }
                }
            }
            assertEquals(live.size(), tree.verifyIntegrity(), "after step " + step);
        }

        for (TreeNode<Category> node : live) {
            TreeNode<Category> current = tree.refresh(node);
            assertEquals(current.descendantCount(), tree.descendantsOf(current).size());
        }
    }

    private static TreeNode<Category> pick(Random random, List<TreeNode<Category>> nodes) {
        return nodes.get(random.nextInt(nodes.size()));
    }

    @Test
    void concurrentInserts_shouldSerialize() throws Exception {
        TreeNode<Category> r = root("R");
        int threads = 4;
        int perThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tree.addChild(r, new Category("w" + worker + "-" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1 + threads * perThread, tree.verifyIntegrity());
        assertEquals(threads * perThread, tree.childrenOf(r).size());
    }
}
