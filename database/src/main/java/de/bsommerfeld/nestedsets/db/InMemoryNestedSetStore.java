package de.bsommerfeld.nestedsets.db;

import de.bsommerfeld.nestedsets.core.boundary.Boundaries;
import de.bsommerfeld.nestedsets.core.boundary.Shift;
import de.bsommerfeld.nestedsets.core.domain.TreeNode;
import de.bsommerfeld.nestedsets.core.error.ConcurrencyConflictException;
import de.bsommerfeld.nestedsets.core.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Heap-backed {@link NestedSetStore}: no disk I/O, no SQL. Bound when the
 * store mode is {@code MEMORY}; also the store of choice for tests.
 *
 * <h3>Transactions</h3>
 * A write transaction holds the write lock for its whole duration and works
 * on a private copy of the rows. The copy replaces the committed rows only
 * when the work returns, so a failing work leaves nothing behind. Reads hold
 * the read lock and see the committed rows directly.
 *
 * <p>
 * Lock acquisition waits at most {@code lockTimeoutMillis} and then fails
 * with {@link ConcurrencyConflictException}, mirroring SQLite's busy
 * timeout.
 */
public class InMemoryNestedSetStore<T> implements NestedSetStore<T> {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryNestedSetStore.class);
    private static final Comparator<TreeNode<?>> BY_LEFT = Comparator.comparingLong(TreeNode::left);

    private final String name;
    private final long lockTimeoutMillis;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<Long, TreeNode<T>> rows = new HashMap<>();
    private long nextId = 1;

    public InMemoryNestedSetStore(String name) {
        this(name, 5000);
    }

    public InMemoryNestedSetStore(String name, long lockTimeoutMillis) {
        this.name = name;
        this.lockTimeoutMillis = lockTimeoutMillis;
        LOG.debug("In-memory store {} created, rows are not persisted.", name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public <R> R inTransaction(TransactionWork<T, R> work) {
        Lock writeLock = lock.writeLock();
        acquire(writeLock);
        try {
            WorkingSet working = new WorkingSet(new HashMap<>(rows), nextId, false);
            R result = work.execute(working);
            rows = working.rows;
            nextId = working.nextId;
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public <R> R readSnapshot(TransactionWork<T, R> work) {
        Lock readLock = lock.readLock();
        acquire(readLock);
        try {
            return work.execute(new WorkingSet(rows, nextId, true));
        } finally {
            readLock.unlock();
        }
    }

    /** Number of committed rows. */
    public int size() {
        Lock readLock = lock.readLock();
        acquire(readLock);
        try {
            return rows.size();
        } finally {
            readLock.unlock();
        }
    }

    private void acquire(Lock target) {
        try {
            if (!target.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new ConcurrencyConflictException(
                        "Timed out after " + lockTimeoutMillis + " ms waiting for the lock on " + name, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for the lock on " + name, e);
        }
    }

    private final class WorkingSet implements TreeSession<T> {

        private final Map<Long, TreeNode<T>> rows;
        private final boolean readOnly;
        private long nextId;

        private WorkingSet(Map<Long, TreeNode<T>> rows, long nextId, boolean readOnly) {
            this.rows = rows;
            this.nextId = nextId;
            this.readOnly = readOnly;
        }

        @Override
        public Optional<TreeNode<T>> findById(long id) {
            return Optional.ofNullable(rows.get(id));
        }

        @Override
        public long highestBoundary() {
            long highest = 0;
            for (TreeNode<T> row : rows.values()) {
                highest = Math.max(highest, row.right());
            }
            return highest;
        }

        @Override
        public List<TreeNode<T>> findAncestors(Boundaries of) {
            return select(row -> row.left() < of.left() && row.right() > of.right());
        }

        @Override
        public int countAncestors(Boundaries of) {
            return findAncestors(of).size();
        }

        @Override
        public List<TreeNode<T>> findDescendants(Boundaries of) {
            return select(row -> row.left() > of.left() && row.right() < of.right());
        }

        @Override
        public List<TreeNode<T>> findRoots() {
            return select(row -> rows.values().stream()
                    .noneMatch(other -> other.left() < row.left() && other.right() > row.right()));
        }

        @Override
        public List<TreeNode<T>> findAll() {
            return select(row -> true);
        }

        @Override
        public TreeNode<T> insert(Boundaries at, T payload) {
            requireWritable();
            TreeNode<T> row = new TreeNode<>(nextId++, at.left(), at.right(), payload);
            rows.put(row.id(), row);
            return row;
        }

        @Override
        public int applyShift(Shift shift) {
            requireWritable();
            if (shift.isNoop()) {
                return 0;
            }
            int touched = 0;
            for (TreeNode<T> row : new ArrayList<>(rows.values())) {
                if (row.right() > shift.threshold()) {
                    rows.put(row.id(), new TreeNode<>(row.id(), shift.apply(row.left()),
                            shift.apply(row.right()), row.payload()));
                    touched++;
                }
            }
            return touched;
        }

        @Override
        public int deleteRange(Boundaries range) {
            requireWritable();
            int before = rows.size();
            rows.values().removeIf(row -> row.left() >= range.left() && row.right() <= range.right());
            return before - rows.size();
        }

        @Override
        public int parkRange(Boundaries range) {
            requireWritable();
            int parked = 0;
            for (TreeNode<T> row : new ArrayList<>(rows.values())) {
                if (row.left() >= range.left() && row.right() <= range.right()) {
                    rows.put(row.id(), new TreeNode<>(row.id(), -row.left(), -row.right(), row.payload()));
                    parked++;
                }
            }
            return parked;
        }

        @Override
        public int restoreParked(long offset) {
            requireWritable();
            int restored = 0;
            for (TreeNode<T> row : new ArrayList<>(rows.values())) {
                if (row.left() < 0) {
                    rows.put(row.id(), new TreeNode<>(row.id(), -row.left() + offset,
                            -row.right() + offset, row.payload()));
                    restored++;
                }
            }
            return restored;
        }

        private List<TreeNode<T>> select(Predicate<TreeNode<T>> filter) {
            List<TreeNode<T>> result = new ArrayList<>();
            for (TreeNode<T> row : rows.values()) {
                if (filter.test(row)) {
                    result.add(row);
                }
            }
            result.sort(BY_LEFT);
            return result;
        }

        private void requireWritable() {
            if (readOnly) {
                throw new UnsupportedOperationException("Read snapshot on " + name + " cannot write");
            }
        }
    }
}
