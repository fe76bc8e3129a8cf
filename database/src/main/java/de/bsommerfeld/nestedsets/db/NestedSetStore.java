package de.bsommerfeld.nestedsets.db;

/**
 * Storage contract for one nested set table. Implementations must be
 * thread-safe.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlNestedSetStore}: JDBC persistence, SQLite by default</li>
 * <li>{@link InMemoryNestedSetStore}: rows on the heap, no disk I/O</li>
 * </ul>
 *
 * <h3>Transactions</h3>
 * {@link #inTransaction} serializes against every other write before the
 * work sees its first row, commits when the work returns and rolls back
 * when it throws. {@link #readSnapshot} gives the work a consistent view
 * without holding writers back longer than the reads take.
 *
 * <p>
 * Storage failures surface as
 * {@link de.bsommerfeld.nestedsets.core.error.ConcurrencyConflictException}
 * for lock timeouts and deadlocks, and as
 * {@link de.bsommerfeld.nestedsets.core.error.StorageException} otherwise.
 */
public interface NestedSetStore<T> {

    /** Table or store name, used in logs and events. */
    String name();

    <R> R inTransaction(TransactionWork<T, R> work);

    <R> R readSnapshot(TransactionWork<T, R> work);
}
