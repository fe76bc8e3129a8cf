/**
 * Nested set trees on top of a relational table, SQLite-backed by default and
 * in-memory on demand.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application]
 *        │
 *        ▼
 *   NestedSetTree&lt;T&gt;   ← single public entry point, one transaction per mutation
 *        │          └──── BoundaryAllocator (core) computes every shift plan
 *        ▼
 *   NestedSetStore&lt;T&gt;  ← interface (SQL ↔ MEMORY swap via NestedSetTreeFactory)
 *    ┌───┴───┐
 *    │       │
 *  SqlStore InMemoryStore
 * </pre>
 *
 * <h2>Table Layout</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ {table} (one row per node)                                        │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ Storage-assigned, stable for the node's life   │
 * │ lft              │ Left boundary, 1..2n across the whole forest   │
 * │ rgt              │ Right boundary, lft &lt; rgt                      │
 * │ ... payload      │ Columns declared by the PayloadMapper          │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Column names come from the {@link de.bsommerfeld.nestedsets.db.TableMapping};
 * {@code lft} and {@code rgt} are only the defaults. Both boundary columns are
 * indexed, because every query is a range predicate over them.
 *
 * <h2>Range Queries</h2>
 * <ul>
 * <li>ancestors of N: {@code lft < N.lft AND rgt > N.rgt ORDER BY lft}</li>
 * <li>descendants of N: {@code lft > N.lft AND rgt < N.rgt ORDER BY lft}</li>
 * <li>depth of N: {@code COUNT(*)} over the ancestor predicate</li>
 * </ul>
 *
 * <h2>SQL File Inventory</h2>
 * All statements are templates under {@code sql/*.sql}, loaded by
 * {@link de.bsommerfeld.nestedsets.db.SqlLoader}:
 * <ul>
 * <li>{@code schema.sql}: CREATE TABLE / INDEX IF NOT EXISTS</li>
 * <li>{@code select-node.sql}: one row by id</li>
 * <li>{@code select-highest-boundary.sql}: MAX(rgt), 0 when empty</li>
 * <li>{@code select-ancestors.sql}, {@code count-ancestors.sql}</li>
 * <li>{@code select-descendants.sql}</li>
 * <li>{@code select-roots.sql}: rows without an enclosing row</li>
 * <li>{@code select-all-nodes.sql}: full forest in pre-order</li>
 * <li>{@code insert-node.sql}</li>
 * <li>{@code shift-boundaries.sql}: the bulk shift primitive</li>
 * <li>{@code delete-range.sql}</li>
 * <li>{@code park-range.sql}, {@code restore-parked.sql}: subtree moves</li>
 * </ul>
 */
package de.bsommerfeld.nestedsets.db;
