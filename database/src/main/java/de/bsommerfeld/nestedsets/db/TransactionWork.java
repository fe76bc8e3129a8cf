package de.bsommerfeld.nestedsets.db;

/**
 * A unit of work run against a {@link TreeSession}. Throwing rolls the
 * surrounding transaction back.
 */
@FunctionalInterface
public interface TransactionWork<T, R> {

    R execute(TreeSession<T> session);
}
