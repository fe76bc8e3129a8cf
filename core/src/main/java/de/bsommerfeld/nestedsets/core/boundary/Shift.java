package de.bsommerfeld.nestedsets.core.boundary;

/**
 * The single renumbering primitive: add {@code amount} to every {@code left}
 * and every {@code right} that is strictly greater than {@code threshold}.
 *
 * <p>
 * Stores translate this into one bulk update:
 *
 * <pre>
 * UPDATE t SET lft = CASE WHEN lft &gt; :threshold THEN lft + :amount ELSE lft END,
 *              rgt = rgt + :amount
 *  WHERE rgt &gt; :threshold
 * </pre>
 */
public record Shift(long threshold, long amount) {

    /** A shift that touches nothing. */
    public static final Shift NONE = new Shift(Long.MAX_VALUE, 0);

    public boolean isNoop() {
        return amount == 0;
    }

    /** Returns {@code value} as it reads after this shift is applied. */
    public long apply(long value) {
        return value > threshold ? value + amount : value;
    }
}
