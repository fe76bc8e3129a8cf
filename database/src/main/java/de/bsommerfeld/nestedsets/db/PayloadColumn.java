package de.bsommerfeld.nestedsets.db;

/**
 * One column owned by the caller's record.
 *
 * @param name       column name, a plain SQL identifier
 * @param definition type and constraints used when the table is created,
 *                   e.g. {@code TEXT NOT NULL}
 */
public record PayloadColumn(String name, String definition) {
}
