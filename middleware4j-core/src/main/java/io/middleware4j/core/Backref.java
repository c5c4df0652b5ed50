package io.middleware4j.core;

/**
 * A foreign key in {@code table.column} pointing at the primary key of another table.
 */
public record Backref(String table, String column) {
}
