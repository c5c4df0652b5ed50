package io.middleware4j.datastore;

import io.middleware4j.core.Backref;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Local backing store boundary.
 *
 * <p>Rows are plain maps. When a {@code prefix} is given, stored column names carry it and returned rows have it
 * stripped; filters and data always use the unprefixed names. The primary key column is never prefixed.
 *
 * <p>Implementations must return fresh copies: callers are free to mutate what they receive.
 */
public interface Datastore {

    /**
     * Rows of {@code table} matching all {@code filters}, ordered and paged by {@code options}.
     * Only ordering, limit and offset are honored here.
     */
    List<Map<String, Object>> query(String table, List<Filter> filters, QueryOptions options, String prefix);

    default List<Map<String, Object>> query(String table, List<Filter> filters) {
        return query(table, filters, QueryOptions.defaults(), null);
    }

    /**
     * The single row of a config table, or empty if it was never inserted.
     */
    Optional<Map<String, Object>> config(String table, String prefix);

    /**
     * Insert a row and return its primary key. A key is allocated when {@code data} carries none.
     */
    Object insert(String table, Map<String, Object> data, String prefix);

    void update(String table, Object id, Map<String, Object> data, String prefix);

    void delete(String table, Object id);

    /**
     * Foreign keys in other tables that reference the primary key of {@code table}.
     */
    List<Backref> getBackrefs(String table);
}
