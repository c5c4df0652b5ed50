package io.middleware4j.datastore;

import io.middleware4j.core.Backref;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-backed {@link Datastore}. Tables are created on first use with an integer {@code id} primary key unless
 * declared otherwise.
 */
public class InMemoryDatastore implements Datastore {

    private final Map<String, Table> tables = new ConcurrentHashMap<>();
    private final Map<String, List<Backref>> backrefs = new ConcurrentHashMap<>();

    private static final class Table {
        private final String primaryKey;
        private final Map<Object, Map<String, Object>> rows = new LinkedHashMap<>();
        private long sequence = 0;

        private Table(String primaryKey) {
            this.primaryKey = primaryKey;
        }
    }

    public InMemoryDatastore declareTable(String table, String primaryKey) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        tables.putIfAbsent(table, new Table(primaryKey));
        return this;
    }

    /**
     * Declare that {@code table.column} references the primary key of {@code target}.
     */
    public InMemoryDatastore declareBackref(String target, String table, String column) {
        backrefs.computeIfAbsent(target, t -> new CopyOnWriteArrayList<>())
                .add(new Backref(table, column));
        return this;
    }

    private Table table(String name) {
        Objects.requireNonNull(name, "table must not be null");
        return tables.computeIfAbsent(name, n -> new Table("id"));
    }

    @Override
    public List<Map<String, Object>> query(String table, List<Filter> filters, QueryOptions options, String prefix) {
        Table t = table(table);
        List<Map<String, Object>> snapshot;
        synchronized (t) {
            snapshot = new ArrayList<>(t.rows.size());
            for (Map<String, Object> row : t.rows.values()) {
                snapshot.add(strip(row, prefix, t.primaryKey));
            }
        }
        QueryOptions storage = options == null ? QueryOptions.defaults() : options.storageOptions();
        return new ArrayList<>(FilterEngine.apply(snapshot, filters, storage).list());
    }

    @Override
    public Optional<Map<String, Object>> config(String table, String prefix) {
        Table t = table(table);
        synchronized (t) {
            return t.rows.values().stream().findFirst().map(row -> strip(row, prefix, t.primaryKey));
        }
    }

    @Override
    public Object insert(String table, Map<String, Object> data, String prefix) {
        Table t = table(table);
        synchronized (t) {
            Object id = data.get(t.primaryKey);
            if (id == null) {
                do {
                    id = ++t.sequence;
                } while (t.rows.containsKey(id));
            } else {
                if (t.rows.containsKey(normalizeKey(id))) {
                    throw new ValidationException(table + "." + t.primaryKey, "Object with this id already exists");
                }
                id = normalizeKey(id);
            }
            Map<String, Object> row = applyPrefix(data, prefix, t.primaryKey);
            row.put(t.primaryKey, id);
            t.rows.put(id, row);
            return id;
        }
    }

    @Override
    public void update(String table, Object id, Map<String, Object> data, String prefix) {
        Table t = table(table);
        synchronized (t) {
            Map<String, Object> row = t.rows.get(normalizeKey(id));
            if (row == null) {
                throw new InstanceNotFoundException(table + " " + id + " does not exist");
            }
            Map<String, Object> changes = applyPrefix(data, prefix, t.primaryKey);
            changes.remove(t.primaryKey);
            row.putAll(changes);
        }
    }

    @Override
    public void delete(String table, Object id) {
        Table t = table(table);
        synchronized (t) {
            if (t.rows.remove(normalizeKey(id)) == null) {
                throw new InstanceNotFoundException(table + " " + id + " does not exist");
            }
        }
    }

    @Override
    public List<Backref> getBackrefs(String table) {
        return List.copyOf(backrefs.getOrDefault(table, List.of()));
    }

    // Integral keys are stored as Long so that 1, 1L and (short) 1 address the same row.
    private static Object normalizeKey(Object id) {
        if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return ((Number) id).longValue();
        }
        return id;
    }

    private static Map<String, Object> applyPrefix(Map<String, Object> data, String prefix, String primaryKey) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : data.entrySet()) {
            String key = e.getKey();
            if (prefix != null && !prefix.isEmpty() && !key.equals(primaryKey)) {
                key = prefix + key;
            }
            out.put(key, e.getValue());
        }
        return out;
    }

    private static Map<String, Object> strip(Map<String, Object> row, String prefix, String primaryKey) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (var e : row.entrySet()) {
            String key = e.getKey();
            if (prefix != null && !prefix.isEmpty() && !key.equals(primaryKey) && key.startsWith(prefix)) {
                key = key.substring(prefix.length());
            }
            out.put(key, copyValue(e.getValue()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> m) {
            return new LinkedHashMap<>((Map<String, Object>) m);
        }
        if (value instanceof List<?> l) {
            return new ArrayList<>(l);
        }
        return value;
    }
}
