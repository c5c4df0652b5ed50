package io.middleware4j.core;

import java.util.List;
import java.util.Map;

/**
 * Result of a filterable query: a list of entries, a single entry ({@code get}) or a count ({@code count}).
 */
public final class QueryResult {

    public enum Kind {
        LIST,
        ENTRY,
        COUNT
    }

    private final Kind kind;
    private final List<Map<String, Object>> entries;
    private final Map<String, Object> entry;
    private final long count;

    private QueryResult(Kind kind, List<Map<String, Object>> entries, Map<String, Object> entry, long count) {
        this.kind = kind;
        this.entries = entries;
        this.entry = entry;
        this.count = count;
    }

    public static QueryResult ofList(List<Map<String, Object>> entries) {
        return new QueryResult(Kind.LIST, List.copyOf(entries), null, entries.size());
    }

    public static QueryResult ofEntry(Map<String, Object> entry) {
        return new QueryResult(Kind.ENTRY, List.of(entry), entry, 1);
    }

    public static QueryResult ofCount(long count) {
        return new QueryResult(Kind.COUNT, List.of(), null, count);
    }

    public Kind kind() {
        return kind;
    }

    public List<Map<String, Object>> list() {
        if (kind != Kind.LIST) {
            throw new IllegalStateException("query result is " + kind + ", not LIST");
        }
        return entries;
    }

    public Map<String, Object> entry() {
        if (kind != Kind.ENTRY) {
            throw new IllegalStateException("query result is " + kind + ", not ENTRY");
        }
        return entry;
    }

    public long count() {
        return count;
    }

    /**
     * Plain value as returned over the dispatch boundary: a list, a map or a number.
     */
    public Object value() {
        return switch (kind) {
            case LIST -> entries;
            case ENTRY -> entry;
            case COUNT -> count;
        };
    }

    @Override
    public String toString() {
        return "QueryResult{" + kind + "=" + value() + "}";
    }
}
