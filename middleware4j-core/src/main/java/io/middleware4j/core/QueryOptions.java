package io.middleware4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options accepted by every filterable query.
 *
 * <ul>
 *   <li>get: return the first matching entry instead of a list (fails if there is none)</li>
 *   <li>count: return the number of matching entries</li>
 *   <li>limit / offset: paging, applied after ordering</li>
 *   <li>orderBy: field names, prefix with {@code -} for descending</li>
 *   <li>select: keep only these fields in each returned entry</li>
 *   <li>forceStorageFilters: push filters down to the datastore even when an extend transform is registered</li>
 * </ul>
 */
public final class QueryOptions {

    private static final QueryOptions DEFAULTS = builder().build();

    private final boolean get;
    private final boolean count;
    private final int limit;
    private final int offset;
    private final List<String> orderBy;
    private final List<String> select;
    private final boolean forceStorageFilters;
    private final Map<String, Object> extra;

    private QueryOptions(Builder b) {
        this.get = b.get;
        this.count = b.count;
        this.limit = b.limit;
        this.offset = b.offset;
        this.orderBy = List.copyOf(b.orderBy);
        this.select = List.copyOf(b.select);
        this.forceStorageFilters = b.forceStorageFilters;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(b.extra));
    }

    public static QueryOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse the wire form, e.g. {@code {"get": true, "order_by": ["-name"], "limit": 10}}.
     */
    @SuppressWarnings("unchecked")
    public static QueryOptions fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return DEFAULTS;
        }
        Builder b = builder();
        for (Map.Entry<String, Object> e : raw.entrySet()) {
            Object v = e.getValue();
            switch (e.getKey()) {
                case "get" -> b.get(Boolean.TRUE.equals(v));
                case "count" -> b.count(Boolean.TRUE.equals(v));
                case "limit" -> b.limit(v == null ? 0 : ((Number) v).intValue());
                case "offset" -> b.offset(v == null ? 0 : ((Number) v).intValue());
                case "order_by" -> b.orderBy((List<String>) v);
                case "select" -> b.select((List<String>) v);
                case "force_sql_filters", "force_storage_filters" -> b.forceStorageFilters(Boolean.TRUE.equals(v));
                case "extra" -> b.extra((Map<String, Object>) v);
                default -> throw new IllegalArgumentException("Unknown query option: " + e.getKey());
            }
        }
        return b.build();
    }

    public boolean get() {
        return get;
    }

    public boolean count() {
        return count;
    }

    /**
     * 0 means no limit.
     */
    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public List<String> orderBy() {
        return orderBy;
    }

    public List<String> select() {
        return select;
    }

    public boolean forceStorageFilters() {
        return forceStorageFilters;
    }

    public Map<String, Object> extra() {
        return extra;
    }

    public Builder toBuilder() {
        return new Builder()
                .get(get)
                .count(count)
                .limit(limit)
                .offset(offset)
                .orderBy(orderBy)
                .select(select)
                .forceStorageFilters(forceStorageFilters)
                .extra(extra);
    }

    /**
     * Storage-level view of these options: paging and ordering only, no get/count/select.
     */
    public QueryOptions storageOptions() {
        return new Builder().limit(limit).offset(offset).orderBy(orderBy).build();
    }

    public static final class Builder {
        private boolean get;
        private boolean count;
        private int limit;
        private int offset;
        private List<String> orderBy = List.of();
        private List<String> select = List.of();
        private boolean forceStorageFilters;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Builder get(boolean get) {
            this.get = get;
            return this;
        }

        public Builder count(boolean count) {
            this.count = count;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must not be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(int offset) {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must not be negative");
            }
            this.offset = offset;
            return this;
        }

        public Builder orderBy(List<String> orderBy) {
            this.orderBy = orderBy == null ? List.of() : orderBy;
            return this;
        }

        public Builder select(List<String> select) {
            this.select = select == null ? List.of() : select;
            return this;
        }

        public Builder forceStorageFilters(boolean forceStorageFilters) {
            this.forceStorageFilters = forceStorageFilters;
            return this;
        }

        public Builder extra(Map<String, Object> extra) {
            this.extra.clear();
            if (extra != null) {
                this.extra.putAll(extra);
            }
            return this;
        }

        public Builder putExtra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public QueryOptions build() {
            if (get && count) {
                throw new IllegalStateException("get and count are mutually exclusive");
            }
            return new QueryOptions(this);
        }
    }
}
