package io.middleware4j.internal.mongo;

import io.middleware4j.core.Backref;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.datastore.FilterEngine;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.ValidationException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * MongoDB {@link Datastore}: one collection per table.
 *
 * <p>The primary key is stored as {@code _id}. Integer keys are allocated from the {@code counters} collection with
 * an atomic increment, one counter document per table.
 *
 * <p>Filters are translated to {@link Criteria} when every operator has a MongoDB equivalent. Queries using
 * {@code rin}, {@code rnin}, {@code !^} or {@code !$} fetch the whole collection and filter in-process.
 * Sorting follows MongoDB's order, where missing and null values sort first.
 */
public class MongoDatastore implements Datastore {
    private static final Logger log = LoggerFactory.getLogger(MongoDatastore.class);

    public static final String COUNTERS_COLLECTION = "counters";

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final Map<String, String> primaryKeys = new ConcurrentHashMap<>();
    private final Map<String, List<Backref>> backrefs = new ConcurrentHashMap<>();

    public MongoDatastore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public MongoDatastore declareTable(String table, String primaryKey) {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(primaryKey, "primaryKey must not be null");
        primaryKeys.put(table, primaryKey);
        return this;
    }

    /**
     * Declare that {@code table.column} references the primary key of {@code target}.
     */
    public MongoDatastore declareBackref(String target, String table, String column) {
        backrefs.computeIfAbsent(target, t -> new CopyOnWriteArrayList<>()).add(new Backref(table, column));
        return this;
    }

    /**
     * Every declared backref, keyed by referenced table.
     */
    public Map<String, List<Backref>> backrefs() {
        Map<String, List<Backref>> out = new LinkedHashMap<>();
        backrefs.forEach((target, refs) -> out.put(target, List.copyOf(refs)));
        return out;
    }

    @Override
    public List<Map<String, Object>> query(String table, List<Filter> filters, QueryOptions options, String prefix) {
        String pk = primaryKey(table);
        QueryOptions storage = options == null ? QueryOptions.defaults() : options.storageOptions();
        List<Filter> f = filters == null ? List.of() : filters;

        Criteria criteria = translateAll(f, prefix, pk);
        if (criteria == null) {
            log.debug("filters not translatable, filtering in-process table={} filters={}", table, f.size());
            List<Map<String, Object>> rows = toRows(mongoTemplate.find(new Query(), Document.class, table), prefix, pk);
            return new ArrayList<>(FilterEngine.apply(rows, f, storage).list());
        }

        Query query = new Query(criteria);
        for (String spec : storage.orderBy()) {
            boolean desc = spec.startsWith("-");
            String field = column(desc ? spec.substring(1) : spec, prefix, pk);
            query.with(Sort.by(desc ? Sort.Direction.DESC : Sort.Direction.ASC, field));
        }
        if (storage.offset() > 0) {
            query.skip(storage.offset());
        }
        if (storage.limit() > 0) {
            query.limit(storage.limit());
        }
        return toRows(mongoTemplate.find(query, Document.class, table), prefix, pk);
    }

    @Override
    public Optional<Map<String, Object>> config(String table, String prefix) {
        Document doc = mongoTemplate.findOne(new Query().with(Sort.by(ID)), Document.class, table);
        return Optional.ofNullable(doc).map(d -> toRow(d, prefix, primaryKey(table)));
    }

    @Override
    public Object insert(String table, Map<String, Object> data, String prefix) {
        String pk = primaryKey(table);
        Object id = data.get(pk);
        id = id == null ? nextId(table) : normalizeKey(id);

        Document doc = new Document(ID, id);
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (!e.getKey().equals(pk)) {
                doc.put(column(e.getKey(), prefix, pk), e.getValue());
            }
        }
        try {
            mongoTemplate.insert(doc, table);
        } catch (DuplicateKeyException e) {
            throw new ValidationException(table + "." + pk, "Object with this id already exists");
        }
        if (id instanceof Long explicit && data.get(pk) != null) {
            // keep allocation ahead of caller-chosen keys
            mongoTemplate.upsert(new Query(Criteria.where(ID).is(table)), new Update().max("seq", explicit),
                    COUNTERS_COLLECTION);
        }
        log.debug("row inserted table={} id={}", table, id);
        return id;
    }

    @Override
    public void update(String table, Object id, Map<String, Object> data, String prefix) {
        String pk = primaryKey(table);
        Update update = new Update();
        boolean changes = false;
        for (Map.Entry<String, Object> e : data.entrySet()) {
            if (!e.getKey().equals(pk)) {
                update.set(column(e.getKey(), prefix, pk), e.getValue());
                changes = true;
            }
        }
        Query byId = new Query(Criteria.where(ID).is(normalizeKey(id)));
        long matched = changes
                ? mongoTemplate.updateFirst(byId, update, table).getMatchedCount()
                : (mongoTemplate.exists(byId, table) ? 1 : 0);
        if (matched == 0) {
            throw new InstanceNotFoundException(table + " " + id + " does not exist");
        }
    }

    @Override
    public void delete(String table, Object id) {
        long deleted = mongoTemplate.remove(new Query(Criteria.where(ID).is(normalizeKey(id))), table)
                .getDeletedCount();
        if (deleted == 0) {
            throw new InstanceNotFoundException(table + " " + id + " does not exist");
        }
    }

    @Override
    public List<Backref> getBackrefs(String table) {
        return List.copyOf(backrefs.getOrDefault(table, List.of()));
    }

    private long nextId(String table) {
        Document counter = mongoTemplate.findAndModify(
                new Query(Criteria.where(ID).is(table)),
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                Document.class,
                COUNTERS_COLLECTION);
        return ((Number) Objects.requireNonNull(counter, "counter upsert returned nothing").get("seq")).longValue();
    }

    private String primaryKey(String table) {
        Objects.requireNonNull(table, "table must not be null");
        return primaryKeys.getOrDefault(table, "id");
    }

    // ---- filter translation ----

    private Criteria translateAll(List<Filter> filters, String prefix, String pk) {
        if (filters.isEmpty()) {
            return new Criteria();
        }
        List<Criteria> parts = new ArrayList<>(filters.size());
        for (Filter f : filters) {
            Criteria c = translate(f, prefix, pk);
            if (c == null) {
                return null;
            }
            parts.add(c);
        }
        return parts.size() == 1 ? parts.get(0) : new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private Criteria translate(Filter filter, String prefix, String pk) {
        if (filter.isOr()) {
            List<Criteria> members = new ArrayList<>();
            for (Filter member : filter.anyOf()) {
                Criteria c = translate(member, prefix, pk);
                if (c == null) {
                    return null;
                }
                members.add(c);
            }
            return new Criteria().orOperator(members.toArray(new Criteria[0]));
        }

        String field = column(filter.field(), prefix, pk);
        Object value = field.equals(ID) ? normalizeKey(filter.value()) : filter.value();
        return switch (filter.operator()) {
            case "=" -> Criteria.where(field).is(value);
            case "!=" -> Criteria.where(field).ne(value);
            case ">" -> Criteria.where(field).gt(value);
            case ">=" -> Criteria.where(field).gte(value);
            case "<" -> Criteria.where(field).lt(value);
            case "<=" -> Criteria.where(field).lte(value);
            case "~" -> Criteria.where(field).regex(String.valueOf(value));
            case "in" -> Criteria.where(field).in(keys(value, field));
            case "nin" -> Criteria.where(field).nin(keys(value, field));
            case "^" -> Criteria.where(field).regex("^" + Pattern.quote(String.valueOf(value)));
            case "$" -> Criteria.where(field).regex(Pattern.quote(String.valueOf(value)) + "$");
            default -> null;
        };
    }

    private static Collection<?> keys(Object value, String field) {
        if (!(value instanceof Collection<?> c)) {
            throw new IllegalArgumentException("in/nin filters require a list, got " + value);
        }
        if (!field.equals(ID)) {
            return c;
        }
        List<Object> out = new ArrayList<>(c.size());
        for (Object o : c) {
            out.add(normalizeKey(o));
        }
        return out;
    }

    private static String column(String field, String prefix, String pk) {
        if (field.equals(pk)) {
            return ID;
        }
        if (prefix == null || prefix.isEmpty()) {
            return field;
        }
        return prefix + field;
    }

    // ---- row mapping ----

    private static List<Map<String, Object>> toRows(List<Document> docs, String prefix, String pk) {
        List<Map<String, Object>> out = new ArrayList<>(docs.size());
        for (Document d : docs) {
            out.add(toRow(d, prefix, pk));
        }
        return out;
    }

    private static Map<String, Object> toRow(Document doc, String prefix, String pk) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : doc.entrySet()) {
            String key = e.getKey();
            if (key.equals(ID)) {
                key = pk;
            } else if (prefix != null && !prefix.isEmpty() && key.startsWith(prefix)) {
                key = key.substring(prefix.length());
            }
            row.put(key, plain(e.getValue()));
        }
        return row;
    }

    // nested BSON documents become plain maps so callers never see driver types
    @SuppressWarnings("unchecked")
    static Object plain(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : ((Map<String, Object>) m).entrySet()) {
                out.put(e.getKey(), plain(e.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object item : l) {
                out.add(plain(item));
            }
            return out;
        }
        return value;
    }

    // Integral keys are stored as int64 so that 1, 1L and (short) 1 address the same document.
    static Object normalizeKey(Object id) {
        if (id instanceof Integer || id instanceof Short || id instanceof Byte) {
            return ((Number) id).longValue();
        }
        return id;
    }
}
