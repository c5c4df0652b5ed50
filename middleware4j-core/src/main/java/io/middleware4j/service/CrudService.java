package io.middleware4j.service;

import io.middleware4j.core.Backref;
import io.middleware4j.core.Dependency;
import io.middleware4j.core.EventType;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.QueryResult;
import io.middleware4j.core.ServiceType;
import io.middleware4j.datastore.FilterEngine;
import io.middleware4j.errors.DependencyConflictException;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.ValidationErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keyed collection store.
 *
 * <p>Query policy: with an extend transform registered and {@code forceStorageFilters} off, every row is fetched,
 * extended and only then filtered in-process, so filters may reference computed fields. Otherwise filters, ordering
 * and paging are pushed down to the datastore and the result is extended afterwards.
 *
 * <p>Mutations run {@code do*}, then the {@code post_*} hook, then the change event. A hook failure propagates and
 * suppresses the event; the mutation itself is not undone.
 */
public class CrudService extends Service {
    private static final Logger log = LoggerFactory.getLogger(CrudService.class);

    private final EntrySchema schema;

    public CrudService(ServiceDescriptor descriptor) {
        this(descriptor, null);
    }

    public CrudService(ServiceDescriptor descriptor, EntrySchema schema) {
        super(descriptor);
        this.schema = schema;
    }

    @Override
    public ServiceType type() {
        return ServiceType.CRUD;
    }

    public EntrySchema schema() {
        return schema;
    }

    @Override
    public List<MethodDescriptor> methods() {
        return List.of(
                MethodDescriptor.builder("query", (job, args) -> query(
                        filtersArg(arg(args, 0)), QueryOptions.fromMap(mapArg(args, 1, "options"))).value()).build(),
                MethodDescriptor.builder("get_instance", (job, args) -> getInstance(
                        arg(args, 0), QueryOptions.fromMap(mapArg(args, 1, "options")))).itemMethod(true).build(),
                MethodDescriptor.builder("create", (job, args) -> create(mapArg(args, 0, "data"))).build(),
                MethodDescriptor.builder("update", (job, args) -> update(arg(args, 0), mapArg(args, 1, "data")))
                        .itemMethod(true).build(),
                MethodDescriptor.builder("delete", (job, args) -> delete(arg(args, 0))).itemMethod(true).build(),
                MethodDescriptor.builder("get_dependencies", (job, args) -> getDependencies(arg(args, 0), Set.of()))
                        .privateMethod(true).build()
        );
    }

    public QueryResult query(List<Filter> filters, QueryOptions options) {
        List<Filter> f = filters == null ? List.of() : filters;
        QueryOptions o = options == null ? QueryOptions.defaults() : options;

        if (descriptor().extend() != null && !o.forceStorageFilters()) {
            List<Map<String, Object>> rows = extendAll(fetch(List.of(), QueryOptions.defaults()), o.extra());
            return FilterEngine.apply(rows, f, o);
        }

        List<Map<String, Object>> rows = extendAll(fetch(f, o.storageOptions()), o.extra());
        // already filtered, ordered and paged by the datastore
        return FilterEngine.apply(rows, List.of(), o.toBuilder().limit(0).offset(0).orderBy(List.of()).build());
    }

    public QueryResult query(List<Filter> filters) {
        return query(filters, QueryOptions.defaults());
    }

    /**
     * Raw rows from the backing store.
     */
    protected List<Map<String, Object>> fetch(List<Filter> filters, QueryOptions storageOptions) {
        return datastore().query(table(), filters, storageOptions, descriptor().datastorePrefix());
    }

    public Map<String, Object> getInstance(Object id) {
        return getInstance(id, QueryOptions.defaults());
    }

    /**
     * Entry by primary key. Filtering is always pushed down: the primary key is a stored column.
     */
    public Map<String, Object> getInstance(Object id, QueryOptions options) {
        QueryOptions o = (options == null ? QueryOptions.defaults() : options).toBuilder()
                .get(true)
                .count(false)
                .forceStorageFilters(true)
                .build();
        try {
            return query(List.of(Filter.eq(descriptor().primaryKey(), id)), o).entry();
        } catch (InstanceNotFoundException e) {
            throw new InstanceNotFoundException(descriptor().verboseName() + " " + id + " does not exist");
        }
    }

    public Map<String, Object> create(Map<String, Object> data) {
        Map<String, Object> result = doCreate(data);
        hooks().run(namespace() + ".post_create", result);
        if (descriptor().eventSend() && result != null && result.containsKey(descriptor().primaryKey())) {
            events().send(queryEvent(), EventType.ADDED, result.get(descriptor().primaryKey()), result);
        }
        return result;
    }

    public Map<String, Object> update(Object id, Map<String, Object> data) {
        Map<String, Object> result = doUpdate(id, data);
        hooks().run(namespace() + ".post_update", result);
        if (descriptor().eventSend() && result != null && result.containsKey(descriptor().primaryKey())) {
            events().send(queryEvent(), EventType.CHANGED, result.get(descriptor().primaryKey()), result);
        }
        return result;
    }

    public boolean delete(Object id) {
        if (descriptor().deleteDependencyGuard() && descriptor().datastore() != null) {
            checkDependencies(id, Set.of());
        }
        boolean result = doDelete(id);
        hooks().run(namespace() + ".post_delete", id);
        if (descriptor().eventSend()) {
            events().send(queryEvent(), EventType.REMOVED, id, null);
        }
        return result;
    }

    protected Map<String, Object> doCreate(Map<String, Object> data) {
        validate(data, schema == null ? null : schema.forCreate(descriptor().primaryKey()));
        Object id = directCreate(new LinkedHashMap<>(data));
        return getInstance(id);
    }

    protected Map<String, Object> doUpdate(Object id, Map<String, Object> data) {
        getInstance(id);
        validate(data, schema == null ? null : schema.forUpdate(descriptor().primaryKey()));
        directUpdate(id, new LinkedHashMap<>(data));
        return getInstance(id);
    }

    protected boolean doDelete(Object id) {
        getInstance(id);
        directDelete(id);
        return true;
    }

    protected Object directCreate(Map<String, Object> data) {
        return datastore().insert(table(), data, descriptor().datastorePrefix());
    }

    protected void directUpdate(Object id, Map<String, Object> data) {
        datastore().update(table(), id, data, descriptor().datastorePrefix());
    }

    protected void directDelete(Object id) {
        datastore().delete(table(), id);
    }

    private void validate(Map<String, Object> data, EntrySchema s) {
        if (s == null) {
            return;
        }
        ValidationErrors verrors = new ValidationErrors();
        s.validate(data, verrors);
        verrors.check();
    }

    /**
     * Add an error to {@code verrors} when another entry already has {@code field = value}. {@code id} is the entry
     * being updated, or null on create.
     */
    public void ensureUnique(ValidationErrors verrors, String schemaName, String field, Object value, Object id) {
        List<Filter> filters = new ArrayList<>();
        filters.add(Filter.eq(field, value));
        if (id != null) {
            filters.add(Filter.of(descriptor().primaryKey(), "!=", id));
        }
        long matches = query(filters, QueryOptions.builder().count(true).build()).count();
        if (matches > 0) {
            verrors.add(schemaName + "." + field, "Object with this " + field + " already exists");
        }
    }

    /**
     * Refuse with {@link DependencyConflictException} while unignored stores still reference {@code id}.
     */
    public void checkDependencies(Object id, Set<String> ignored) {
        List<Dependency> dependencies = getDependencies(id, ignored);
        if (dependencies.isEmpty()) {
            return;
        }
        StringBuilder msg = new StringBuilder("This object is being used by following service(s):\n");
        int index = 1;
        for (Dependency d : dependencies) {
            boolean hasService = d.service() != null;
            msg.append(index++).append(") '")
                    .append(hasService ? d.service() : d.datastore()).append("' ")
                    .append(hasService ? "Service" : "Datastore").append('\n');
        }
        log.debug("delete refused namespace={} id={} dependencies={}", namespace(), id, dependencies.size());
        throw new DependencyConflictException(msg.toString(), dependencies);
    }

    public List<Dependency> getDependencies(Object id, Set<String> ignored) {
        Set<String> ignore = new HashSet<>(descriptor().ignoredDependencies());
        if (ignored != null) {
            ignore.addAll(ignored);
        }
        DependencyIndex index = context().registry().dependencies(datastore());

        List<Dependency> out = new ArrayList<>();
        for (Backref ref : index.backrefsOf(table())) {
            if (ignore.contains(ref.table())) {
                continue;
            }
            Service owner = index.serviceFor(ref.table()).orElse(null);
            if (owner != null && ignore.contains(owner.namespace())) {
                continue;
            }

            List<Map<String, Object>> objects = datastore().query(ref.table(), List.of(Filter.eq(ref.column(), id)));
            if (objects.isEmpty()) {
                continue;
            }

            if (owner == null) {
                out.add(new Dependency(ref.table(), null, null, objects));
            } else if (owner.type() == ServiceType.CONFIG) {
                out.add(new Dependency(ref.table(), owner.namespace(), stripPrefix(ref.column(), owner), null));
            } else if (owner.type() == ServiceType.CRUD) {
                String pk = owner.descriptor().primaryKey();
                List<Object> ids = new ArrayList<>();
                for (Map<String, Object> row : objects) {
                    ids.add(row.get(pk));
                }
                @SuppressWarnings("unchecked")
                List<Map<String, Object>> extended = (List<Map<String, Object>>) middleware().call(
                        owner.namespace() + ".query", List.of(Filter.of(pk, "in", ids)));
                out.add(new Dependency(ref.table(), owner.namespace(), null, extended));
            } else {
                out.add(new Dependency(ref.table(), owner.namespace(), null, objects));
            }
        }
        return out;
    }

    private static String stripPrefix(String column, Service owner) {
        String prefix = owner.descriptor().datastorePrefix();
        if (prefix != null && !prefix.isEmpty() && column.startsWith(prefix)) {
            return column.substring(prefix.length());
        }
        return column;
    }

    protected String queryEvent() {
        return namespace() + ".query";
    }

    protected String table() {
        String table = descriptor().datastore();
        if (table == null) {
            throw new IllegalStateException(namespace() + " has no datastore");
        }
        return table;
    }

    protected static List<Filter> filtersArg(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new IllegalArgumentException("filters must be a list");
        }
        return Filter.parse(list);
    }
}
