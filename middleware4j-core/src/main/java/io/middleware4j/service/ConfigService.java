package io.middleware4j.service;

import io.middleware4j.core.ServiceType;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.ValidationErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-record store.
 *
 * <p>The row is created lazily: the first {@link #config()} against an empty table inserts an empty row. Concurrent
 * first calls are serialized on one process-wide lock and re-read after acquiring it, so exactly one row is inserted.
 */
public class ConfigService extends Service {
    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private static final ReentrantLock GET_OR_INSERT = new ReentrantLock();

    private final EntrySchema schema;

    public ConfigService(ServiceDescriptor descriptor) {
        this(descriptor, null);
    }

    public ConfigService(ServiceDescriptor descriptor, EntrySchema schema) {
        super(descriptor);
        this.schema = schema;
    }

    @Override
    public ServiceType type() {
        return ServiceType.CONFIG;
    }

    public EntrySchema schema() {
        return schema;
    }

    @Override
    public List<MethodDescriptor> methods() {
        return List.of(
                MethodDescriptor.builder("config", (job, args) -> config()).build(),
                MethodDescriptor.builder("update", (job, args) -> update(mapArg(args, 0, "data"))).build()
        );
    }

    public Map<String, Object> config() {
        return extendOne(getOrInsert());
    }

    /**
     * Apply {@code data}, then run {@code <namespace>.post_update}. A hook failure reaches the caller but the
     * update stays committed.
     */
    public Map<String, Object> update(Map<String, Object> data) {
        Map<String, Object> result = doUpdate(data);
        hooks().run(namespace() + ".post_update", result);
        return result;
    }

    /**
     * Default update: validate against the update schema, then write through {@link #directUpdate(Map)}.
     */
    protected Map<String, Object> doUpdate(Map<String, Object> data) {
        if (schema != null) {
            ValidationErrors verrors = new ValidationErrors();
            schema.forUpdate(descriptor().primaryKey()).validate(data, verrors);
            verrors.check();
        }
        return directUpdate(new LinkedHashMap<>(data));
    }

    /**
     * Merge {@code data} into the stored row and return the new config.
     */
    protected Map<String, Object> directUpdate(Map<String, Object> data) {
        Map<String, Object> row = getOrInsert();
        Object id = row.get(descriptor().primaryKey());
        datastore().update(table(), id, data, descriptor().datastorePrefix());
        return config();
    }

    protected Map<String, Object> getOrInsert() {
        String table = table();
        String prefix = descriptor().datastorePrefix();
        Optional<Map<String, Object>> row = datastore().config(table, prefix);
        if (row.isPresent()) {
            return row.get();
        }

        GET_OR_INSERT.lock();
        try {
            row = datastore().config(table, prefix);
            if (row.isEmpty()) {
                log.debug("config row missing, inserting default namespace={} table={}", namespace(), table);
                datastore().insert(table, new LinkedHashMap<>(), prefix);
                row = datastore().config(table, prefix);
            }
        } finally {
            GET_OR_INSERT.unlock();
        }
        return row.orElseThrow(() -> new InstanceNotFoundException(namespace() + ": config row is missing"));
    }

    protected String table() {
        String table = descriptor().datastore();
        if (table == null) {
            throw new IllegalStateException(namespace() + " has no datastore");
        }
        return table;
    }
}
