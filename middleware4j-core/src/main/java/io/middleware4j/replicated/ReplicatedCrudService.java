package io.middleware4j.replicated;

import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.QueryResult;
import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.datastore.FilterEngine;
import io.middleware4j.service.CrudService;
import io.middleware4j.service.EntrySchema;
import io.middleware4j.service.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * CRUD service over a {@link ReplicatedBackend} when clustered, over the local datastore otherwise.
 *
 * <p>Clustered reads filter in-process after extending. Degraded reads return the default entries. An empty,
 * healthy collection is seeded with the defaults on first read.
 */
public class ReplicatedCrudService extends CrudService {
    private static final Logger log = LoggerFactory.getLogger(ReplicatedCrudService.class);

    private final ReplicatedStoreSupport store;
    private final List<Map<String, Object>> defaults;

    public ReplicatedCrudService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                                 VersionStamp version, List<Map<String, Object>> defaults) {
        this(descriptor, schema, backend, version, defaults, ReplicatedConfigService.DEFAULT_RECHECK_INTERVAL);
    }

    public ReplicatedCrudService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                                 VersionStamp version, List<Map<String, Object>> defaults, Duration recheckInterval) {
        this(descriptor, schema, backend, version, defaults, recheckInterval, System::nanoTime);
    }

    ReplicatedCrudService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                          VersionStamp version, List<Map<String, Object>> defaults, Duration recheckInterval,
                          LongSupplier ticker) {
        super(descriptor, schema);
        if (!ReplicatedBackend.ENTRY_ID.equals(descriptor.primaryKey())) {
            throw new IllegalArgumentException(descriptor.namespace() + ": replicated entries are keyed by '"
                    + ReplicatedBackend.ENTRY_ID + "', not '" + descriptor.primaryKey() + "'");
        }
        this.store = new ReplicatedStoreSupport(descriptor.namespace(), backend, version, recheckInterval, ticker);
        this.defaults = defaults == null ? List.of() : new ArrayList<>(defaults);
        for (Map<String, Object> entry : this.defaults) {
            if (!entry.containsKey(descriptor.primaryKey())) {
                throw new IllegalArgumentException(descriptor.namespace() + ": default entries need a "
                        + descriptor.primaryKey());
            }
        }
    }

    public VersionStamp version() {
        return store.version();
    }

    @Override
    public QueryResult query(List<Filter> filters, QueryOptions options) {
        if (!store.clustered()) {
            return super.query(filters, options);
        }
        List<Filter> f = filters == null ? List.of() : filters;
        QueryOptions o = options == null ? QueryOptions.defaults() : options;

        if (!store.readable()) {
            return FilterEngine.apply(defaultsCopy(), f, o);
        }

        VersionedPayload<List<Map<String, Object>>> stored = store.read(() -> store.backend().query(namespace()));
        if (stored == null || !store.compatible(stored.version())) {
            return FilterEngine.apply(defaultsCopy(), f, o);
        }

        List<Map<String, Object>> rows = extendAll(stored.data() == null ? List.of() : stored.data(), o.extra());
        if (rows.isEmpty() && !defaults.isEmpty()) {
            insertDefaults();
            rows = defaultsCopy();
        }
        return FilterEngine.apply(rows, f, o);
    }

    /**
     * Seed the collection with the default entries. A failure is logged: the read still answers with defaults.
     */
    protected void insertDefaults() {
        try {
            store.backend().batchSet(namespace(), store.version(), defaultsCopy());
            log.debug("{}: seeded replicated collection with defaults count={}", namespace(), defaults.size());
        } catch (RuntimeException e) {
            log.warn("{}: failed to seed replicated collection with defaults msg={}", namespace(), e.getMessage(), e);
        }
    }

    @Override
    protected Object directCreate(Map<String, Object> data) {
        if (!store.clustered()) {
            return super.directCreate(data);
        }
        store.requireWritable();
        try {
            Map<String, Object> created = store.backend().create(namespace(),
                    new VersionedPayload<>(store.version(), data));
            return created.get(descriptor().primaryKey());
        } catch (VersionConflictException e) {
            throw store.mismatch(e);
        }
    }

    @Override
    protected void directUpdate(Object id, Map<String, Object> data) {
        if (!store.clustered()) {
            super.directUpdate(id, data);
            return;
        }
        store.requireWritable();
        try {
            store.backend().update(namespace(), id, new VersionedPayload<>(store.version(), data));
        } catch (VersionConflictException e) {
            throw store.mismatch(e);
        }
    }

    @Override
    protected void directDelete(Object id) {
        if (!store.clustered()) {
            super.directDelete(id);
            return;
        }
        store.requireWritable();
        try {
            store.backend().delete(namespace(), store.version(), id);
        } catch (VersionConflictException e) {
            throw store.mismatch(e);
        }
    }

    private List<Map<String, Object>> defaultsCopy() {
        return ReplicatedStoreSupport.copyList(context().objectMapper(), defaults);
    }
}
