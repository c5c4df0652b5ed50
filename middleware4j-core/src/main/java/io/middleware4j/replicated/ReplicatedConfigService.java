package io.middleware4j.replicated;

import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.service.ConfigService;
import io.middleware4j.service.EntrySchema;
import io.middleware4j.service.ServiceDescriptor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Config service that runs against a {@link ReplicatedBackend} when the node is clustered and against the local
 * datastore otherwise.
 *
 * <p>Reads never fail for availability reasons: with both health probes down, or with data stored under another
 * version, the defaults are returned. Writes fail instead, with
 * {@link io.middleware4j.errors.UnhealthyBackendException} or {@link io.middleware4j.errors.VersionMismatchException}.
 */
public class ReplicatedConfigService extends ConfigService {

    public static final Duration DEFAULT_RECHECK_INTERVAL = Duration.ofSeconds(30);

    private final ReplicatedStoreSupport store;
    private final Map<String, Object> defaults;

    public ReplicatedConfigService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                                   VersionStamp version, Map<String, Object> defaults) {
        this(descriptor, schema, backend, version, defaults, DEFAULT_RECHECK_INTERVAL);
    }

    public ReplicatedConfigService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                                   VersionStamp version, Map<String, Object> defaults, Duration recheckInterval) {
        this(descriptor, schema, backend, version, defaults, recheckInterval, System::nanoTime);
    }

    ReplicatedConfigService(ServiceDescriptor descriptor, EntrySchema schema, ReplicatedBackend backend,
                            VersionStamp version, Map<String, Object> defaults, Duration recheckInterval,
                            LongSupplier ticker) {
        super(descriptor, schema);
        this.store = new ReplicatedStoreSupport(descriptor.namespace(), backend, version, recheckInterval, ticker);
        this.defaults = defaults == null ? Map.of() : new LinkedHashMap<>(defaults);
    }

    public VersionStamp version() {
        return store.version();
    }

    @Override
    public Map<String, Object> config() {
        if (!store.clustered()) {
            return super.config();
        }
        if (!store.readable()) {
            return defaultsCopy();
        }

        VersionedPayload<Map<String, Object>> stored = store.read(() -> store.backend().readConfig(namespace()));
        if (stored == null) {
            return defaultsCopy();
        }
        Map<String, Object> data = stored.data() == null ? defaultsCopy() : stored.data();
        if (!store.compatible(stored.version())) {
            data = defaultsCopy();
        }
        return extendOne(data);
    }

    @Override
    protected Map<String, Object> directUpdate(Map<String, Object> data) {
        if (!store.clustered()) {
            getOrInsert();
            Object id = data.containsKey("id") ? data.remove("id") : 1;
            datastore().update(table(), id, data, descriptor().datastorePrefix());
            return config();
        }

        store.requireWritable();

        VersionedPayload<Map<String, Object>> old = store.backend().readConfig(namespace());
        Map<String, Object> merged = old.data() == null ? defaultsCopy() : new LinkedHashMap<>(old.data());
        merged.putAll(data);
        try {
            store.backend().writeConfig(namespace(), new VersionedPayload<>(store.version(), merged));
        } catch (VersionConflictException e) {
            throw store.mismatch(e);
        }

        VersionedPayload<Map<String, Object>> now = store.backend().readConfig(namespace());
        return extendOne(now.data());
    }

    private Map<String, Object> defaultsCopy() {
        return ReplicatedStoreSupport.copyMap(context().objectMapper(), defaults);
    }
}
