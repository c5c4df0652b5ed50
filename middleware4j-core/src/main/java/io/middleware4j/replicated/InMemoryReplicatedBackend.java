package io.middleware4j.replicated;

import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.errors.InstanceNotFoundException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-process {@link ReplicatedBackend}. Topology and health are switchable, which makes it the backend for
 * single-node setups and for exercising degraded modes.
 */
public class InMemoryReplicatedBackend implements ReplicatedBackend {

    private static final class Store {
        private VersionStamp version;
        private Map<String, Object> config;
        private Map<Object, Map<String, Object>> entries;
        private long nextId = 1;
    }

    private final Map<String, Store> stores = new HashMap<>();
    private final AtomicInteger healthProbes = new AtomicInteger();

    private volatile boolean clustered = true;
    private volatile boolean healthy = true;
    private volatile boolean localHealthy = true;
    private volatile RuntimeException healthFailure;
    private volatile RuntimeException readFailure;

    public void setClustered(boolean clustered) {
        this.clustered = clustered;
    }

    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    public void setLocalHealthy(boolean localHealthy) {
        this.localHealthy = localHealthy;
    }

    /**
     * Make the cluster health probe throw {@code failure}; null restores normal probing.
     */
    public void failHealthProbe(RuntimeException failure) {
        this.healthFailure = failure;
    }

    /**
     * Make {@link #readConfig} and {@link #query} throw {@code failure}; null restores normal reads.
     */
    public void failReads(RuntimeException failure) {
        this.readFailure = failure;
    }

    public int healthProbes() {
        return healthProbes.get();
    }

    /**
     * Overwrite the version stamp of whatever is stored under {@code name}, e.g. to emulate another node's upgrade.
     */
    public synchronized void restamp(String name, VersionStamp version) {
        store(name).version = version;
    }

    @Override
    public boolean clustered() {
        return clustered;
    }

    @Override
    public boolean healthy(String name) {
        healthProbes.incrementAndGet();
        RuntimeException failure = healthFailure;
        if (failure != null) {
            throw failure;
        }
        return healthy;
    }

    @Override
    public boolean localHealthy(String name) {
        return localHealthy;
    }

    @Override
    public synchronized VersionedPayload<Map<String, Object>> readConfig(String name) {
        throwIfReadsFail();
        Store s = stores.get(name);
        if (s == null || s.config == null) {
            return VersionedPayload.empty();
        }
        return new VersionedPayload<>(s.version, new LinkedHashMap<>(s.config));
    }

    @Override
    public synchronized void writeConfig(String name, VersionedPayload<Map<String, Object>> payload) {
        Store s = store(name);
        checkVersion(name, s, payload.version());
        s.version = payload.version();
        s.config = new LinkedHashMap<>(payload.data());
    }

    @Override
    public synchronized VersionedPayload<List<Map<String, Object>>> query(String name) {
        throwIfReadsFail();
        Store s = stores.get(name);
        if (s == null || s.entries == null) {
            return VersionedPayload.empty();
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Map<String, Object> e : s.entries.values()) {
            out.add(new LinkedHashMap<>(e));
        }
        return new VersionedPayload<>(s.version, out);
    }

    @Override
    public synchronized Map<String, Object> create(String name, VersionedPayload<Map<String, Object>> payload) {
        Store s = store(name);
        checkVersion(name, s, payload.version());
        Map<String, Object> row = new LinkedHashMap<>(payload.data());
        Object id = row.get(ENTRY_ID);
        if (id == null) {
            id = s.nextId;
        }
        if (id instanceof Number n) {
            id = n.longValue();
            s.nextId = Math.max(s.nextId, n.longValue() + 1);
        }
        row.put(ENTRY_ID, id);
        entries(s).put(id, row);
        s.version = payload.version();
        return new LinkedHashMap<>(row);
    }

    @Override
    public synchronized Map<String, Object> update(String name, Object id, VersionedPayload<Map<String, Object>> payload) {
        Store s = store(name);
        checkVersion(name, s, payload.version());
        Map<String, Object> row = entries(s).get(key(id));
        if (row == null) {
            throw new InstanceNotFoundException(name + " " + id + " does not exist");
        }
        row.putAll(payload.data());
        row.put(ENTRY_ID, key(id));
        return new LinkedHashMap<>(row);
    }

    @Override
    public synchronized void delete(String name, VersionStamp version, Object id) {
        Store s = store(name);
        checkVersion(name, s, version);
        if (entries(s).remove(key(id)) == null) {
            throw new InstanceNotFoundException(name + " " + id + " does not exist");
        }
    }

    @Override
    public synchronized void batchSet(String name, VersionStamp version, List<Map<String, Object>> entries) {
        Store s = store(name);
        checkVersion(name, s, version);
        for (Map<String, Object> entry : entries) {
            create(name, new VersionedPayload<>(version, entry));
        }
    }

    private void throwIfReadsFail() {
        RuntimeException failure = readFailure;
        if (failure != null) {
            throw failure;
        }
    }

    private Store store(String name) {
        return stores.computeIfAbsent(name, n -> new Store());
    }

    private static Map<Object, Map<String, Object>> entries(Store s) {
        if (s.entries == null) {
            s.entries = new LinkedHashMap<>();
        }
        return s.entries;
    }

    private static void checkVersion(String name, Store s, VersionStamp version) {
        if (s.version != null && !s.version.equals(version)) {
            throw new VersionConflictException(name, s.version);
        }
    }

    private static Object key(Object id) {
        return id instanceof Number n ? (Object) n.longValue() : id;
    }
}
