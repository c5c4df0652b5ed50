package io.middleware4j.replicated;

import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;

import java.util.List;
import java.util.Map;

/**
 * Clustered key/value backend boundary. Consistency of the replication itself is the backend's concern.
 *
 * <p>Every write carries the writer's version stamp. When the store already holds data under a different stamp
 * the write is refused with {@link VersionConflictException} and nothing changes.
 */
public interface ReplicatedBackend {

    /**
     * Key field of collection entries.
     */
    String ENTRY_ID = "id";

    /**
     * Topology probe: whether this node runs against the clustered backend at all.
     */
    boolean clustered();

    /**
     * Cluster health. May throw, which callers treat as unhealthy.
     */
    boolean healthy(String name);

    /**
     * Health of this node's local replica of {@code name}. May throw, which callers treat as unhealthy.
     */
    boolean localHealthy(String name);

    /**
     * The single record stored under {@code name}; {@link VersionedPayload#empty()} if never written.
     */
    VersionedPayload<Map<String, Object>> readConfig(String name);

    void writeConfig(String name, VersionedPayload<Map<String, Object>> payload);

    /**
     * Every entry of the collection {@code name}; {@link VersionedPayload#empty()} if never written.
     */
    VersionedPayload<List<Map<String, Object>>> query(String name);

    /**
     * Store a new entry and return it with its allocated {@code id}.
     */
    Map<String, Object> create(String name, VersionedPayload<Map<String, Object>> payload);

    Map<String, Object> update(String name, Object id, VersionedPayload<Map<String, Object>> payload);

    void delete(String name, VersionStamp version, Object id);

    /**
     * Set several entries at once, keyed by their {@code id}.
     */
    void batchSet(String name, VersionStamp version, List<Map<String, Object>> entries);
}
