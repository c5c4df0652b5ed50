package io.middleware4j.replicated;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.errors.UnhealthyBackendException;
import io.middleware4j.errors.VersionMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Health gating and version handling shared by the replicated Config and CRUD services.
 *
 * <p>The cluster health result is cached for {@code recheckInterval}. Two callers crossing the expiry at the same
 * time may both probe; that only costs an extra probe.
 */
final class ReplicatedStoreSupport {
    private static final Logger log = LoggerFactory.getLogger(ReplicatedStoreSupport.class);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<LinkedHashMap<String, Object>>> LIST = new TypeReference<>() {
    };

    private final String name;
    private final ReplicatedBackend backend;
    private final VersionStamp version;
    private final long recheckNanos;
    private final LongSupplier ticker;

    private volatile boolean status;
    private volatile long lastCheck;
    private volatile boolean checked;

    ReplicatedStoreSupport(String name, ReplicatedBackend backend, VersionStamp version, Duration recheckInterval,
                           LongSupplier ticker) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(recheckInterval, "recheckInterval must not be null");
        if (recheckInterval.isNegative()) {
            throw new IllegalArgumentException("recheckInterval must not be negative");
        }
        this.recheckNanos = recheckInterval.toNanos();
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
    }

    ReplicatedBackend backend() {
        return backend;
    }

    VersionStamp version() {
        return version;
    }

    boolean clustered() {
        return backend.clustered();
    }

    boolean clusterHealthy() {
        long now = ticker.getAsLong();
        if (checked && now - lastCheck < recheckNanos) {
            return status;
        }
        boolean result;
        try {
            result = backend.healthy(name);
        } catch (RuntimeException e) {
            log.warn("{}: cluster health check failed msg={}", name, e.getMessage(), e);
            result = false;
        }
        status = result;
        lastCheck = now;
        checked = true;
        return result;
    }

    boolean localHealthy() {
        try {
            if (backend.localHealthy(name)) {
                return true;
            }
            log.warn("{}: local replica is unhealthy, returning default value", name);
        } catch (RuntimeException e) {
            log.warn("{}: local replica health check failed msg={}", name, e.getMessage(), e);
        }
        return false;
    }

    /**
     * A read is possible when either the cluster or the local replica reports healthy. The local probe is only
     * consulted when the cluster probe says no.
     */
    boolean readable() {
        return clusterHealthy() || localHealthy();
    }

    /**
     * Read through the backend. A failure is logged, drops the cached health result, and yields null so the caller
     * answers with defaults.
     */
    <T> VersionedPayload<T> read(Supplier<VersionedPayload<T>> reader) {
        try {
            return reader.get();
        } catch (RuntimeException e) {
            log.warn("{}: replicated read failed, returning default value msg={}", name, e.getMessage(), e);
            checked = false;
            return null;
        }
    }

    void requireWritable() {
        if (!clusterHealthy()) {
            throw new UnhealthyBackendException(
                    name + ": clustered configuration may not be altered while cluster is unhealthy.");
        }
    }

    /**
     * Whether data stored under {@code stored} can be used by this node. Logs when it cannot.
     */
    boolean compatible(VersionStamp stored) {
        if (stored == null || stored.equals(version)) {
            return true;
        }
        log.error("{}: service version mismatch, node={} cluster={}. Service update migration is required. "
                + "Returning default values.", name, version, stored);
        return false;
    }

    VersionMismatchException mismatch(VersionConflictException e) {
        return new VersionMismatchException(name, version, e.stored());
    }

    static Map<String, Object> copyMap(ObjectMapper mapper, Map<String, Object> value) {
        return mapper.convertValue(value, MAP);
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> copyList(ObjectMapper mapper, List<Map<String, Object>> value) {
        return (List<Map<String, Object>>) (List<?>) mapper.convertValue(value, LIST);
    }
}
