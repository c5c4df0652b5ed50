package io.middleware4j.replicated;

import io.middleware4j.MiddlewareHarness;
import io.middleware4j.core.VersionStamp;
import io.middleware4j.errors.UnhealthyBackendException;
import io.middleware4j.errors.VersionMismatchException;
import io.middleware4j.service.ServiceDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReplicatedConfigServiceTest {

    private static final VersionStamp V1 = VersionStamp.of(1, 0);
    private static final Map<String, Object> DEFAULTS = Map.of("enabled", false, "interval", 60);

    private final InMemoryReplicatedBackend backend = new InMemoryReplicatedBackend();
    private final AtomicLong now = new AtomicLong();
    private MiddlewareHarness harness;

    private ReplicatedConfigService service(Duration recheck) {
        ServiceDescriptor descriptor = ServiceDescriptor.builder("cluster.alerts")
                .datastore("cluster_alerts")
                .extend((row, ctx) -> {
                    Map<String, Object> out = new LinkedHashMap<>(row);
                    out.put("extended", true);
                    return out;
                })
                .build();
        ReplicatedConfigService service = new ReplicatedConfigService(descriptor, null, backend, V1, DEFAULTS,
                recheck, now::get);
        harness = new MiddlewareHarness(service);
        return service;
    }

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    @Test
    void emptyStoreShouldReadAsExtendedDefaults() {
        ReplicatedConfigService alerts = service(Duration.ZERO);

        Map<String, Object> config = alerts.config();

        assertEquals(false, config.get("enabled"));
        assertEquals(60, config.get("interval"));
        assertEquals(true, config.get("extended"));
    }

    @Test
    void updateShouldMergeOverDefaultsAndStampVersion() {
        ReplicatedConfigService alerts = service(Duration.ZERO);

        Map<String, Object> result = alerts.update(Map.of("enabled", true));

        assertEquals(true, result.get("enabled"));
        assertEquals(60, result.get("interval"));
        assertEquals(true, result.get("extended"));
        assertEquals(V1, backend.readConfig("cluster.alerts").version());
        assertFalse(backend.readConfig("cluster.alerts").data().containsKey("extended"));
    }

    @Test
    void unreadableStoreShouldReturnDefaultsVerbatim() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        alerts.update(Map.of("enabled", true));
        backend.setHealthy(false);
        backend.setLocalHealthy(false);

        Map<String, Object> config = alerts.config();

        assertEquals(DEFAULTS, config);
        assertNull(config.get("extended"));
    }

    @Test
    void failingReadBehindHealthyCacheShouldReturnDefaults() {
        ReplicatedConfigService alerts = service(Duration.ofSeconds(30));
        alerts.update(Map.of("enabled", true));
        assertEquals(1, backend.healthProbes());

        backend.failReads(new IllegalStateException("backend unreachable"));
        Map<String, Object> config = alerts.config();

        assertEquals(DEFAULTS, config);
        assertEquals(1, backend.healthProbes());

        backend.failReads(null);
        assertEquals(true, alerts.config().get("enabled"));
        assertEquals(2, backend.healthProbes());
    }

    @Test
    void healthyLocalReplicaShouldStillServeStoredData() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        alerts.update(Map.of("enabled", true));
        backend.setHealthy(false);

        assertEquals(true, alerts.config().get("enabled"));
    }

    @Test
    void unhealthyClusterShouldRefuseWrites() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        backend.setHealthy(false);

        assertThrows(UnhealthyBackendException.class, () -> alerts.update(Map.of("enabled", true)));
        assertNull(backend.readConfig("cluster.alerts").data());
    }

    @Test
    void failingHealthProbeShouldCountAsUnhealthy() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        backend.failHealthProbe(new IllegalStateException("peer timeout"));

        assertEquals(60, alerts.config().get("interval"));
        assertThrows(UnhealthyBackendException.class, () -> alerts.update(Map.of("enabled", true)));
    }

    @Test
    void versionMismatchShouldReadDefaultsAndRefuseWrites() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        alerts.update(Map.of("enabled", true, "interval", 5));
        backend.restamp("cluster.alerts", VersionStamp.of(2, 0));

        Map<String, Object> config = alerts.config();
        VersionMismatchException e = assertThrows(VersionMismatchException.class,
                () -> alerts.update(Map.of("interval", 10)));

        assertEquals(false, config.get("enabled"));
        assertEquals(60, config.get("interval"));
        assertEquals(V1, e.local());
        assertEquals(VersionStamp.of(2, 0), e.stored());
        assertEquals(5, backend.readConfig("cluster.alerts").data().get("interval"));
    }

    @Test
    void healthResultShouldBeCachedForRecheckInterval() {
        ReplicatedConfigService alerts = service(Duration.ofSeconds(30));

        alerts.config();
        alerts.config();
        assertEquals(1, backend.healthProbes());

        backend.setHealthy(false);
        backend.setLocalHealthy(false);
        assertEquals(true, alerts.config().get("extended"));

        now.addAndGet(Duration.ofSeconds(31).toNanos());
        assertNull(alerts.config().get("extended"));
        assertEquals(2, backend.healthProbes());
    }

    @Test
    void returnedDefaultsShouldBeIndependentCopies() {
        ReplicatedConfigService alerts = service(Duration.ZERO);
        backend.setHealthy(false);
        backend.setLocalHealthy(false);

        alerts.config().put("enabled", true);

        assertEquals(false, alerts.config().get("enabled"));
    }

    @Test
    void standaloneNodeShouldUseLocalDatastore() {
        backend.setClustered(false);
        ReplicatedConfigService alerts = service(Duration.ZERO);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", 1);
        data.put("enabled", true);
        Map<String, Object> result = alerts.update(data);

        assertEquals(true, result.get("enabled"));
        assertEquals(1L, result.get("id"));
        assertEquals(List.of(Map.of("id", 1L, "enabled", true)), harness.datastore.query("cluster_alerts", List.of()));
        assertNull(backend.readConfig("cluster.alerts").data());
        assertEquals(0, backend.healthProbes());
    }
}
