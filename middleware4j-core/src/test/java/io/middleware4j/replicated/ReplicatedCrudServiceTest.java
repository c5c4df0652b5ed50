package io.middleware4j.replicated;

import io.middleware4j.MiddlewareHarness;
import io.middleware4j.core.EventType;
import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.VersionStamp;
import io.middleware4j.errors.UnhealthyBackendException;
import io.middleware4j.errors.VersionMismatchException;
import io.middleware4j.event.Event;
import io.middleware4j.service.ServiceDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplicatedCrudServiceTest {

    private static final VersionStamp V1 = VersionStamp.of(1, 0);
    private static final List<Map<String, Object>> DEFAULTS = List.of(
            Map.of("id", 1, "name", "admins", "builtin", true),
            Map.of("id", 2, "name", "users", "builtin", true));

    private InMemoryReplicatedBackend backend = new InMemoryReplicatedBackend();
    private MiddlewareHarness harness;

    private ReplicatedCrudService service() {
        ServiceDescriptor descriptor = ServiceDescriptor.builder("cluster.groups")
                .datastore("cluster_groups")
                .extend((row, ctx) -> {
                    Map<String, Object> out = new LinkedHashMap<>(row);
                    out.put("display", "@" + row.get("name"));
                    return out;
                })
                .build();
        ReplicatedCrudService service = new ReplicatedCrudService(descriptor, null, backend, V1, DEFAULTS,
                Duration.ZERO, System::nanoTime);
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
    void firstReadShouldSeedDefaults() {
        ReplicatedCrudService groups = service();

        List<Map<String, Object>> rows = groups.query(List.of()).list();

        assertEquals(2, rows.size());
        assertEquals(2, backend.query("cluster.groups").data().size());
        assertEquals(V1, backend.query("cluster.groups").version());
        assertEquals("@admins", groups.query(List.of(Filter.eq("id", 1))).list().get(0).get("display"));
    }

    @Test
    void clusteredMutationsShouldGoToBackendAndAnnounce() {
        ReplicatedCrudService groups = service();
        groups.query(List.of());

        Map<String, Object> created = groups.create(Map.of("name", "ops"));
        Object id = created.get("id");
        Map<String, Object> updated = groups.update(id, Map.of("name", "sre"));
        groups.delete(id);

        assertEquals(3L, id);
        assertEquals("@ops", created.get("display"));
        assertEquals("@sre", updated.get("display"));
        assertEquals(2, backend.query("cluster.groups").data().size());
        List<EventType> types = harness.sent("cluster.groups.query").stream().map(Event::type).toList();
        assertEquals(List.of(EventType.ADDED, EventType.CHANGED, EventType.REMOVED), types);
        assertTrue(harness.datastore.query("cluster_groups", List.of()).isEmpty());
    }

    @Test
    void filtersShouldApplyToExtendedRows() {
        ReplicatedCrudService groups = service();
        groups.query(List.of());

        List<Map<String, Object>> rows = groups.query(List.of(Filter.eq("display", "@users")),
                QueryOptions.defaults()).list();

        assertEquals(1, rows.size());
        assertEquals(2L, rows.get(0).get("id"));
    }

    @Test
    void unreadableStoreShouldServeFilteredDefaults() {
        ReplicatedCrudService groups = service();
        backend.setHealthy(false);
        backend.setLocalHealthy(false);

        List<Map<String, Object>> all = groups.query(List.of()).list();
        List<Map<String, Object>> one = groups.query(List.of(Filter.eq("name", "users"))).list();

        assertEquals(DEFAULTS, all);
        assertEquals(1, one.size());
        assertNull(backend.query("cluster.groups").data());
    }

    @Test
    void failingQueryBehindHealthyCheckShouldServeFilteredDefaults() {
        ReplicatedCrudService groups = service();
        groups.create(Map.of("name", "ops"));
        backend.failReads(new IllegalStateException("backend unreachable"));

        List<Map<String, Object>> all = groups.query(List.of()).list();
        List<Map<String, Object>> one = groups.query(List.of(Filter.eq("name", "admins"))).list();

        assertEquals(DEFAULTS, all);
        assertEquals(List.of(DEFAULTS.get(0)), one);
    }

    @Test
    void unhealthyClusterShouldRefuseWrites() {
        ReplicatedCrudService groups = service();
        groups.query(List.of());
        backend.setHealthy(false);

        assertThrows(UnhealthyBackendException.class, () -> groups.create(Map.of("name", "ops")));
        assertThrows(UnhealthyBackendException.class, () -> groups.delete(1));
        assertEquals(2, backend.query("cluster.groups").data().size());
    }

    @Test
    void versionMismatchShouldReadDefaultsAndRefuseWrites() {
        ReplicatedCrudService groups = service();
        groups.query(List.of());
        groups.create(Map.of("name", "ops"));
        backend.restamp("cluster.groups", VersionStamp.of(1, 1));

        List<Map<String, Object>> rows = groups.query(List.of()).list();

        assertEquals(DEFAULTS, rows);
        assertThrows(VersionMismatchException.class, () -> groups.create(Map.of("name", "dev")));
    }

    @Test
    void failedSeedingShouldStillAnswerWithDefaults() {
        backend = new InMemoryReplicatedBackend() {
            @Override
            public synchronized void batchSet(String name, VersionStamp version, List<Map<String, Object>> entries) {
                throw new IllegalStateException("quorum lost");
            }
        };
        ReplicatedCrudService groups = service();

        List<Map<String, Object>> rows = groups.query(List.of()).list();

        assertEquals(DEFAULTS, rows);
        assertNull(backend.query("cluster.groups").data());
    }

    @Test
    void standaloneNodeShouldUseLocalDatastore() {
        backend.setClustered(false);
        ReplicatedCrudService groups = service();

        Map<String, Object> created = groups.create(Map.of("name", "ops"));

        assertEquals("@ops", created.get("display"));
        assertEquals(1, harness.datastore.query("cluster_groups", List.of()).size());
        assertNull(backend.query("cluster.groups").data());
    }

    @Test
    void defaultsWithoutPrimaryKeyShouldBeRejected() {
        ServiceDescriptor descriptor = ServiceDescriptor.builder("cluster.groups").build();

        assertThrows(IllegalArgumentException.class, () -> new ReplicatedCrudService(descriptor, null, backend, V1,
                List.of(Map.of("name", "nobody"))));
    }

    @Test
    void primaryKeyOtherThanIdShouldBeRejected() {
        ServiceDescriptor descriptor = ServiceDescriptor.builder("cluster.groups").primaryKey("name").build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ReplicatedCrudService(descriptor, null, backend, V1, List.of()));
        assertTrue(e.getMessage().contains("'name'"));
    }
}
