package io.middleware4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.replicated.VersionConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoReplicatedBackendIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final VersionStamp V1 = VersionStamp.of(1, 0);
    private static final VersionStamp V2 = VersionStamp.of(2, 0);

    private MongoTemplate mongoTemplate;
    private MongoReplicatedBackend backend;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "middleware4j_test");
        mongoTemplate.dropCollection(ReplicatedStoreDocument.class);
        backend = new MongoReplicatedBackend(mongoTemplate, true);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ReplicatedStoreDocument.class);
    }

    @Test
    void healthShouldPingTheServer() {
        assertTrue(backend.clustered());
        assertTrue(backend.healthy("ha.settings"));
        assertTrue(backend.localHealthy("ha.settings"));
    }

    @Test
    void configShouldRoundTripWithItsVersion() {
        assertNull(backend.readConfig("ha.settings").data());

        backend.writeConfig("ha.settings", new VersionedPayload<>(V1, Map.of("peer", "10.0.0.2", "port", 7000)));
        backend.writeConfig("ha.settings", new VersionedPayload<>(V1, Map.of("peer", "10.0.0.3", "port", 7000)));

        VersionedPayload<Map<String, Object>> read = backend.readConfig("ha.settings");
        assertEquals(V1, read.version());
        assertEquals("10.0.0.3", read.data().get("peer"));
        assertEquals(7000, read.data().get("port"));
    }

    @Test
    void writeUnderForeignVersionShouldConflictAndLeaveDataAlone() {
        backend.writeConfig("ha.settings", new VersionedPayload<>(V1, Map.of("peer", "10.0.0.2")));

        VersionConflictException e = assertThrows(VersionConflictException.class,
                () -> backend.writeConfig("ha.settings", new VersionedPayload<>(V2, Map.of("peer", "x"))));

        assertEquals(V1, e.stored());
        assertEquals("10.0.0.2", backend.readConfig("ha.settings").data().get("peer"));
    }

    @Test
    void entriesShouldBeCreatedUpdatedAndDeleted() {
        Map<String, Object> first = backend.create("kmip.certs", new VersionedPayload<>(V1, Map.of("name", "a")));
        Map<String, Object> second = backend.create("kmip.certs", new VersionedPayload<>(V1, Map.of("name", "b")));
        assertEquals(1L, first.get("id"));
        assertEquals(2L, second.get("id"));

        Map<String, Object> updated = backend.update("kmip.certs", 2,
                new VersionedPayload<>(V1, Map.of("name", "bb", "enabled", true)));
        assertEquals(Map.of("id", 2L, "name", "bb", "enabled", true), updated);

        backend.delete("kmip.certs", V1, 1);

        VersionedPayload<List<Map<String, Object>>> all = backend.query("kmip.certs");
        assertEquals(V1, all.version());
        assertEquals(List.of(updated), all.data());

        assertThrows(InstanceNotFoundException.class,
                () -> backend.update("kmip.certs", 1, new VersionedPayload<>(V1, Map.of("name", "x"))));
        assertThrows(VersionConflictException.class, () -> backend.delete("kmip.certs", V2, 2));
    }

    @Test
    void batchSetShouldKeepAllocationAheadOfExplicitIds() {
        backend.batchSet("kmip.certs", V1, List.of(Map.of("id", 5, "name", "a"), Map.of("id", 9, "name", "b")));

        Map<String, Object> next = backend.create("kmip.certs", new VersionedPayload<>(V1, Map.of("name", "c")));

        assertEquals(10L, next.get("id"));
        assertEquals(3, backend.query("kmip.certs").data().size());
        assertThrows(VersionConflictException.class,
                () -> backend.batchSet("kmip.certs", V2, List.of(Map.of("name", "d"))));
    }
}
