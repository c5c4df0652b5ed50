package io.middleware4j.service;

import io.middleware4j.MiddlewareHarness;
import io.middleware4j.errors.ValidationError;
import io.middleware4j.errors.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    private static final EntrySchema SMB_ENTRY = EntrySchema.builder("smb_entry")
            .field("id", Long.class, false)
            .field("netbiosname", String.class, true)
            .field("workgroup", String.class, false)
            .field("guest", String.class, false, true)
            .build();

    private ConfigService smb;
    private MiddlewareHarness harness;

    @BeforeEach
    void setUp() {
        smb = new ConfigService(ServiceDescriptor.builder("smb")
                .datastore("services.cifs")
                .datastorePrefix("cifs_srv_")
                .extend((row, ctx) -> {
                    Map<String, Object> out = new LinkedHashMap<>(row);
                    out.put("netbiosname_upper", String.valueOf(row.get("netbiosname")).toUpperCase());
                    return out;
                })
                .build(), SMB_ENTRY);
        harness = new MiddlewareHarness(smb);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void firstReadShouldInsertSingleRow() {
        Map<String, Object> config = smb.config();

        assertEquals(1L, config.get("id"));
        assertEquals("NULL", config.get("netbiosname_upper"));
        assertEquals(1, harness.datastore.query("services.cifs", List.of()).size());
    }

    @Test
    void concurrentFirstReadsShouldInsertExactlyOneRow() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Map<String, Object>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Map<String, Object>> task = () -> {
                    go.await();
                    return smb.config();
                };
                results.add(pool.submit(task));
            }
            go.countDown();
            for (Future<Map<String, Object>> r : results) {
                assertEquals(1L, r.get(5, TimeUnit.SECONDS).get("id"));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, harness.datastore.query("services.cifs", List.of()).size());
    }

    @Test
    void updateShouldMergeStoreWithPrefixAndReturnExtendedConfig() {
        smb.update(Map.of("netbiosname", "truenas", "workgroup", "WORKGROUP"));
        Map<String, Object> result = smb.update(Map.of("workgroup", "HOME"));

        assertEquals("truenas", result.get("netbiosname"));
        assertEquals("HOME", result.get("workgroup"));
        assertEquals("TRUENAS", result.get("netbiosname_upper"));

        Map<String, Object> raw = harness.datastore.query("services.cifs", List.of()).get(0);
        assertEquals("HOME", raw.get("cifs_srv_workgroup"));
    }

    @Test
    void updateShouldReportAllValidationErrorsWithoutWriting() {
        smb.update(Map.of("netbiosname", "nas"));

        Map<String, Object> bad = new LinkedHashMap<>();
        bad.put("workgroup", 5);
        bad.put("bogus", true);
        bad.put("netbiosname", null);
        ValidationException e = assertThrows(ValidationException.class, () -> smb.update(bad));

        List<String> attributes = e.errors().stream().map(ValidationError::attribute).toList();
        assertEquals(List.of("smb_update.workgroup", "smb_update.bogus", "smb_update.netbiosname"), attributes);
        assertEquals("nas", smb.config().get("netbiosname"));
    }

    @Test
    void nullableFieldShouldAcceptNull() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("guest", null);

        Map<String, Object> result = smb.update(data);

        assertTrue(result.containsKey("guest"));
    }

    @Test
    void postUpdateHookFailureShouldPropagateAfterCommit() {
        List<Object> seen = new ArrayList<>();
        harness.hooks.register("smb.post_update", args -> seen.add(args.get(0)));
        harness.hooks.register("smb.post_update", args -> {
            throw new IllegalStateException("reload failed");
        });

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> smb.update(Map.of("netbiosname", "after")));

        assertEquals("reload failed", e.getMessage());
        assertEquals(1, seen.size());
        assertEquals("after", smb.config().get("netbiosname"));
    }

    @Test
    void methodsShouldBeCallableThroughMiddleware() {
        harness.middleware.call("smb.update", Map.of("netbiosname", "remote"));

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) harness.middleware.call("smb.config");
        assertEquals("remote", config.get("netbiosname"));
    }
}
