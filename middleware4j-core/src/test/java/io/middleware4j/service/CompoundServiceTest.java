package io.middleware4j.service;

import io.middleware4j.MiddlewareHarness;
import io.middleware4j.core.ServiceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompoundServiceTest {

    private static final class Extras extends Service {
        Extras(ServiceDescriptor descriptor) {
            super(descriptor);
        }

        @Override
        public List<MethodDescriptor> methods() {
            return List.of(MethodDescriptor.builder("restart", (job, args) -> "restarted " + namespace()).build());
        }
    }

    @Test
    void partsShouldShareNamespaceAndCombineMethods() {
        CrudService crud = new CrudService(ServiceDescriptor.builder("vm").datastore("vms").build());
        Extras extras = new Extras(ServiceDescriptor.builder("vm").build());

        CompoundService vm = new CompoundService(List.of(crud, extras));

        assertEquals(ServiceType.CRUD, vm.type());
        assertEquals("vms", vm.descriptor().datastore());
        assertTrue(vm.methods().stream().anyMatch(m -> m.name().equals("restart")));
        assertTrue(vm.methods().stream().anyMatch(m -> m.name().equals("create")));

        try (MiddlewareHarness harness = new MiddlewareHarness(vm)) {
            assertEquals("restarted vm", harness.middleware.call("vm.restart"));
            harness.middleware.call("vm.create", Map.of("name", "debian"));
            assertEquals(1, ((List<?>) harness.middleware.call("vm.query")).size());
            assertSame(crud, harness.middleware.service("vm", CrudService.class));
        }
    }

    @Test
    void conflictingSettingsShouldFailFast() {
        Extras a = new Extras(ServiceDescriptor.builder("vm").datastore("vms").build());
        Extras b = new Extras(ServiceDescriptor.builder("vm").datastore("machines").build());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new CompoundService(List.of(a, b)));
        assertTrue(e.getMessage().contains("datastore"));
    }

    @Test
    void sameMethodInTwoPartsShouldFailFast() {
        Extras a = new Extras(ServiceDescriptor.builder("vm").build());
        Extras b = new Extras(ServiceDescriptor.builder("vm").build());

        assertThrows(IllegalStateException.class, () -> new CompoundService(List.of(a, b)));
    }

    @Test
    void partsFromDifferentNamespacesShouldBeRejected() {
        Extras a = new Extras(ServiceDescriptor.builder("vm").build());
        CrudService b = new CrudService(ServiceDescriptor.builder("disk").build());

        assertThrows(IllegalStateException.class, () -> new CompoundService(List.of(a, b)));
    }
}
