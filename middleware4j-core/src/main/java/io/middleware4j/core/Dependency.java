package io.middleware4j.core;

import java.util.List;
import java.util.Map;

/**
 * One referencing store found by the dependency guard.
 *
 * datastore : referencing table
 * service   : namespace of the service owning that table, or null
 * key       : referencing column (config services only)
 * objects   : referencing rows (CRUD services and bare tables)
 */
public record Dependency(
        String datastore,
        String service,
        String key,
        List<Map<String, Object>> objects
) {
}
