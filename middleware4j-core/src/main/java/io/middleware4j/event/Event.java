package io.middleware4j.event;

import io.middleware4j.core.EventType;

import java.util.Map;

/**
 * A change notification, e.g. {@code pool.query ADDED id=3 fields={...}}.
 * fields is null for REMOVED.
 */
public record Event(String name, EventType type, Object id, Map<String, Object> fields) {
}
