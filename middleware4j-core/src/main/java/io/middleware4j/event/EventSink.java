package io.middleware4j.event;

import io.middleware4j.core.EventType;

import java.util.Map;

/**
 * Notification boundary.
 */
public interface EventSink {

    void send(String name, EventType type, Object id, Map<String, Object> fields);
}
