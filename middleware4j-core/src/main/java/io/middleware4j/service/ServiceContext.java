package io.middleware4j.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.Middleware;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.event.EventSink;

/**
 * Collaborators a service reaches through once it is registered.
 */
public record ServiceContext(
        Middleware middleware,
        Datastore datastore,
        HookRegistry hooks,
        EventSink events,
        ServiceRegistry registry,
        ObjectMapper objectMapper
) {
}
