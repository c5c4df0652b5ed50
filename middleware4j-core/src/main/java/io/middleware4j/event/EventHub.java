package io.middleware4j.event;

import io.middleware4j.core.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process {@link EventSink} fanning events out to subscribers.
 *
 * <p>Delivery is synchronous on the sending thread. A failing subscriber is logged and skipped; it never fails
 * the mutation that produced the event.
 */
public class EventHub implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(EventHub.class);

    /**
     * Subscribing to this name receives every event.
     */
    public static final String ALL = "*";

    private final Map<String, String> registered = new ConcurrentHashMap<>();
    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();

    /**
     * Declare an event so it can be listed; sending an unregistered event is still allowed.
     */
    public void register(String name, String description) {
        Objects.requireNonNull(name, "name must not be null");
        registered.put(name, description == null ? "" : description);
    }

    public Map<String, String> registeredEvents() {
        return new LinkedHashMap<>(registered);
    }

    public void subscribe(String name, EventListener listener) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.computeIfAbsent(name, n -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public void unsubscribe(String name, EventListener listener) {
        List<EventListener> l = listeners.get(name);
        if (l != null) {
            l.remove(listener);
        }
    }

    @Override
    public void send(String name, EventType type, Object id, Map<String, Object> fields) {
        Event event = new Event(name, type, id, fields);
        log.debug("event name={} type={} id={}", name, type, id);
        deliver(listeners.get(name), event);
        deliver(listeners.get(ALL), event);
    }

    private void deliver(List<EventListener> targets, Event event) {
        if (targets == null) {
            return;
        }
        for (EventListener listener : targets) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("event listener failed name={} type={} msg={}", event.name(), event.type(), e.getMessage(), e);
            }
        }
    }
}
