package io.middleware4j.event;

@FunctionalInterface
public interface EventListener {
    void onEvent(Event event);
}
