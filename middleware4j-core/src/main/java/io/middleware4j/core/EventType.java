package io.middleware4j.core;

public enum EventType {
    ADDED,
    CHANGED,
    REMOVED
}
