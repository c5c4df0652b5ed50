package io.middleware4j.core;

public enum ServiceType {
    SERVICE,
    CONFIG,
    CRUD
}
