package io.middleware4j.core;

public enum PipeKind {
    INPUT,
    OUTPUT
}
