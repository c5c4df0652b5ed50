package io.middleware4j.job;

import io.middleware4j.core.PipeKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Pipes bound to one job. The caller attaches them before submission or, when the job opted out of the pipe
 * precheck, before the job body probes for them.
 */
public final class Pipes {

    private final Map<PipeKind, Pipe> pipes = new EnumMap<>(PipeKind.class);

    public static Pipes none() {
        return new Pipes();
    }

    public static Pipes input(Pipe input) {
        return new Pipes().attach(PipeKind.INPUT, input);
    }

    public static Pipes output(Pipe output) {
        return new Pipes().attach(PipeKind.OUTPUT, output);
    }

    public synchronized Pipes attach(PipeKind kind, Pipe pipe) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(pipe, "pipe must not be null");
        pipes.put(kind, pipe);
        return this;
    }

    public synchronized Pipe get(PipeKind kind) {
        return pipes.get(kind);
    }

    public synchronized boolean has(PipeKind kind) {
        return pipes.containsKey(kind);
    }

    public Pipe input() {
        return get(PipeKind.INPUT);
    }

    public Pipe output() {
        return get(PipeKind.OUTPUT);
    }
}
