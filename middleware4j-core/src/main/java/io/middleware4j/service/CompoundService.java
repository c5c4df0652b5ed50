package io.middleware4j.service;

import io.middleware4j.core.ServiceType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Several service parts exposed under one namespace.
 *
 * <p>Settings a part changed from the defaults must agree across parts, and method names must be unique; both
 * are checked when the compound is built.
 */
public class CompoundService extends Service {

    private final List<Service> parts;
    private final List<MethodDescriptor> methods;
    private final ServiceType type;

    public CompoundService(List<? extends Service> parts) {
        super(mergeDescriptors(parts));
        this.parts = List.copyOf(parts);

        Map<String, MethodDescriptor> byName = new LinkedHashMap<>();
        ServiceType merged = ServiceType.SERVICE;
        for (Service part : parts) {
            for (MethodDescriptor m : part.methods()) {
                if (byName.putIfAbsent(m.name(), m) != null) {
                    throw new IllegalStateException(
                            namespace() + ": method " + m.name() + " is declared by more than one part");
                }
            }
            if (part.type() != ServiceType.SERVICE) {
                if (merged != ServiceType.SERVICE && merged != part.type()) {
                    throw new IllegalStateException(namespace() + ": parts mix " + merged + " and " + part.type());
                }
                merged = part.type();
            }
        }
        this.methods = List.copyOf(byName.values());
        this.type = merged;
    }

    private static ServiceDescriptor mergeDescriptors(List<? extends Service> parts) {
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("a compound service needs at least one part");
        }
        String namespace = parts.get(0).namespace();
        Map<String, Object> defaults = ServiceDescriptor.builder(namespace).build().settings();
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        Map<String, String> setBy = new LinkedHashMap<>();

        for (Service part : parts) {
            if (!part.namespace().equals(namespace)) {
                throw new IllegalStateException("Compound parts disagree on namespace: "
                        + namespace + " vs " + part.namespace());
            }
            for (Map.Entry<String, Object> e : part.descriptor().settings().entrySet()) {
                if (Objects.equals(e.getValue(), defaults.get(e.getKey()))) {
                    continue;
                }
                String previous = setBy.putIfAbsent(e.getKey(), part.getClass().getSimpleName());
                if (previous != null && !Objects.equals(merged.get(e.getKey()), e.getValue())) {
                    throw new IllegalStateException(namespace + ": " + e.getKey() + " conflicts between "
                            + previous + " and " + part.getClass().getSimpleName());
                }
                merged.put(e.getKey(), e.getValue());
            }
        }
        return ServiceDescriptor.fromSettings(namespace, merged);
    }

    public List<Service> parts() {
        return parts;
    }

    @Override
    public ServiceType type() {
        return type;
    }

    @Override
    public List<MethodDescriptor> methods() {
        return new ArrayList<>(methods);
    }

    @Override
    public void bind(ServiceContext context) {
        super.bind(context);
        for (Service part : parts) {
            part.bind(context);
        }
    }
}
