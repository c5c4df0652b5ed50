package io.middleware4j.service;

import io.middleware4j.datastore.Datastore;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered services and their methods, resolved by {@code <namespace>.<method>}. Duplicate namespaces and
 * duplicate method names fail at construction.
 */
public class ServiceRegistry {

    public record ResolvedMethod(Service service, MethodDescriptor method) {

        public String fullName() {
            return service.namespace() + "." + method.name();
        }

        public boolean isPrivate() {
            return method.privateMethod() || service.descriptor().privateService();
        }
    }

    private final Map<String, Service> services;
    private final Map<String, ResolvedMethod> methods;
    private volatile DependencyIndex dependencies;

    public ServiceRegistry(List<? extends Service> services) {
        Map<String, Service> byNamespace = new LinkedHashMap<>();
        Map<String, ResolvedMethod> byName = new LinkedHashMap<>();
        for (Service service : services) {
            if (byNamespace.putIfAbsent(service.namespace(), service) != null) {
                throw new IllegalStateException("Duplicate service namespace: " + service.namespace());
            }
            for (MethodDescriptor m : service.methods()) {
                ResolvedMethod resolved = new ResolvedMethod(service, m);
                if (byName.putIfAbsent(resolved.fullName(), resolved) != null) {
                    throw new IllegalStateException("Duplicate method: " + resolved.fullName());
                }
            }
        }
        this.services = Collections.unmodifiableMap(byNamespace);
        this.methods = Collections.unmodifiableMap(byName);
    }

    public Optional<Service> get(String namespace) {
        return Optional.ofNullable(services.get(namespace));
    }

    public Service getRequired(String namespace) {
        Service service = services.get(namespace);
        if (service == null) {
            throw new CallException("Service " + namespace + " does not exist", ErrorCode.ENOMETHOD);
        }
        return service;
    }

    public Collection<Service> all() {
        return services.values();
    }

    public Collection<ResolvedMethod> methods() {
        return methods.values();
    }

    public ResolvedMethod resolve(String method) {
        Objects.requireNonNull(method, "method must not be null");
        ResolvedMethod resolved = methods.get(method);
        if (resolved == null) {
            throw new CallException("Method " + method + " not found", ErrorCode.ENOMETHOD);
        }
        return resolved;
    }

    /**
     * Bind every service to its collaborators. Called once by the middleware.
     */
    public void bindAll(ServiceContext context) {
        for (Service service : services.values()) {
            service.bind(context);
        }
    }

    /**
     * The dependency graph, built on first use.
     */
    public DependencyIndex dependencies(Datastore datastore) {
        DependencyIndex index = dependencies;
        if (index == null) {
            synchronized (this) {
                index = dependencies;
                if (index == null) {
                    index = DependencyIndex.build(services.values(), datastore);
                    dependencies = index;
                }
            }
        }
        return index;
    }
}
