package io.middleware4j.service;

import io.middleware4j.Middleware;
import io.middleware4j.core.ServiceType;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.errors.ValidationException;
import io.middleware4j.event.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every service. A service is a named group of methods sharing one {@link ServiceDescriptor}.
 */
public abstract class Service {

    private final ServiceDescriptor descriptor;
    private volatile ServiceContext context;

    protected Service(ServiceDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
    }

    public ServiceDescriptor descriptor() {
        return descriptor;
    }

    public String namespace() {
        return descriptor.namespace();
    }

    public ServiceType type() {
        return ServiceType.SERVICE;
    }

    /**
     * Methods exposed under this service's namespace.
     */
    public abstract List<MethodDescriptor> methods();

    /**
     * Called once by the registry.
     */
    public void bind(ServiceContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    protected ServiceContext context() {
        ServiceContext c = context;
        if (c == null) {
            throw new IllegalStateException("Service " + namespace() + " is not registered");
        }
        return c;
    }

    protected Middleware middleware() {
        return context().middleware();
    }

    protected Datastore datastore() {
        return context().datastore();
    }

    protected HookRegistry hooks() {
        return context().hooks();
    }

    protected EventSink events() {
        return context().events();
    }

    /**
     * Pass rows through the extend transform, building the extend context once for the whole batch.
     */
    protected List<Map<String, Object>> extendAll(List<Map<String, Object>> rows, Map<String, Object> extra) {
        ExtendTransform extend = descriptor.extend();
        if (extend == null) {
            return rows;
        }
        try {
            Object ctx = descriptor.extendContext() == null ? null : descriptor.extendContext().build(rows, extra);
            List<Map<String, Object>> out = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                out.add(extend.extend(row, ctx));
            }
            return out;
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CallException(namespace() + ": extend failed: " + e.getMessage(), ErrorCode.EFAULT, e);
        }
    }

    protected Map<String, Object> extendOne(Map<String, Object> row) {
        return extendAll(List.of(row), Map.of()).get(0);
    }

    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mapArg(List<Object> args, int index, String name) {
        Object value = index < args.size() ? args.get(index) : null;
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ValidationException(name, "Not a dictionary");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Argument {@code index} converted to {@code type}, e.g. a map into a typed request object.
     */
    protected <T> T argAs(List<Object> args, int index, Class<T> type) {
        Object value = arg(args, index);
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return context().objectMapper().convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("args." + index, "Not a valid " + type.getSimpleName() + ": " + e.getMessage());
        }
    }

    protected static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{namespace=" + namespace() + "}";
    }
}
