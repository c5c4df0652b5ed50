package io.middleware4j.service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static, per-service configuration. Immutable once built and shared by every operation of the service.
 *
 * <ul>
 *   <li>namespace: method prefix, e.g. {@code "pool.scrub"}</li>
 *   <li>datastore / datastorePrefix: backing table and the column prefix it uses</li>
 *   <li>extend / extendContext: record transform applied before anything is returned</li>
 *   <li>primaryKey: primary key field, {@code "id"} by default</li>
 *   <li>eventRegister / eventSend: register {@code <namespace>.query} and emit ADDED/CHANGED/REMOVED on it</li>
 *   <li>privateService: hide every method of the service from external callers</li>
 *   <li>deleteDependencyGuard / ignoredDependencies: refuse deletes while other stores reference the entry</li>
 * </ul>
 */
public final class ServiceDescriptor {

    private final String namespace;
    private final String datastore;
    private final String datastorePrefix;
    private final ExtendTransform extend;
    private final ExtendContextBuilder extendContext;
    private final String primaryKey;
    private final boolean eventRegister;
    private final boolean eventSend;
    private final boolean privateService;
    private final String verboseName;
    private final boolean deleteDependencyGuard;
    private final Set<String> ignoredDependencies;

    private ServiceDescriptor(Builder b) {
        this.namespace = b.namespace;
        this.datastore = b.datastore;
        this.datastorePrefix = b.datastorePrefix;
        this.extend = b.extend;
        this.extendContext = b.extendContext;
        this.primaryKey = b.primaryKey;
        this.eventRegister = b.eventRegister;
        this.eventSend = b.eventSend;
        this.privateService = b.privateService;
        this.verboseName = b.verboseName != null ? b.verboseName : defaultVerboseName(b.namespace);
        this.deleteDependencyGuard = b.deleteDependencyGuard;
        this.ignoredDependencies = Set.copyOf(b.ignoredDependencies);
    }

    public static Builder builder(String namespace) {
        return new Builder(namespace);
    }

    public String namespace() {
        return namespace;
    }

    public String datastore() {
        return datastore;
    }

    public String datastorePrefix() {
        return datastorePrefix;
    }

    public ExtendTransform extend() {
        return extend;
    }

    public ExtendContextBuilder extendContext() {
        return extendContext;
    }

    public String primaryKey() {
        return primaryKey;
    }

    public boolean eventRegister() {
        return eventRegister;
    }

    public boolean eventSend() {
        return eventSend;
    }

    public boolean privateService() {
        return privateService;
    }

    public String verboseName() {
        return verboseName;
    }

    public boolean deleteDependencyGuard() {
        return deleteDependencyGuard;
    }

    public Set<String> ignoredDependencies() {
        return ignoredDependencies;
    }

    /**
     * Settings as a flat map, used to detect conflicting parts of a {@link CompoundService}.
     */
    Map<String, Object> settings() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("datastore", datastore);
        m.put("datastorePrefix", datastorePrefix);
        m.put("extend", extend);
        m.put("extendContext", extendContext);
        m.put("primaryKey", primaryKey);
        m.put("eventRegister", eventRegister);
        m.put("eventSend", eventSend);
        m.put("privateService", privateService);
        m.put("verboseName", verboseName);
        m.put("deleteDependencyGuard", deleteDependencyGuard);
        m.put("ignoredDependencies", ignoredDependencies);
        return m;
    }

    static ServiceDescriptor fromSettings(String namespace, Map<String, Object> s) {
        Builder b = builder(namespace)
                .datastore((String) s.get("datastore"))
                .datastorePrefix((String) s.get("datastorePrefix"))
                .extend((ExtendTransform) s.get("extend"))
                .extendContext((ExtendContextBuilder) s.get("extendContext"))
                .primaryKey((String) s.get("primaryKey"))
                .eventRegister((Boolean) s.get("eventRegister"))
                .eventSend((Boolean) s.get("eventSend"))
                .privateService((Boolean) s.get("privateService"))
                .verboseName((String) s.get("verboseName"))
                .deleteDependencyGuard((Boolean) s.get("deleteDependencyGuard"));
        @SuppressWarnings("unchecked")
        Set<String> ignored = (Set<String>) s.get("ignoredDependencies");
        return b.ignoreDependencies(List.copyOf(ignored)).build();
    }

    private static String defaultVerboseName(String namespace) {
        String[] parts = namespace.split("[._]");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ServiceDescriptor{namespace=" + namespace + ", datastore=" + datastore + "}";
    }

    public static final class Builder {
        private final String namespace;
        private String datastore;
        private String datastorePrefix;
        private ExtendTransform extend;
        private ExtendContextBuilder extendContext;
        private String primaryKey = "id";
        private boolean eventRegister = true;
        private boolean eventSend = true;
        private boolean privateService;
        private String verboseName;
        private boolean deleteDependencyGuard = true;
        private final Set<String> ignoredDependencies = new LinkedHashSet<>();

        private Builder(String namespace) {
            Objects.requireNonNull(namespace, "namespace must not be null");
            if (namespace.isBlank()) {
                throw new IllegalArgumentException("namespace must not be blank");
            }
            this.namespace = namespace;
        }

        public Builder datastore(String datastore) {
            this.datastore = datastore;
            return this;
        }

        public Builder datastorePrefix(String datastorePrefix) {
            this.datastorePrefix = datastorePrefix;
            return this;
        }

        public Builder extend(ExtendTransform extend) {
            this.extend = extend;
            return this;
        }

        public Builder extendContext(ExtendContextBuilder extendContext) {
            this.extendContext = extendContext;
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = Objects.requireNonNull(primaryKey, "primaryKey must not be null");
            return this;
        }

        public Builder eventRegister(boolean eventRegister) {
            this.eventRegister = eventRegister;
            return this;
        }

        public Builder eventSend(boolean eventSend) {
            this.eventSend = eventSend;
            return this;
        }

        public Builder privateService(boolean privateService) {
            this.privateService = privateService;
            return this;
        }

        public Builder verboseName(String verboseName) {
            this.verboseName = verboseName;
            return this;
        }

        public Builder deleteDependencyGuard(boolean deleteDependencyGuard) {
            this.deleteDependencyGuard = deleteDependencyGuard;
            return this;
        }

        /**
         * Tables or service namespaces whose references never block a delete.
         */
        public Builder ignoreDependencies(List<String> names) {
            this.ignoredDependencies.addAll(names);
            return this;
        }

        public ServiceDescriptor build() {
            if (extendContext != null && extend == null) {
                throw new IllegalStateException("extendContext requires an extend transform");
            }
            return new ServiceDescriptor(this);
        }
    }
}
