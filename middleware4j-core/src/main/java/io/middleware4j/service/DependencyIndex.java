package io.middleware4j.service;

import io.middleware4j.core.Backref;
import io.middleware4j.datastore.Datastore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store → referencing stores graph, built once from the registered services and the datastore's backrefs.
 * Tables no service was registered for are looked up on first use and cached.
 */
public final class DependencyIndex {
    private static final Logger log = LoggerFactory.getLogger(DependencyIndex.class);

    private final Datastore datastore;
    private final Map<String, Service> servicesByTable;
    private final Map<String, List<Backref>> backrefs = new ConcurrentHashMap<>();

    private DependencyIndex(Datastore datastore, Map<String, Service> servicesByTable) {
        this.datastore = datastore;
        this.servicesByTable = servicesByTable;
    }

    static DependencyIndex build(Collection<Service> services, Datastore datastore) {
        Map<String, Service> byTable = new HashMap<>();
        for (Service service : services) {
            String table = service.descriptor().datastore();
            if (table != null) {
                byTable.putIfAbsent(table, service);
            }
        }
        DependencyIndex index = new DependencyIndex(datastore, Map.copyOf(byTable));
        int edges = 0;
        for (String table : byTable.keySet()) {
            edges += index.backrefsOf(table).size();
        }
        log.info("Dependency index built with tables={}, backrefs={}", byTable.size(), edges);
        return index;
    }

    public Optional<Service> serviceFor(String table) {
        return Optional.ofNullable(servicesByTable.get(table));
    }

    public List<Backref> backrefsOf(String table) {
        return backrefs.computeIfAbsent(table, t -> List.copyOf(datastore.getBackrefs(t)));
    }
}
