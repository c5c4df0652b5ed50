package io.middleware4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;

/**
 * Mongo document model for one replicated store: either a single config record or a collection of entries
 * keyed by their id.
 */
@Document(collection = ReplicatedStoreDocument.COLLECTION)
public class ReplicatedStoreDocument {

    public static final String COLLECTION = "replicated_stores";

    @Id
    private String name;

    private Map<String, Object> version;
    private Map<String, Object> config;
    private Map<String, Map<String, Object>> entries;
    private long lastId;

    public ReplicatedStoreDocument() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getVersion() {
        return version;
    }

    public void setVersion(Map<String, Object> version) {
        this.version = version;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }

    public Map<String, Map<String, Object>> getEntries() {
        return entries;
    }

    public void setEntries(Map<String, Map<String, Object>> entries) {
        this.entries = entries;
    }

    public long getLastId() {
        return lastId;
    }

    public void setLastId(long lastId) {
        this.lastId = lastId;
    }
}
