package io.middleware4j.internal.mongo;

import io.middleware4j.core.VersionStamp;
import io.middleware4j.core.VersionedPayload;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.replicated.ReplicatedBackend;
import io.middleware4j.replicated.VersionConflictException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ReplicatedBackend} keeping one {@link ReplicatedStoreDocument} per store name.
 *
 * <p>Every write is a single {@code findAndModify} guarded by the stored version: it matches only when the document
 * carries no version yet or the same {major, minor} as the writer. A guarded upsert that finds a document under a
 * different version collides on {@code _id}, which is reported as {@link VersionConflictException}.
 *
 * <p>Replication itself is left to the MongoDB deployment (replica set). Health is a {@code ping} command.
 */
public class MongoReplicatedBackend implements ReplicatedBackend {
    private static final Logger log = LoggerFactory.getLogger(MongoReplicatedBackend.class);

    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final boolean clustered;

    public MongoReplicatedBackend(MongoTemplate mongoTemplate, boolean clustered) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clustered = clustered;
    }

    @Override
    public boolean clustered() {
        return clustered;
    }

    @Override
    public boolean healthy(String name) {
        return ping();
    }

    @Override
    public boolean localHealthy(String name) {
        return ping();
    }

    private boolean ping() {
        Document reply = mongoTemplate.executeCommand("{ ping: 1 }");
        Object ok = reply.get("ok");
        return ok instanceof Number n && n.doubleValue() == 1.0;
    }

    @Override
    public VersionedPayload<Map<String, Object>> readConfig(String name) {
        ReplicatedStoreDocument doc = find(name);
        if (doc == null || doc.getConfig() == null) {
            return VersionedPayload.empty();
        }
        return new VersionedPayload<>(VersionStamp.fromMap(doc.getVersion()), copy(doc.getConfig()));
    }

    @Override
    public void writeConfig(String name, VersionedPayload<Map<String, Object>> payload) {
        guardedUpsert(name, payload.version(), new Update().set("config", payload.data()));
    }

    @Override
    public VersionedPayload<List<Map<String, Object>>> query(String name) {
        ReplicatedStoreDocument doc = find(name);
        if (doc == null || doc.getEntries() == null) {
            return VersionedPayload.empty();
        }
        List<Map<String, Object>> out = new ArrayList<>(doc.getEntries().size());
        for (Map<String, Object> entry : doc.getEntries().values()) {
            out.add(copy(entry));
        }
        return new VersionedPayload<>(VersionStamp.fromMap(doc.getVersion()), out);
    }

    @Override
    public Map<String, Object> create(String name, VersionedPayload<Map<String, Object>> payload) {
        Map<String, Object> row = new LinkedHashMap<>(payload.data());
        Object id = row.get(ENTRY_ID);
        if (id == null) {
            Document doc = guardedUpsert(name, payload.version(), new Update().inc("lastId", 1L));
            id = ((Number) doc.get("lastId")).longValue();
        }
        id = key(id);
        row.put(ENTRY_ID, id);

        Update update = new Update().set("entries." + field(id), row);
        if (id instanceof Long n) {
            update.max("lastId", n);
        }
        guardedUpsert(name, payload.version(), update);
        log.debug("replicated entry created store={} id={}", name, id);
        return row;
    }

    @Override
    public Map<String, Object> update(String name, Object id, VersionedPayload<Map<String, Object>> payload) {
        Object key = key(id);
        String path = "entries." + field(key);
        Update update = new Update().set("version", payload.version().toMap());
        for (Map.Entry<String, Object> e : payload.data().entrySet()) {
            if (!e.getKey().equals(ENTRY_ID)) {
                update.set(path + "." + e.getKey(), e.getValue());
            }
        }
        Query q = new Query(guard(name, payload.version()).and(path).exists(true));
        Document doc = mongoTemplate.findAndModify(q, update,
                FindAndModifyOptions.options().returnNew(true), Document.class, ReplicatedStoreDocument.COLLECTION);
        if (doc == null) {
            throw missingOrConflict(name, payload.version(), id);
        }
        return copy(doc.get("entries", Document.class).get(field(key), Document.class));
    }

    @Override
    public void delete(String name, VersionStamp version, Object id) {
        String path = "entries." + field(key(id));
        Query q = new Query(guard(name, version).and(path).exists(true));
        Update update = new Update().unset(path).set("version", version.toMap());
        if (mongoTemplate.updateFirst(q, update, ReplicatedStoreDocument.COLLECTION).getMatchedCount() == 0) {
            throw missingOrConflict(name, version, id);
        }
    }

    @Override
    public void batchSet(String name, VersionStamp version, List<Map<String, Object>> entries) {
        // claim the store (or fail on a foreign version) before writing anything
        guardedUpsert(name, version, new Update());
        for (Map<String, Object> entry : entries) {
            create(name, new VersionedPayload<>(version, entry));
        }
    }

    private ReplicatedStoreDocument find(String name) {
        return mongoTemplate.findById(name, ReplicatedStoreDocument.class);
    }

    private static Criteria guard(String name, VersionStamp version) {
        return Criteria.where(ID).is(name).orOperator(
                Criteria.where("version").is(null),
                Criteria.where("version.major").is(version.major()).and("version.minor").is(version.minor())
        );
    }

    // writes go through raw documents so that entry ids stay literal path segments
    private Document guardedUpsert(String name, VersionStamp version, Update update) {
        Objects.requireNonNull(version, "version must not be null");
        update.set("version", version.toMap());
        try {
            return mongoTemplate.findAndModify(new Query(guard(name, version)), update,
                    FindAndModifyOptions.options().returnNew(true).upsert(true), Document.class,
                    ReplicatedStoreDocument.COLLECTION);
        } catch (DuplicateKeyException e) {
            throw new VersionConflictException(name, storedVersion(name));
        }
    }

    private RuntimeException missingOrConflict(String name, VersionStamp version, Object id) {
        VersionStamp stored = storedVersion(name);
        if (stored != null && !stored.equals(version)) {
            return new VersionConflictException(name, stored);
        }
        return new InstanceNotFoundException(name + " " + id + " does not exist");
    }

    private VersionStamp storedVersion(String name) {
        ReplicatedStoreDocument doc = find(name);
        return doc == null ? null : VersionStamp.fromMap(doc.getVersion());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> copy(Map<String, Object> data) {
        return (Map<String, Object>) MongoDatastore.plain(data);
    }

    private static Object key(Object id) {
        Objects.requireNonNull(id, "id must not be null");
        return id instanceof Number n ? (Object) n.longValue() : id;
    }

    private static String field(Object key) {
        String s = String.valueOf(key);
        if (s.isEmpty() || s.contains(".") || s.startsWith("$")) {
            throw new IllegalArgumentException("Invalid entry id: " + key);
        }
        return s;
    }
}
