package io.middleware4j.config;

import io.middleware4j.core.Backref;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.internal.mongo.MongoDatastore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB index definitions for the middleware datastore.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code middleware.ensure-indexes-on-startup=true}. In production they are usually managed by migrations or ops
 * scripts.
 *
 * <p>Primary keys live in {@code _id}, and replicated stores are keyed by name in {@code _id}, so both are covered by
 * MongoDB's implicit index. What remains are the referencing columns of every declared backref: the delete
 * dependency check queries them by equality.
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * // backref shares &lt;- share_acls.share_id
 * db.share_acls.createIndex({ share_id: 1 }, { name: "idx_backref_share_id" });
 * </pre>
 */
public class MiddlewareMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(MiddlewareMongoIndexConfig.class);

    public static final String IDX_BACKREF_PREFIX = "idx_backref_";

    private final MongoTemplate mongoTemplate;
    private final Datastore datastore;

    public MiddlewareMongoIndexConfig(MongoTemplate mongoTemplate, Datastore datastore) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.datastore = Objects.requireNonNull(datastore, "datastore must not be null");
    }

    /**
     * Manually ensure the backref indexes. Does nothing when the datastore is not MongoDB-backed.
     */
    public void ensureIndexes() {
        List<Backref> refs = backrefs();
        for (Backref ref : refs) {
            mongoTemplate.indexOps(ref.table()).ensureIndex(backrefIndex(ref.column()));
        }
        log.info("Middleware indexes ensured count={}", refs.size());
    }

    /**
     * Every distinct referencing column known to the datastore.
     */
    public List<Backref> backrefs() {
        if (!(datastore instanceof MongoDatastore mongo)) {
            return List.of();
        }
        List<Backref> out = new ArrayList<>();
        for (Map.Entry<String, List<Backref>> e : mongo.backrefs().entrySet()) {
            for (Backref ref : e.getValue()) {
                if (!out.contains(ref)) {
                    out.add(ref);
                }
            }
        }
        return out;
    }

    /**
     * Equality lookup on a referencing column.
     * Keys: column ASC
     */
    public static Index backrefIndex(String column) {
        Objects.requireNonNull(column, "column must not be null");
        return new Index()
                .on(column, Sort.Direction.ASC)
                .named(IDX_BACKREF_PREFIX + column);
    }
}
