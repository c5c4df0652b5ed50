package io.middleware4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.Middleware;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.datastore.InMemoryDatastore;
import io.middleware4j.event.EventHub;
import io.middleware4j.internal.DefaultMiddleware;
import io.middleware4j.internal.mongo.MongoDatastore;
import io.middleware4j.internal.mongo.MongoReplicatedBackend;
import io.middleware4j.job.DefaultJobScheduler;
import io.middleware4j.job.JobScheduler;
import io.middleware4j.replicated.InMemoryReplicatedBackend;
import io.middleware4j.replicated.ReplicatedBackend;
import io.middleware4j.service.CoreService;
import io.middleware4j.service.HookRegistry;
import io.middleware4j.service.Service;
import io.middleware4j.service.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the middleware.
 *
 * <p>Storage follows what the context offers: with a {@link MongoTemplate} bean the datastore and the replicated
 * backend are MongoDB-backed, otherwise both are in-memory.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@EnableConfigurationProperties(MiddlewareProperties.class)
@ConditionalOnProperty(prefix = "middleware", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MiddlewareConfig {
    private static final Logger log = LoggerFactory.getLogger(MiddlewareConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public EventHub eventHub() {
        return new EventHub();
    }

    @Bean
    @ConditionalOnMissingBean
    public HookRegistry hookRegistry() {
        return new HookRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(MiddlewareProperties props, EventHub events,
                                     ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultJobScheduler(props, events, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Datastore datastore(ObjectProvider<MongoTemplate> mongoTemplate) {
        MongoTemplate mongo = mongoTemplate.getIfAvailable();
        if (mongo == null) {
            log.info("No MongoTemplate available, using in-memory datastore");
            return new InMemoryDatastore();
        }
        return new MongoDatastore(mongo);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReplicatedBackend replicatedBackend(MiddlewareProperties props,
                                               ObjectProvider<MongoTemplate> mongoTemplate) {
        MongoTemplate mongo = mongoTemplate.getIfAvailable();
        if (mongo == null) {
            InMemoryReplicatedBackend backend = new InMemoryReplicatedBackend();
            backend.setClustered(props.isReplicatedClustered());
            return backend;
        }
        return new MongoReplicatedBackend(mongo, props.isReplicatedClustered());
    }

    @Bean
    @ConditionalOnMissingBean
    public ServiceRegistry serviceRegistry(ObjectProvider<List<Service>> servicesProvider) {
        List<Service> services = new ArrayList<>(servicesProvider.getIfAvailable(List::of));
        boolean hasCore = services.stream().anyMatch(s -> CoreService.NAMESPACE.equals(s.namespace()));
        if (!hasCore) {
            services.add(0, new CoreService());
        }
        return new ServiceRegistry(services);
    }

    @Bean
    @ConditionalOnMissingBean
    public Middleware middleware(MiddlewareProperties props, ServiceRegistry registry, JobScheduler jobs,
                                 EventHub events, HookRegistry hooks, Datastore datastore,
                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new DefaultMiddleware(props, registry, jobs, events, hooks, datastore,
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public MiddlewareLifecycle middlewareLifecycle(Middleware middleware, MiddlewareProperties props) {
        return new MiddlewareLifecycle(middleware, props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    public MiddlewareMongoIndexConfig middlewareMongoIndexConfig(MongoTemplate mongoTemplate, Datastore datastore) {
        return new MiddlewareMongoIndexConfig(mongoTemplate, datastore);
    }

    @Bean
    @ConditionalOnProperty(prefix = "middleware", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton middlewareIndexesInitializer(
            ObjectProvider<MiddlewareMongoIndexConfig> indexConfig) {
        return () -> indexConfig.ifAvailable(MiddlewareMongoIndexConfig::ensureIndexes);
    }
}
