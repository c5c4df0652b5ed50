package io.middleware4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.Middleware;
import io.middleware4j.datastore.Datastore;
import io.middleware4j.datastore.InMemoryDatastore;
import io.middleware4j.internal.mongo.MongoDatastore;
import io.middleware4j.internal.mongo.MongoReplicatedBackend;
import io.middleware4j.replicated.InMemoryReplicatedBackend;
import io.middleware4j.replicated.ReplicatedBackend;
import io.middleware4j.service.ConfigService;
import io.middleware4j.service.Service;
import io.middleware4j.service.ServiceDescriptor;
import io.middleware4j.service.ServiceRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MiddlewareAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MiddlewareConfig.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean("smbService", Service.class, () -> new ConfigService(
                    ServiceDescriptor.builder("smb").datastore("services.cifs").build()))
            .withPropertyValues(
                    "middleware.thread-pool-size=2",
                    "middleware.process-pool-size=1",
                    "middleware.shutdown-timeout=2s"
            );

    @Test
    void shouldAutoConfigureInMemoryMiddlewareWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Middleware.class);
            assertThat(context).hasSingleBean(MiddlewareLifecycle.class);
            assertThat(context).hasSingleBean(MiddlewareProperties.class);
            assertThat(context).doesNotHaveBean(MiddlewareMongoIndexConfig.class);
            assertThat(context.getBean(Datastore.class)).isInstanceOf(InMemoryDatastore.class);
            assertThat(context.getBean(ReplicatedBackend.class)).isInstanceOf(InMemoryReplicatedBackend.class);
            assertThat(context.getBean(MiddlewareProperties.class).getThreadPoolSize()).isEqualTo(2);

            ServiceRegistry registry = context.getBean(ServiceRegistry.class);
            assertThat(registry.get("core")).isPresent();
            assertThat(registry.get("smb")).isPresent();
            assertThat(context.getBean(MiddlewareLifecycle.class).isRunning()).isTrue();
            assertThat(context.getBean(MiddlewareLifecycle.class).getPhase()).isEqualTo(MiddlewareLifecycle.PHASE);

            Middleware middleware = context.getBean(Middleware.class);
            assertThat(middleware.call("core.ping")).isEqualTo("pong");
            middleware.call("smb.update", Map.of("netbiosname", "nas"));
            @SuppressWarnings("unchecked")
            Map<String, Object> config = (Map<String, Object>) middleware.call("smb.config");
            assertThat(config).containsEntry("netbiosname", "nas");
        });
    }

    @Test
    void shouldUseMongoStorageWhenTemplateIsAvailable() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .run(context -> {
                    assertThat(context.getBean(Datastore.class)).isInstanceOf(MongoDatastore.class);
                    assertThat(context.getBean(ReplicatedBackend.class)).isInstanceOf(MongoReplicatedBackend.class);
                    assertThat(context).hasSingleBean(MiddlewareMongoIndexConfig.class);
                    assertThat(context).doesNotHaveBean("middlewareIndexesInitializer");
                });
    }

    @Test
    void shouldHonorReplicatedClusteredFlag() {
        contextRunner
                .withPropertyValues("middleware.replicated-clustered=false")
                .run(context -> assertThat(context.getBean(ReplicatedBackend.class).clustered()).isFalse());
    }

    @Test
    void shouldEnsureBackrefIndexesWhenEnabled() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        IndexOperations indexOps = mock(IndexOperations.class);
        when(mongoTemplate.indexOps("share_acls")).thenReturn(indexOps);

        contextRunner
                .withBean(MongoTemplate.class, () -> mongoTemplate)
                .withBean(Datastore.class, () -> new MongoDatastore(mongoTemplate)
                        .declareBackref("shares", "share_acls", "share_id"))
                .withPropertyValues("middleware.ensure-indexes-on-startup=true")
                .run(context -> {
                    assertThat(context).hasBean("middlewareIndexesInitializer");
                    verify(indexOps).ensureIndex(any(Index.class));
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("middleware.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(Middleware.class);
                    assertThat(context).doesNotHaveBean(ServiceRegistry.class);
                });
    }
}
