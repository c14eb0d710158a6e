package io.tenantq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.tenantq.TaskExecution;
import io.tenantq.TaskHandler;
import io.tenantq.TaskQueue;
import io.tenantq.core.TaskHandlerRegistry;
import io.tenantq.internal.mongo.MongoTenantDirectory;
import io.tenantq.internal.mongo.TenantDocument;
import io.tenantq.isolation.IsolationEnforcer;
import io.tenantq.spi.TaskEventPublisher;
import io.tenantq.tenant.TenantContextResolver;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatus;
import io.tenantq.tenant.TenantStatusCache;
import io.tenantq.tenant.TenantTier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TaskQueueAutoConfigurationTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TaskQueueAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mongoTemplate)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(TaskHandler.class, DemoTaskHandler::new)
            .withPropertyValues(
                    "tenantq.worker-id=test-worker",
                    "tenantq.worker-concurrency=2",
                    "tenantq.poll-interval=500ms",
                    "tenantq.lock-lifetime=5s",
                    "tenantq.default-timeout=2s",
                    "tenantq.scheduler-enabled=false"
            );

    @Test
    void shouldAutoConfigureTaskQueueBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TaskQueue.class);
            assertThat(context).hasSingleBean(TaskQueueLifecycle.class);
            assertThat(context).hasSingleBean(TaskQueueProperties.class);
            assertThat(context).hasSingleBean(TenantContextResolver.class);
            assertThat(context).hasSingleBean(IsolationEnforcer.class);
            assertThat(context).hasSingleBean(TaskEventPublisher.class);
            assertThat(context).doesNotHaveBean(SmartInitializingSingleton.class);

            assertThat(context.getBean(TaskHandlerRegistry.class).find("demo_task")).isPresent();
            assertThat(context.getBean(TaskQueueLifecycle.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindPropertiesUnderTenantqPrefix() {
        contextRunner.run(context -> {
            TaskQueueProperties props = context.getBean(TaskQueueProperties.class);
            assertThat(props.getWorkerId()).isEqualTo("test-worker");
            assertThat(props.getWorkerConcurrency()).isEqualTo(2);
            assertThat(props.getPollInterval()).isEqualTo(Duration.ofMillis(500));
            assertThat(props.getLockLifetime()).isEqualTo(Duration.ofSeconds(5));
            assertThat(props.getDefaultTimeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(props.getTenantHeader()).isEqualTo("X-Tenant-ID");
        });
    }

    @Test
    void shouldApplyTenantStatusSignalsToTheStatusCache() {
        TenantDocument active = TenantDocument.from(
                new TenantRecord("org-a", "acme", TenantTier.BASIC, TenantStatus.ACTIVE, Set.of()));
        TenantDocument suspended = TenantDocument.from(
                new TenantRecord("org-a", "acme", TenantTier.BASIC, TenantStatus.SUSPENDED, Set.of()));
        when(mongoTemplate.findById(eq("org-a"), eq(TenantDocument.class))).thenReturn(active, suspended);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(TenantDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        contextRunner.run(context -> {
            TenantStatusCache cache = context.getBean(TenantStatusCache.class);
            assertThat(cache.lookup("org-a")).map(TenantRecord::status).contains(TenantStatus.ACTIVE);

            context.getBean(MongoTenantDirectory.class).updateStatus("org-a", TenantStatus.SUSPENDED);

            assertThat(cache.lookup("org-a")).map(TenantRecord::status).contains(TenantStatus.SUSPENDED);
        });
    }

    @Test
    void shouldFailStartupWhenDefaultTimeoutOutlivesTheLease() {
        contextRunner
                .withPropertyValues("tenantq.default-timeout=5s")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(IllegalArgumentException.class)
                            .hasStackTraceContaining("must be shorter than tenantq.lockLifetime");
                });
    }

    @Test
    void shouldCreateIndexInitializerOnlyWhenRequested() {
        contextRunner
                .withPropertyValues("tenantq.ensure-indexes-on-startup=true")
                .run(context -> assertThat(context).hasSingleBean(SmartInitializingSingleton.class));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("tenantq.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(TaskQueue.class);
                    assertThat(context).doesNotHaveBean(TaskQueueLifecycle.class);
                });
    }

    @Test
    void shouldKeepUserDefinedTaskQueue() {
        TaskQueue custom = mock(TaskQueue.class);
        contextRunner
                .withBean("customTaskQueue", TaskQueue.class, () -> custom)
                .run(context -> assertThat(context.getBean(TaskQueue.class)).isSameAs(custom));
    }

    static class DemoTaskHandler implements TaskHandler<String> {
        @Override
        public String taskType() {
            return "demo_task";
        }

        @Override
        public Class<String> payloadClass() {
            return String.class;
        }

        @Override
        public Object execute(String payload, TaskExecution execution) {
            // no-op for context bootstrap test
            return null;
        }
    }
}
