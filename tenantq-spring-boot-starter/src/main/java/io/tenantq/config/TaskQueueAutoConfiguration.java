package io.tenantq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tenantq.TaskHandler;
import io.tenantq.TaskQueue;
import io.tenantq.core.TaskHandlerRegistry;
import io.tenantq.internal.DefaultTaskQueue;
import io.tenantq.internal.mongo.MongoTaskQueueStores;
import io.tenantq.internal.mongo.MongoTenantDirectory;
import io.tenantq.isolation.IsolationEnforcer;
import io.tenantq.schedule.LoggingSchedulerListener;
import io.tenantq.schedule.SchedulerListener;
import io.tenantq.spi.TaskEventPublisher;
import io.tenantq.spi.TaskQueueStores;
import io.tenantq.tenant.TenantContextResolver;
import io.tenantq.tenant.TenantStatusCache;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the tenant task queue.
 */
@AutoConfiguration
@ConditionalOnClass({TaskQueue.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "tenantq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TaskQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "tenantq")
    public TaskQueueProperties taskQueueProperties() {
        return new TaskQueueProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock taskQueueClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoTenantDirectory mongoTenantDirectory(MongoTemplate mongoTemplate) {
        return new MongoTenantDirectory(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected TaskQueueStores taskQueueStores(MongoTemplate mongoTemplate, MongoTenantDirectory tenantDirectory) {
        return MongoTaskQueueStores.create(mongoTemplate, tenantDirectory);
    }

    @Bean
    @ConditionalOnMissingBean
    protected TaskQueueMongoIndexConfig taskQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new TaskQueueMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskHandlerRegistry taskHandlerRegistry(ObjectProvider<List<TaskHandler<?>>> handlersProvider) {
        List<TaskHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new TaskHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantStatusCache tenantStatusCache(TaskQueueStores stores,
                                               MongoTenantDirectory tenantDirectory,
                                               TaskQueueProperties props,
                                               Clock clock) {
        TenantStatusCache cache = new TenantStatusCache(stores.tenantDirectory(), props.getTenantCacheTtl(), clock);
        tenantDirectory.addListener(cache);
        return cache;
    }

    @Bean
    @ConditionalOnMissingBean
    public IsolationEnforcer isolationEnforcer(TenantStatusCache statusCache) {
        return new IsolationEnforcer(statusCache);
    }

    @Bean
    @ConditionalOnMissingBean
    public TenantContextResolver tenantContextResolver(TaskQueueProperties props,
                                                       TenantStatusCache statusCache,
                                                       TaskQueueStores stores) {
        return new TenantContextResolver(props, statusCache, stores.tenantDirectory());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerListener schedulerListener() {
        return new LoggingSchedulerListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskEventPublisher taskEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringTaskEventPublisher(applicationEventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueue taskQueue(TaskQueueProperties props,
                               TaskQueueStores stores,
                               TaskHandlerRegistry registry,
                               TenantStatusCache statusCache,
                               IsolationEnforcer enforcer,
                               ObjectProvider<ObjectMapper> objectMapper,
                               TaskEventPublisher eventPublisher,
                               SchedulerListener schedulerListener,
                               Clock clock) {
        return new DefaultTaskQueue(props, stores, registry, statusCache, enforcer,
                objectMapper.getIfAvailable(ObjectMapper::new), eventPublisher, schedulerListener, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueueLifecycle taskQueueLifecycle(TaskQueue taskQueue) {
        return new TaskQueueLifecycle(taskQueue);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tenantq", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton taskQueueIndexesInitializer(TaskQueueMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
