package io.tenantq.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for the task queue, worker pool, tenant resolution and scheduler.
 *
 * <p>Plain bean so the core has no Spring dependency; the starter binds it under the
 * {@code tenantq} prefix.
 */
public class TaskQueueProperties {
    // worker pool
    private int workerConcurrency = 4;
    private List<String> queues = new ArrayList<>(List.of("high_priority", "default", "low_priority"));
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration lockLifetime = Duration.ofMinutes(10);
    private Duration leaseReapInterval = Duration.ofSeconds(30);
    private Duration defaultTimeout = Duration.ofMinutes(5);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private String workerId;

    // envelopes and retries
    private int defaultPriority = 5;
    private int defaultMaxRetries = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(10);
    private Duration retryMaxDelay = Duration.ofSeconds(700);
    private double retryJitter = 0.1;

    // tenant resolution
    private Duration tenantCacheTtl = Duration.ofSeconds(30);
    private String tenantHeader = "X-Tenant-ID";
    private String tenantClaim = "organization_id";
    private String baseDomain;

    // scheduler
    private boolean schedulerEnabled = true;
    private Duration schedulerTick = Duration.ofSeconds(30);
    private int fanOutPageSize = 100;
    private Duration fanOutPagePause = Duration.ZERO;

    // routing
    private String bindingsVersion = "1";
    private List<Binding> bindings = new ArrayList<>();

    private boolean ensureIndexesOnStartup = false;

    /**
     * One row of the queue binding table. A blank tier matches every tier.
     */
    public static class Binding {
        private String pattern;
        private String tier;
        private String queue;

        public Binding() {
        }

        public Binding(String pattern, String tier, String queue) {
            this.pattern = pattern;
            this.tier = tier;
            this.queue = queue;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getTier() {
            return tier;
        }

        public void setTier(String tier) {
            this.tier = tier;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public Duration getLeaseReapInterval() {
        return leaseReapInterval;
    }

    public void setLeaseReapInterval(Duration leaseReapInterval) {
        this.leaseReapInterval = leaseReapInterval;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public double getRetryJitter() {
        return retryJitter;
    }

    public void setRetryJitter(double retryJitter) {
        this.retryJitter = retryJitter;
    }

    public Duration getTenantCacheTtl() {
        return tenantCacheTtl;
    }

    public void setTenantCacheTtl(Duration tenantCacheTtl) {
        this.tenantCacheTtl = tenantCacheTtl;
    }

    public String getTenantHeader() {
        return tenantHeader;
    }

    public void setTenantHeader(String tenantHeader) {
        this.tenantHeader = tenantHeader;
    }

    public String getTenantClaim() {
        return tenantClaim;
    }

    public void setTenantClaim(String tenantClaim) {
        this.tenantClaim = tenantClaim;
    }

    public String getBaseDomain() {
        return baseDomain;
    }

    public void setBaseDomain(String baseDomain) {
        this.baseDomain = baseDomain;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public Duration getSchedulerTick() {
        return schedulerTick;
    }

    public void setSchedulerTick(Duration schedulerTick) {
        this.schedulerTick = schedulerTick;
    }

    public int getFanOutPageSize() {
        return fanOutPageSize;
    }

    public void setFanOutPageSize(int fanOutPageSize) {
        this.fanOutPageSize = fanOutPageSize;
    }

    public Duration getFanOutPagePause() {
        return fanOutPagePause;
    }

    public void setFanOutPagePause(Duration fanOutPagePause) {
        this.fanOutPagePause = fanOutPagePause;
    }

    public String getBindingsVersion() {
        return bindingsVersion;
    }

    public void setBindingsVersion(String bindingsVersion) {
        this.bindingsVersion = bindingsVersion;
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public void setBindings(List<Binding> bindings) {
        this.bindings = bindings;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
