package io.tenantq.internal.mongo;

import com.mongodb.client.MongoClients;
import io.tenantq.core.DeadLetterReason;
import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.EnqueueResult;
import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskStatus;
import io.tenantq.schedule.ScheduleEntry;
import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatus;
import io.tenantq.tenant.TenantTier;
import org.bson.Document;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final List<String> ALL_QUEUES = List.of("high_priority", "default", "low_priority");

    private MongoTemplate mongoTemplate;
    private MongoTaskStore taskStore;
    private MongoResultStore resultStore;
    private MongoScheduleStore scheduleStore;
    private MongoTenantDirectory tenantDirectory;
    private Instant now;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "tenantq_test");
        dropAll();
        mongoTemplate.indexOps(TaskEnvelopeDocument.class).ensureIndex(new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("taskType", Sort.Direction.ASC)
                .on("idempotencyKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("open", true)))
                .named("ux_open_idempotency"));

        taskStore = new MongoTaskStore(mongoTemplate);
        resultStore = new MongoResultStore(mongoTemplate);
        scheduleStore = new MongoScheduleStore(mongoTemplate);
        tenantDirectory = new MongoTenantDirectory(mongoTemplate);
        // Mongo keeps millisecond precision
        now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void claimNextShouldLockAndPreventDoubleClaim() {
        taskStore.insertIfAbsent(envelope("org-a", "send_email", "k1", 5, "high_priority"));

        Optional<TaskEnvelope> first = taskStore.claimNext(ALL_QUEUES, now, "worker-A", Duration.ofSeconds(30));
        Optional<TaskEnvelope> second = taskStore.claimNext(ALL_QUEUES, now, "worker-B", Duration.ofSeconds(30));

        assertThat(first).isPresent();
        assertThat(first.get().status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(first.get().lockedBy()).isEqualTo("worker-A");
        assertThat(first.get().lockUntil()).isEqualTo(now.plusSeconds(30));
        assertThat(second).isEmpty();
    }

    @Test
    void claimNextShouldPreferPriorityThenAge() {
        TaskEnvelope low = envelope("org-a", "cleanup_old", "k1", 3, "default");
        TaskEnvelope urgentOld = envelope("org-a", "send_email", "k2", 9, "default");
        TaskEnvelope urgentNew = withCreatedAt(envelope("org-b", "send_email", "k3", 9, "default"), now.plusMillis(5));
        taskStore.insertIfAbsent(low);
        taskStore.insertIfAbsent(urgentNew);
        taskStore.insertIfAbsent(urgentOld);

        List<String> order = new ArrayList<>();
        Optional<TaskEnvelope> next;
        while ((next = taskStore.claimNext(ALL_QUEUES, now.plusSeconds(1), "w", Duration.ofSeconds(30))).isPresent()) {
            order.add(next.get().id());
        }

        assertThat(order).containsExactly(urgentOld.id(), urgentNew.id(), low.id());
    }

    @Test
    void claimNextShouldRespectQueuesAndNotBefore() {
        TaskEnvelope later = TaskEnvelope.pending(UUID.randomUUID().toString(), "org-a", false, "send_email",
                "high_priority", "k1", payload(), 5, 3, now.plusSeconds(60), now);
        taskStore.insertIfAbsent(later);
        taskStore.insertIfAbsent(envelope("org-a", "aggregate_metrics", "k2", 5, "low_priority"));

        assertThat(taskStore.claimNext(List.of("high_priority"), now, "w", Duration.ofSeconds(30))).isEmpty();
        assertThat(taskStore.claimNext(List.of("high_priority"), now.plusSeconds(60), "w", Duration.ofSeconds(30)))
                .map(TaskEnvelope::id)
                .contains(later.id());
    }

    @Test
    void insertIfAbsentShouldDeduplicateOnlyOpenEnvelopes() {
        TaskEnvelope original = envelope("org-a", "send_email", "welcome", 5, "high_priority");
        EnqueueResult created = taskStore.insertIfAbsent(original);
        EnqueueResult duplicate = taskStore.insertIfAbsent(envelope("org-a", "send_email", "welcome", 5, "high_priority"));
        EnqueueResult otherTenant = taskStore.insertIfAbsent(envelope("org-b", "send_email", "welcome", 3, "high_priority"));

        assertThat(created.created()).isTrue();
        assertThat(duplicate.created()).isFalse();
        assertThat(duplicate.taskId()).isEqualTo(original.id());
        assertThat(otherTenant.created()).isTrue();

        TaskEnvelope claimed = taskStore.claimNext(List.of("high_priority"), now, "w", Duration.ofSeconds(30))
                .filter(e -> e.id().equals(original.id()))
                .orElseThrow();
        assertThat(taskStore.compareAndSet(claimed, claimed.completed(now))).isTrue();

        EnqueueResult afterFinish = taskStore.insertIfAbsent(envelope("org-a", "send_email", "welcome", 5, "high_priority"));
        assertThat(afterFinish.created()).isTrue();
        assertThat(afterFinish.taskId()).isNotEqualTo(original.id());
    }

    @Test
    void compareAndSetShouldRejectStaleWriterAndKeepCancelFlag() {
        TaskEnvelope e = envelope("org-a", "send_email", "k1", 5, "high_priority");
        taskStore.insertIfAbsent(e);
        TaskEnvelope claimed = taskStore.claimNext(ALL_QUEUES, now, "worker-A", Duration.ofSeconds(30)).orElseThrow();

        assertThat(taskStore.requestCancel(e.id(), now)).isTrue();

        TaskEnvelope retrying = claimed.retrying(1, now.plusSeconds(20), "boom", now);
        assertThat(taskStore.compareAndSet(claimed, retrying)).isTrue();

        TaskEnvelope stored = taskStore.findById(e.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.RETRYING);
        assertThat(stored.cancelRequested()).isTrue();
        assertThat(stored.lockedBy()).isNull();
        assertThat(stored.lastError()).isEqualTo("boom");

        // second writer still holding the old IN_PROGRESS view
        assertThat(taskStore.compareAndSet(claimed, claimed.completed(now))).isFalse();
        assertThat(taskStore.findById(e.id()).orElseThrow().status()).isEqualTo(TaskStatus.RETRYING);
    }

    @Test
    void compareAndSetShouldRejectEarlierClaimOfSameWorker() {
        TaskEnvelope e = envelope("org-a", "send_email", "k1", 5, "high_priority");
        taskStore.insertIfAbsent(e);
        TaskEnvelope first = taskStore.claimNext(ALL_QUEUES, now, "worker-A", Duration.ofSeconds(30)).orElseThrow();
        Instant reapedAt = now.plusSeconds(31);
        assertThat(taskStore.compareAndSet(first, first.retrying(1, reapedAt, "lease expired", reapedAt))).isTrue();
        TaskEnvelope second = taskStore.claimNext(ALL_QUEUES, reapedAt, "worker-A", Duration.ofSeconds(30)).orElseThrow();

        assertThat(taskStore.compareAndSet(first, first.completed(reapedAt))).isFalse();
        TaskEnvelope stored = taskStore.findById(e.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(stored.lockUntil()).isEqualTo(second.lockUntil());
        assertThat(taskStore.compareAndSet(second, second.completed(reapedAt))).isTrue();
    }

    @Test
    void requestCancelShouldIgnoreTerminalEnvelopes() {
        TaskEnvelope e = envelope("org-a", "send_email", "k1", 5, "high_priority");
        taskStore.insertIfAbsent(e);
        TaskEnvelope claimed = taskStore.claimNext(ALL_QUEUES, now, "w", Duration.ofSeconds(30)).orElseThrow();
        taskStore.compareAndSet(claimed, claimed.completed(now));

        assertThat(taskStore.requestCancel(e.id(), now)).isFalse();
        assertThat(taskStore.requestCancel("missing", now)).isFalse();
    }

    @Test
    void findExpiredLeasesShouldReturnOnlyLapsedClaims() {
        taskStore.insertIfAbsent(envelope("org-a", "send_email", "k1", 5, "high_priority"));
        taskStore.insertIfAbsent(envelope("org-a", "send_email", "k2", 5, "high_priority"));
        TaskEnvelope shortLease = taskStore.claimNext(ALL_QUEUES, now, "w1", Duration.ofSeconds(1)).orElseThrow();
        taskStore.claimNext(ALL_QUEUES, now, "w2", Duration.ofMinutes(10)).orElseThrow();

        List<TaskEnvelope> expired = taskStore.findExpiredLeases(now.plusSeconds(5), 10);

        assertThat(expired).extracting(TaskEnvelope::id).containsExactly(shortLease.id());
    }

    @Test
    void deadLettersShouldBeListedPerTenantNewestFirst() {
        TaskEnvelope a1 = envelope("org-a", "send_email", "k1", 5, "high_priority");
        TaskEnvelope a2 = envelope("org-a", "send_email", "k2", 5, "high_priority");
        TaskEnvelope b1 = envelope("org-b", "send_email", "k3", 5, "high_priority");
        resultStore.saveDeadLetter(DeadLetterRecord.of(a1, DeadLetterReason.RETRIES_EXHAUSTED, "x", now));
        resultStore.saveDeadLetter(DeadLetterRecord.of(a2, DeadLetterReason.PERMANENT_FAILURE, "y", now.plusSeconds(1)));
        resultStore.saveDeadLetter(DeadLetterRecord.of(b1, DeadLetterReason.TENANT_INACTIVE, "z", now));

        List<DeadLetterRecord> forA = resultStore.findDeadLetters("org-a", 10);

        assertThat(forA).extracting(DeadLetterRecord::taskId).containsExactly(a2.id(), a1.id());
        assertThat(resultStore.findDeadLetter(b1.id())).map(DeadLetterRecord::reason).contains(DeadLetterReason.TENANT_INACTIVE);
        assertThat(new String(forA.get(0).payload(), StandardCharsets.UTF_8)).isEqualTo("{\"to\":\"a@b.c\"}");
    }

    @Test
    void advanceWatermarkShouldOnlyMoveFromExpectedValue() {
        Instant t0 = now.truncatedTo(ChronoUnit.SECONDS);
        scheduleStore.save(ScheduleEntry.forAllActiveTenants("daily", "AT 06:00", "generate_report", null, 5)
                .withWatermark(t0));

        assertThat(scheduleStore.advanceWatermark("daily", t0, t0.plusSeconds(60))).isTrue();
        // a second scheduler instance racing with the same view and target
        assertThat(scheduleStore.advanceWatermark("daily", t0, t0.plusSeconds(60))).isTrue();
        // and one that is behind
        assertThat(scheduleStore.advanceWatermark("daily", t0, t0.plusSeconds(30))).isFalse();

        assertThat(scheduleStore.findById("daily").orElseThrow().lastFiredWatermark()).isEqualTo(t0.plusSeconds(60));
    }

    @Test
    void tenantDirectoryShouldPageActiveTenantsAndNotifyOnStatusChange() {
        for (String id : List.of("org-a", "org-b", "org-c", "org-d")) {
            tenantDirectory.save(new TenantRecord(id, id + "-slug", TenantTier.BASIC, TenantStatus.ACTIVE, Set.of()));
        }
        List<String> notified = new ArrayList<>();
        tenantDirectory.addListener((tenantId, status) -> notified.add(tenantId + ":" + status));

        assertThat(tenantDirectory.updateStatus("org-b", TenantStatus.SUSPENDED)).isTrue();
        assertThat(tenantDirectory.updateStatus("org-zzz", TenantStatus.SUSPENDED)).isFalse();

        List<TenantRecord> page1 = tenantDirectory.listActiveTenants(null, 2);
        List<TenantRecord> page2 = tenantDirectory.listActiveTenants(page1.get(page1.size() - 1).tenantId(), 2);

        assertThat(page1).extracting(TenantRecord::tenantId).containsExactly("org-a", "org-c");
        assertThat(page2).extracting(TenantRecord::tenantId).containsExactly("org-d");
        assertThat(tenantDirectory.findBySlug("org-c-slug")).map(TenantRecord::tenantId).contains("org-c");
        assertThat(notified).containsExactly("org-b:SUSPENDED");
    }

    private TaskEnvelope envelope(String tenantId, String taskType, String key, int priority, String queue) {
        return TaskEnvelope.pending(UUID.randomUUID().toString(), tenantId, false, taskType, queue, key,
                payload(), priority, 3, null, now);
    }

    private static TaskEnvelope withCreatedAt(TaskEnvelope e, Instant createdAt) {
        return new TaskEnvelope(e.id(), e.tenantId(), e.systemScoped(), e.taskType(), e.queue(), e.idempotencyKey(),
                e.payload(), e.priority(), e.notBefore(), e.retryCount(), e.maxRetries(), e.lastError(),
                e.status(), e.lockedBy(), e.lockUntil(), e.cancelRequested(), createdAt, createdAt);
    }

    private static byte[] payload() {
        return "{\"to\":\"a@b.c\"}".getBytes(StandardCharsets.UTF_8);
    }

    private void dropAll() {
        mongoTemplate.dropCollection(TaskEnvelopeDocument.class);
        mongoTemplate.dropCollection(TaskResultDocument.class);
        mongoTemplate.dropCollection(DeadLetterDocument.class);
        mongoTemplate.dropCollection(ScheduleEntryDocument.class);
        mongoTemplate.dropCollection(TenantDocument.class);
    }
}
