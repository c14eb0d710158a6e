package io.tenantq.internal.memory;

import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryTaskStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(10);

    private final InMemoryTaskStore store = new InMemoryTaskStore();

    private static TaskEnvelope envelope(String id, String queue, int priority, Instant notBefore) {
        return TaskEnvelope.pending(id, "org-a", false, "send_email", queue, "key-" + id, new byte[0],
                priority, 3, notBefore, NOW);
    }

    @Test
    void claimsHighestPriorityThenOldest() {
        store.insertIfAbsent(envelope("low-1", "default", 1, null));
        store.insertIfAbsent(envelope("high-1", "default", 8, null));
        store.insertIfAbsent(envelope("high-2", "default", 8, null));

        List<String> order = new ArrayList<>();
        Optional<TaskEnvelope> claimed;
        while ((claimed = store.claimNext(List.of("default"), NOW, "w", LEASE)).isPresent()) {
            order.add(claimed.get().id());
        }

        assertThat(order).containsExactly("high-1", "high-2", "low-1");
    }

    @Test
    void respectsQueuesAndNotBefore() {
        store.insertIfAbsent(envelope("other-queue", "low_priority", 5, null));
        store.insertIfAbsent(envelope("later", "default", 5, NOW.plusSeconds(60)));

        assertThat(store.claimNext(List.of("default"), NOW, "w", LEASE)).isEmpty();
        assertThat(store.claimNext(List.of("default"), NOW.plusSeconds(60), "w", LEASE)).get()
                .extracting(TaskEnvelope::id).isEqualTo("later");
    }

    @Test
    void claimSetsLease() {
        store.insertIfAbsent(envelope("t", "default", 5, null));

        TaskEnvelope claimed = store.claimNext(List.of("default"), NOW, "worker-7", LEASE).orElseThrow();

        assertThat(claimed.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(claimed.lockedBy()).isEqualTo("worker-7");
        assertThat(claimed.lockUntil()).isEqualTo(NOW.plus(LEASE));
    }

    @Test
    void compareAndSetKeepsAStoredCancelFlag() {
        store.insertIfAbsent(envelope("t", "default", 5, null));
        TaskEnvelope claimed = store.claimNext(List.of("default"), NOW, "w", LEASE).orElseThrow();
        store.requestCancel("t", NOW);

        boolean swapped = store.compareAndSet(claimed, claimed.retrying(1, NOW.plusSeconds(20), "x", NOW));

        assertThat(swapped).isTrue();
        assertThat(store.findById("t").orElseThrow().cancelRequested()).isTrue();
        assertThat(store.compareAndSet(claimed, claimed.completed(NOW))).isFalse();
    }

    @Test
    void compareAndSetRejectsAnEarlierClaimOfTheSameWorker() {
        store.insertIfAbsent(envelope("t", "default", 5, null));
        TaskEnvelope first = store.claimNext(List.of("default"), NOW, "w", LEASE).orElseThrow();
        Instant reapedAt = NOW.plus(LEASE).plusSeconds(1);
        assertThat(store.compareAndSet(first, first.retrying(1, reapedAt.plusSeconds(10), "lease expired", reapedAt))).isTrue();
        TaskEnvelope second = store.claimNext(List.of("default"), reapedAt.plusSeconds(30), "w", LEASE).orElseThrow();

        assertThat(second.lockedBy()).isEqualTo(first.lockedBy());
        assertThat(store.compareAndSet(first, first.completed(reapedAt.plusSeconds(40)))).isFalse();
        assertThat(store.findById("t").orElseThrow().status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(store.compareAndSet(second, second.completed(reapedAt.plusSeconds(40)))).isTrue();
    }

    @Test
    void everyEnvelopeIsClaimedByExactlyOneWorker() throws Exception {
        for (int i = 0; i < 200; i++) {
            store.insertIfAbsent(envelope("t-" + i, "default", i % 10, null));
        }
        Set<String> seen = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new ArrayList<>();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                String worker = "w-" + w;
                futures.add(pool.submit(() -> {
                    go.await(5, TimeUnit.SECONDS);
                    Optional<TaskEnvelope> c;
                    while ((c = store.claimNext(List.of("default"), NOW, worker, LEASE)).isPresent()) {
                        if (!seen.add(c.get().id())) {
                            synchronized (duplicates) {
                                duplicates.add(c.get().id());
                            }
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(duplicates).isEmpty();
        assertThat(seen).hasSize(200);
    }
}
