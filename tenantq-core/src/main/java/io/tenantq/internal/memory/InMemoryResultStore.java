package io.tenantq.internal.memory;

import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.TaskResult;
import io.tenantq.spi.ResultStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryResultStore implements ResultStore {

    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private final Map<String, DeadLetterRecord> deadLetters = new ConcurrentHashMap<>();

    @Override
    public void saveResult(TaskResult result) {
        Objects.requireNonNull(result, "result must not be null");
        results.put(result.taskId(), result);
    }

    @Override
    public Optional<TaskResult> findResult(String taskId) {
        return Optional.ofNullable(results.get(taskId));
    }

    @Override
    public void saveDeadLetter(DeadLetterRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        deadLetters.put(record.taskId(), record);
    }

    @Override
    public Optional<DeadLetterRecord> findDeadLetter(String taskId) {
        return Optional.ofNullable(deadLetters.get(taskId));
    }

    @Override
    public List<DeadLetterRecord> findDeadLetters(String ownerTenantId, int limit) {
        Objects.requireNonNull(ownerTenantId, "ownerTenantId must not be null");
        return deadLetters.values().stream()
                .filter(r -> ownerTenantId.equals(r.tenantId()))
                .sorted(Comparator.comparing(DeadLetterRecord::deadLetteredAt).reversed())
                .limit(limit)
                .toList();
    }
}
