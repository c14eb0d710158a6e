package io.tenantq.spi;

import io.tenantq.core.DeadLetterRecord;
import io.tenantq.core.TaskResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcomes and dead letters. Lookups are by id; tenant ownership is checked by the caller through
 * the isolation enforcer, and tenant scoped listings take the owner as mandatory filter.
 */
public interface ResultStore {

    void saveResult(TaskResult result);

    Optional<TaskResult> findResult(String taskId);

    void saveDeadLetter(DeadLetterRecord record);

    Optional<DeadLetterRecord> findDeadLetter(String taskId);

    List<DeadLetterRecord> findDeadLetters(String ownerTenantId, int limit);
}
