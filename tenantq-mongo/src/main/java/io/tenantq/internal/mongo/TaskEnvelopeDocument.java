package io.tenantq.internal.mongo;

import io.tenantq.core.TaskEnvelope;
import io.tenantq.core.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for task envelopes.
 *
 * <p>{@code open} mirrors "status is not terminal" so that the idempotency index can be partial on
 * a plain equality filter.
 */
@Document(collection = "task_envelopes")
public class TaskEnvelopeDocument {

    @Id
    private String id;

    @Field(write = Field.Write.ALWAYS)
    private String tenantId;
    private boolean systemScoped;
    private String taskType;
    private String queue;
    private String idempotencyKey;

    private byte[] payload;

    private int priority;
    private Instant notBefore;

    private int retryCount;
    private int maxRetries;
    private String lastError;

    private TaskStatus status;
    private boolean open;

    @Field(write = Field.Write.ALWAYS)
    private String lockedBy;
    private Instant lockUntil;
    private boolean cancelRequested;

    private Instant createdAt;
    private Instant updatedAt;

    public TaskEnvelopeDocument() {
    }

    public static TaskEnvelopeDocument from(TaskEnvelope e) {
        TaskEnvelopeDocument doc = new TaskEnvelopeDocument();
        doc.setId(e.id());
        doc.setTenantId(e.tenantId());
        doc.setSystemScoped(e.systemScoped());
        doc.setTaskType(e.taskType());
        doc.setQueue(e.queue());
        doc.setIdempotencyKey(e.idempotencyKey());
        doc.setPayload(e.payload());
        doc.setPriority(e.priority());
        doc.setNotBefore(e.notBefore());
        doc.setRetryCount(e.retryCount());
        doc.setMaxRetries(e.maxRetries());
        doc.setLastError(e.lastError());
        doc.setStatus(e.status());
        doc.setOpen(!e.status().isTerminal());
        doc.setLockedBy(e.lockedBy());
        doc.setLockUntil(e.lockUntil());
        doc.setCancelRequested(e.cancelRequested());
        doc.setCreatedAt(e.createdAt());
        doc.setUpdatedAt(e.updatedAt());
        return doc;
    }

    public TaskEnvelope toEnvelope() {
        return new TaskEnvelope(
                id,
                tenantId,
                systemScoped,
                taskType,
                queue,
                idempotencyKey,
                payload != null ? payload : new byte[0],
                priority,
                notBefore,
                retryCount,
                maxRetries,
                lastError,
                status,
                lockedBy,
                lockUntil,
                cancelRequested,
                createdAt,
                updatedAt
        );
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public boolean isSystemScoped() {
        return systemScoped;
    }

    public void setSystemScoped(boolean systemScoped) {
        this.systemScoped = systemScoped;
    }

    public String getTaskType() {
        return taskType;
    }

    public void setTaskType(String taskType) {
        this.taskType = taskType;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public void setIdempotencyKey(String idempotencyKey) {
        this.idempotencyKey = idempotencyKey;
    }

    public byte[] getPayload() {
        return payload;
    }

    public void setPayload(byte[] payload) {
        this.payload = payload;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public void setNotBefore(Instant notBefore) {
        this.notBefore = notBefore;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public boolean isOpen() {
        return open;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
