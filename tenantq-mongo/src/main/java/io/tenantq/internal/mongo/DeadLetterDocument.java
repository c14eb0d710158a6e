package io.tenantq.internal.mongo;

import io.tenantq.core.DeadLetterReason;
import io.tenantq.core.DeadLetterRecord;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Dead-lettered envelope, kept with its original payload for inspection and replay.
 */
@Document(collection = "dead_letters")
public class DeadLetterDocument {

    @Id
    private String taskId;
    private String tenantId;
    private String taskType;
    private String queue;
    private byte[] payload;
    private int priority;
    private int retryCount;
    private int maxRetries;
    private DeadLetterReason reason;
    private String lastError;
    private Instant deadLetteredAt;

    public DeadLetterDocument() {
    }

    public static DeadLetterDocument from(DeadLetterRecord r) {
        DeadLetterDocument doc = new DeadLetterDocument();
        doc.setTaskId(r.taskId());
        doc.setTenantId(r.tenantId());
        doc.setTaskType(r.taskType());
        doc.setQueue(r.queue());
        doc.setPayload(r.payload());
        doc.setPriority(r.priority());
        doc.setRetryCount(r.retryCount());
        doc.setMaxRetries(r.maxRetries());
        doc.setReason(r.reason());
        doc.setLastError(r.lastError());
        doc.setDeadLetteredAt(r.deadLetteredAt());
        return doc;
    }

    public DeadLetterRecord toRecord() {
        return new DeadLetterRecord(taskId, tenantId, taskType, queue, payload != null ? payload : new byte[0],
                priority, retryCount, maxRetries, reason, lastError, deadLetteredAt);
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
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

    public DeadLetterReason getReason() {
        return reason;
    }

    public void setReason(DeadLetterReason reason) {
        this.reason = reason;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getDeadLetteredAt() {
        return deadLetteredAt;
    }

    public void setDeadLetteredAt(Instant deadLetteredAt) {
        this.deadLetteredAt = deadLetteredAt;
    }
}
