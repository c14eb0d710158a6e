package io.tenantq.internal.mongo;

import io.tenantq.core.TaskResult;
import io.tenantq.core.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "task_results")
public class TaskResultDocument {

    @Id
    private String taskId;
    private String tenantId;
    private TaskStatus status;
    private byte[] resultPayload;
    private String errorDetail;
    private Instant completedAt;

    public TaskResultDocument() {
    }

    public static TaskResultDocument from(TaskResult r) {
        TaskResultDocument doc = new TaskResultDocument();
        doc.setTaskId(r.taskId());
        doc.setTenantId(r.tenantId());
        doc.setStatus(r.status());
        doc.setResultPayload(r.resultPayload());
        doc.setErrorDetail(r.errorDetail());
        doc.setCompletedAt(r.completedAt());
        return doc;
    }

    public TaskResult toResult() {
        return new TaskResult(taskId, tenantId, status, resultPayload, errorDetail, completedAt);
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

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public byte[] getResultPayload() {
        return resultPayload;
    }

    public void setResultPayload(byte[] resultPayload) {
        this.resultPayload = resultPayload;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
