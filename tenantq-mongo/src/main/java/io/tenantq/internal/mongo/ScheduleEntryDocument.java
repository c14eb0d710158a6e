package io.tenantq.internal.mongo;

import io.tenantq.schedule.ScheduleEntry;
import io.tenantq.schedule.ScheduleScope;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

@Document(collection = "schedule_entries")
public class ScheduleEntryDocument {

    @Id
    private String id;
    private String cronExpression;
    private String timezone;
    private String taskType;
    private ScheduleScope scope;
    private String targetTenantId;
    private String payloadTemplate;
    private int priority;
    private Integer maxRetries;
    private boolean enabled;

    @Field(write = Field.Write.ALWAYS)
    private Instant lastFiredWatermark;

    public ScheduleEntryDocument() {
    }

    public static ScheduleEntryDocument from(ScheduleEntry e) {
        ScheduleEntryDocument doc = new ScheduleEntryDocument();
        doc.setId(e.id());
        doc.setCronExpression(e.cronExpression());
        doc.setTimezone(e.timezone());
        doc.setTaskType(e.taskType());
        doc.setScope(e.scope());
        doc.setTargetTenantId(e.targetTenantId());
        doc.setPayloadTemplate(e.payloadTemplate());
        doc.setPriority(e.priority());
        doc.setMaxRetries(e.maxRetries());
        doc.setEnabled(e.enabled());
        doc.setLastFiredWatermark(e.lastFiredWatermark());
        return doc;
    }

    public ScheduleEntry toEntry() {
        return new ScheduleEntry(id, cronExpression, timezone, taskType, scope, targetTenantId, payloadTemplate,
                priority, maxRetries, enabled, lastFiredWatermark);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getTaskType() {
        return taskType;
    }

    public void setTaskType(String taskType) {
        this.taskType = taskType;
    }

    public ScheduleScope getScope() {
        return scope;
    }

    public void setScope(ScheduleScope scope) {
        this.scope = scope;
    }

    public String getTargetTenantId() {
        return targetTenantId;
    }

    public void setTargetTenantId(String targetTenantId) {
        this.targetTenantId = targetTenantId;
    }

    public String getPayloadTemplate() {
        return payloadTemplate;
    }

    public void setPayloadTemplate(String payloadTemplate) {
        this.payloadTemplate = payloadTemplate;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Integer getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(Integer maxRetries) {
        this.maxRetries = maxRetries;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getLastFiredWatermark() {
        return lastFiredWatermark;
    }

    public void setLastFiredWatermark(Instant lastFiredWatermark) {
        this.lastFiredWatermark = lastFiredWatermark;
    }
}
