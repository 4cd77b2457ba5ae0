package com.enterprise.taskgateway.wire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Filter for List and ListStream. Every filter is optional; offset is ignored
 * by ListStream.
 */
public final class TaskQuery {

    public static final int DEFAULT_LIMIT = 50;

    private final UUID projectId;
    private final TaskStatus status;
    private final Priority priority;
    private final Boolean completed;
    private final int limit;
    private final int offset;

    @JsonCreator
    public TaskQuery(@JsonProperty("project_id") UUID projectId,
                     @JsonProperty("status") TaskStatus status,
                     @JsonProperty("priority") Priority priority,
                     @JsonProperty("completed") Boolean completed,
                     @JsonProperty("limit") Integer limit,
                     @JsonProperty("offset") Integer offset) {
        this.projectId = projectId;
        this.status = status;
        this.priority = priority;
        this.completed = completed;
        this.limit = limit != null ? limit : DEFAULT_LIMIT;
        this.offset = offset != null ? offset : 0;
        if (this.limit < 0 || this.offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
    }

    public static TaskQuery all() {
        return new TaskQuery(null, null, null, null, DEFAULT_LIMIT, 0);
    }

    @JsonProperty("project_id")
    public UUID getProjectId() { return projectId; }

    @JsonProperty("status")
    public TaskStatus getStatus() { return status; }

    @JsonProperty("priority")
    public Priority getPriority() { return priority; }

    @JsonProperty("completed")
    public Boolean getCompleted() { return completed; }

    @JsonProperty("limit")
    public int getLimit() { return limit; }

    @JsonProperty("offset")
    public int getOffset() { return offset; }

    /**
     * Whether a task satisfies every filter that is set
     */
    public boolean matches(Task task) {
        return (projectId == null || projectId.equals(task.getProjectId()))
            && (status == null || status == task.getStatus())
            && (priority == null || priority == task.getPriority())
            && (completed == null || completed == task.isCompleted());
    }

    public TaskQuery withLimit(int newLimit) {
        return new TaskQuery(projectId, status, priority, completed, newLimit, offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskQuery)) {
            return false;
        }
        TaskQuery other = (TaskQuery) o;
        return limit == other.limit
            && offset == other.offset
            && Objects.equals(projectId, other.projectId)
            && status == other.status
            && priority == other.priority
            && Objects.equals(completed, other.completed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, status, priority, completed, limit, offset);
    }
}
