package com.enterprise.taskgateway.wire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * A complete snapshot of a task record as exchanged with the tasks service.
 * Tasks are immutable; updates travel as a new full snapshot.
 * Instants are kept at whole-second precision, the resolution of the wire form.
 */
public final class Task {

    private final UUID id;
    private final String title;
    private final String description;
    private final boolean completed;
    private final UUID projectId;
    private final Priority priority;
    private final TaskStatus status;
    private final Instant dueDate;
    private final Instant createdAt;
    private final Instant updatedAt;

    @JsonCreator
    public Task(@JsonProperty("id") UUID id,
                @JsonProperty("title") String title,
                @JsonProperty("description") String description,
                @JsonProperty("completed") boolean completed,
                @JsonProperty("project_id") UUID projectId,
                @JsonProperty("priority") Priority priority,
                @JsonProperty("status") TaskStatus status,
                @JsonProperty("due_date") Instant dueDate,
                @JsonProperty("created_at") Instant createdAt,
                @JsonProperty("updated_at") Instant updatedAt) {
        if (id == null) {
            throw new IllegalArgumentException("Task id is required");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("Task timestamps are required");
        }
        this.id = id;
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        this.completed = completed;
        this.projectId = projectId;
        this.priority = priority;
        this.status = status;
        this.dueDate = dueDate != null ? dueDate.truncatedTo(ChronoUnit.SECONDS) : null;
        this.createdAt = createdAt.truncatedTo(ChronoUnit.SECONDS);
        this.updatedAt = updatedAt.truncatedTo(ChronoUnit.SECONDS);
        if (this.createdAt.isAfter(this.updatedAt)) {
            throw new IllegalArgumentException(
                "created_at " + this.createdAt + " is after updated_at " + this.updatedAt);
        }
    }

    @JsonProperty("id")
    public UUID getId() { return id; }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("description")
    public String getDescription() { return description; }

    @JsonProperty("completed")
    public boolean isCompleted() { return completed; }

    @JsonProperty("project_id")
    public UUID getProjectId() { return projectId; }

    @JsonProperty("priority")
    public Priority getPriority() { return priority; }

    @JsonProperty("status")
    public TaskStatus getStatus() { return status; }

    @JsonProperty("due_date")
    public Instant getDueDate() { return dueDate; }

    @JsonProperty("created_at")
    public Instant getCreatedAt() { return createdAt; }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Start a builder pre-populated with this snapshot
     */
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .title(title)
            .description(description)
            .completed(completed)
            .projectId(projectId)
            .priority(priority)
            .status(status)
            .dueDate(dueDate)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Task)) {
            return false;
        }
        Task other = (Task) o;
        return completed == other.completed
            && id.equals(other.id)
            && title.equals(other.title)
            && description.equals(other.description)
            && Objects.equals(projectId, other.projectId)
            && priority == other.priority
            && status == other.status
            && Objects.equals(dueDate, other.dueDate)
            && createdAt.equals(other.createdAt)
            && updatedAt.equals(other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, description, completed, projectId, priority, status,
                            dueDate, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", title='" + title + "', status=" + status
            + ", priority=" + priority + ", completed=" + completed + "}";
    }

    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private UUID id = UUID.randomUUID();
        private String title = "";
        private String description = "";
        private boolean completed;
        private UUID projectId;
        private Priority priority = Priority.MEDIUM;
        private TaskStatus status = TaskStatus.TODO;
        private Instant dueDate;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder completed(boolean completed) {
            this.completed = completed;
            return this;
        }

        public Builder projectId(UUID projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder dueDate(Instant dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            Instant now = Instant.now();
            Instant created = createdAt != null ? createdAt : now;
            Instant updated = updatedAt != null ? updatedAt : created;
            return new Task(id, title, description, completed, projectId, priority, status,
                            dueDate, created, updated);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
