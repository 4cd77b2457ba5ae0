package com.enterprise.taskgateway.wire;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.UUID;

/**
 * The payload of a Create call. The service assigns id and timestamps.
 */
public final class TaskDraft {

    private final String title;
    private final String description;
    private final UUID projectId;
    private final Priority priority;
    private final TaskStatus status;
    private final Instant dueDate;

    @JsonCreator
    public TaskDraft(@JsonProperty("title") String title,
                     @JsonProperty("description") String description,
                     @JsonProperty("project_id") UUID projectId,
                     @JsonProperty("priority") Priority priority,
                     @JsonProperty("status") TaskStatus status,
                     @JsonProperty("due_date") Instant dueDate) {
        this.title = title != null ? title : "";
        this.description = description != null ? description : "";
        this.projectId = projectId;
        this.priority = priority != null ? priority : Priority.MEDIUM;
        this.status = status != null ? status : TaskStatus.TODO;
        this.dueDate = dueDate != null ? dueDate.truncatedTo(ChronoUnit.SECONDS) : null;
    }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("description")
    public String getDescription() { return description; }

    @JsonProperty("project_id")
    public UUID getProjectId() { return projectId; }

    @JsonProperty("priority")
    public Priority getPriority() { return priority; }

    @JsonProperty("status")
    public TaskStatus getStatus() { return status; }

    @JsonProperty("due_date")
    public Instant getDueDate() { return dueDate; }

    /**
     * Materialize the draft as a new task record, as the tasks service does on Create.
     */
    public Task toTask(UUID id, Instant now) {
        return new Task(id, title, description, false, projectId, priority, status, dueDate, now, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskDraft)) {
            return false;
        }
        TaskDraft other = (TaskDraft) o;
        return title.equals(other.title)
            && description.equals(other.description)
            && Objects.equals(projectId, other.projectId)
            && priority == other.priority
            && status == other.status
            && Objects.equals(dueDate, other.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, description, projectId, priority, status, dueDate);
    }

    public static TaskDraft of(String title, Priority priority, TaskStatus status) {
        return new TaskDraft(title, "", null, priority, status, null);
    }
}
