package com.enterprise.taskgateway.wire;

import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Binary codec for task records and the request/response messages of the
 * tasks service.
 *
 * <p>Layout of a task record, big-endian:
 * <pre>
 * id           16 bytes
 * title        varint length + UTF-8
 * description  varint length + UTF-8
 * completed    1 byte
 * project_id   presence byte [+ 16 bytes]
 * priority     1-byte discriminant
 * status       1-byte discriminant
 * due_date     presence byte [+ int64 epoch seconds]
 * created_at   int64 epoch seconds
 * updated_at   int64 epoch seconds
 * </pre>
 * Encoding is deterministic. Bytes following a complete record are ignored
 * so that newer writers can append optional fields.
 */
public class TaskWireCodec {

    public static final int DEFAULT_MAX_MESSAGE_SIZE = 8 * 1024 * 1024;

    public static final WireFormat<Task> TASK = new WireFormat<>() {
        @Override
        public void write(Task task, WireWriter out) throws EncodingException {
            writeTask(task, out);
        }

        @Override
        public Task read(WireReader in) throws DecodingException {
            return readTask(in);
        }

        @Override
        public String name() {
            return "Task";
        }
    };

    public static final WireFormat<TaskDraft> TASK_DRAFT = new WireFormat<>() {
        @Override
        public void write(TaskDraft draft, WireWriter out) throws EncodingException {
            out.writeText("title", draft.getTitle());
            out.writeText("description", draft.getDescription());
            writeOptionalUuid(draft.getProjectId(), out);
            writePriority(draft.getPriority(), out);
            writeStatus(draft.getStatus(), out);
            writeOptionalInstant(draft.getDueDate(), out);
        }

        @Override
        public TaskDraft read(WireReader in) throws DecodingException {
            String title = in.readText("title");
            String description = in.readText("description");
            UUID projectId = in.readPresence("project_id") ? in.readUuid("project_id") : null;
            Priority priority = readPriority(in);
            TaskStatus status = readStatus(in);
            Instant dueDate = in.readPresence("due_date") ? readInstant(in, "due_date") : null;
            return new TaskDraft(title, description, projectId, priority, status, dueDate);
        }

        @Override
        public String name() {
            return "TaskDraft";
        }
    };

    public static final WireFormat<TaskQuery> TASK_QUERY = new WireFormat<>() {
        @Override
        public void write(TaskQuery query, WireWriter out) throws EncodingException {
            writeOptionalUuid(query.getProjectId(), out);
            out.writeBoolean(query.getStatus() != null);
            if (query.getStatus() != null) {
                out.writeByte(query.getStatus().discriminant());
            }
            out.writeBoolean(query.getPriority() != null);
            if (query.getPriority() != null) {
                out.writeByte(query.getPriority().discriminant());
            }
            out.writeBoolean(query.getCompleted() != null);
            if (query.getCompleted() != null) {
                out.writeBoolean(query.getCompleted());
            }
            out.writeInt(query.getLimit());
            out.writeInt(query.getOffset());
        }

        @Override
        public TaskQuery read(WireReader in) throws DecodingException {
            UUID projectId = in.readPresence("project_id") ? in.readUuid("project_id") : null;
            TaskStatus status = in.readPresence("status") ? readStatus(in) : null;
            Priority priority = in.readPresence("priority") ? readPriority(in) : null;
            Boolean completed = in.readPresence("completed") ? in.readBoolean("completed") : null;
            int limit = in.readInt("limit");
            int offset = in.readInt("offset");
            if (limit < 0 || offset < 0) {
                throw new DecodingException("Negative limit or offset in query");
            }
            return new TaskQuery(projectId, status, priority, completed, limit, offset);
        }

        @Override
        public String name() {
            return "TaskQuery";
        }
    };

    public static final WireFormat<UUID> TASK_ID = new WireFormat<>() {
        @Override
        public void write(UUID id, WireWriter out) throws EncodingException {
            if (id == null) {
                throw new EncodingException("Field 'id' is required");
            }
            out.writeUuid(id);
        }

        @Override
        public UUID read(WireReader in) throws DecodingException {
            return in.readUuid("id");
        }

        @Override
        public String name() {
            return "TaskId";
        }
    };

    public static final WireFormat<List<Task>> TASK_LIST = new WireFormat<>() {
        @Override
        public void write(List<Task> tasks, WireWriter out) throws EncodingException {
            out.writeVarint(tasks.size());
            for (Task task : tasks) {
                // Nested records are length-prefixed so a reader can skip appended fields
                WireWriter nested = new WireWriter(Integer.MAX_VALUE - 8);
                writeTask(task, nested);
                out.writeVarint(nested.size());
                out.writeBytes(nested.toByteArray());
            }
        }

        @Override
        public List<Task> read(WireReader in) throws DecodingException {
            int count = in.readVarint("count");
            // A record takes at least 40 bytes, so a forged count cannot force a huge allocation
            List<Task> tasks = new ArrayList<>(Math.min(count, in.remaining() / 40 + 1));
            for (int i = 0; i < count; i++) {
                int length = in.readVarint("record_length");
                tasks.add(readTask(new WireReader(in.readBytes("record", length))));
            }
            return Collections.unmodifiableList(tasks);
        }

        @Override
        public String name() {
            return "TaskList";
        }
    };

    public static final WireFormat<Empty> EMPTY = new WireFormat<>() {
        @Override
        public void write(Empty value, WireWriter out) {
        }

        @Override
        public Empty read(WireReader in) {
            return Empty.INSTANCE;
        }

        @Override
        public String name() {
            return "Empty";
        }
    };

    private final int maxEncodingSize;
    private final int maxDecodingSize;

    public TaskWireCodec() {
        this(DEFAULT_MAX_MESSAGE_SIZE, DEFAULT_MAX_MESSAGE_SIZE);
    }

    public TaskWireCodec(int maxEncodingSize, int maxDecodingSize) {
        if (maxEncodingSize <= 0 || maxDecodingSize <= 0) {
            throw new IllegalArgumentException("Message size limits must be greater than 0");
        }
        this.maxEncodingSize = maxEncodingSize;
        this.maxDecodingSize = maxDecodingSize;
    }

    public byte[] encode(Task task) throws EncodingException {
        return encode(TASK, task);
    }

    public Task decode(byte[] bytes) throws DecodingException {
        return decode(TASK, bytes);
    }

    public <T> byte[] encode(WireFormat<T> format, T value) throws EncodingException {
        if (value == null) {
            throw new EncodingException("Cannot encode a null " + format.name());
        }
        WireWriter out = new WireWriter(maxEncodingSize);
        format.write(value, out);
        return out.toByteArray();
    }

    public <T> T decode(WireFormat<T> format, byte[] bytes) throws DecodingException {
        if (bytes == null) {
            throw new DecodingException("Cannot decode a null " + format.name());
        }
        if (bytes.length > maxDecodingSize) {
            throw new DecodingException(format.name() + " message of " + bytes.length
                + " bytes exceeds the maximum decoding size of " + maxDecodingSize + " bytes");
        }
        return format.read(new WireReader(bytes));
    }

    public int getMaxEncodingSize() {
        return maxEncodingSize;
    }

    public int getMaxDecodingSize() {
        return maxDecodingSize;
    }

    private static void writeTask(Task task, WireWriter out) throws EncodingException {
        out.writeUuid(task.getId());
        out.writeText("title", task.getTitle());
        out.writeText("description", task.getDescription());
        out.writeBoolean(task.isCompleted());
        writeOptionalUuid(task.getProjectId(), out);
        writePriority(task.getPriority(), out);
        writeStatus(task.getStatus(), out);
        writeOptionalInstant(task.getDueDate(), out);
        out.writeLong(task.getCreatedAt().getEpochSecond());
        out.writeLong(task.getUpdatedAt().getEpochSecond());
    }

    private static Task readTask(WireReader in) throws DecodingException {
        UUID id = in.readUuid("id");
        String title = in.readText("title");
        String description = in.readText("description");
        boolean completed = in.readBoolean("completed");
        UUID projectId = in.readPresence("project_id") ? in.readUuid("project_id") : null;
        Priority priority = readPriority(in);
        TaskStatus status = readStatus(in);
        Instant dueDate = in.readPresence("due_date") ? readInstant(in, "due_date") : null;
        Instant createdAt = readInstant(in, "created_at");
        Instant updatedAt = readInstant(in, "updated_at");
        if (createdAt.isAfter(updatedAt)) {
            throw new DecodingException("Task " + id + " has created_at after updated_at");
        }
        return new Task(id, title, description, completed, projectId, priority, status,
                        dueDate, createdAt, updatedAt);
    }

    private static void writeOptionalUuid(UUID value, WireWriter out) throws EncodingException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeUuid(value);
        }
    }

    private static void writeOptionalInstant(Instant value, WireWriter out) throws EncodingException {
        out.writeBoolean(value != null);
        if (value != null) {
            out.writeLong(value.getEpochSecond());
        }
    }

    private static void writePriority(Priority priority, WireWriter out) throws EncodingException {
        if (priority == null) {
            throw new EncodingException("Field 'priority' must be one of " + Arrays.toString(Priority.values()));
        }
        out.writeByte(priority.discriminant());
    }

    private static void writeStatus(TaskStatus status, WireWriter out) throws EncodingException {
        if (status == null) {
            throw new EncodingException("Field 'status' must be one of " + Arrays.toString(TaskStatus.values()));
        }
        out.writeByte(status.discriminant());
    }

    private static Instant readInstant(WireReader in, String field) throws DecodingException {
        long seconds = in.readLong(field);
        try {
            return Instant.ofEpochSecond(seconds);
        } catch (DateTimeException e) {
            throw new DecodingException("Field '" + field + "' is out of range: " + seconds, e);
        }
    }

    private static Priority readPriority(WireReader in) throws DecodingException {
        int discriminant = in.readByte("priority");
        Priority priority = Priority.fromDiscriminant(discriminant);
        if (priority == null) {
            throw new DecodingException("Unrecognized priority discriminant: " + discriminant);
        }
        return priority;
    }

    private static TaskStatus readStatus(WireReader in) throws DecodingException {
        int discriminant = in.readByte("status");
        TaskStatus status = TaskStatus.fromDiscriminant(discriminant);
        if (status == null) {
            throw new DecodingException("Unrecognized status discriminant: " + discriminant);
        }
        return status;
    }
}
