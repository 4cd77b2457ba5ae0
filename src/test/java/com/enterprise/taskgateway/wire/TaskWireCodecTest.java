package com.enterprise.taskgateway.wire;

import com.enterprise.taskgateway.exception.DecodingException;
import com.enterprise.taskgateway.exception.EncodingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TaskWireCodecTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:15:30Z");

    private TaskWireCodec codec;

    @BeforeEach
    void setUp() {
        codec = new TaskWireCodec();
    }

    private static Task minimalTask() {
        // title "a", empty description, no project, no due date: 40 bytes on the wire
        return Task.builder()
            .id(UUID.fromString("00000000-0000-0000-0000-000000000001"))
            .title("a")
            .description("")
            .priority(Priority.HIGH)
            .status(TaskStatus.TODO)
            .createdAt(CREATED)
            .updatedAt(CREATED)
            .build();
    }

    @Test
    void testFullTaskSurvivesEncodeAndDecode() throws Exception {
        Task task = Task.builder()
            .title("Write release notes")
            .description("Cover the codec and pool changes é中")
            .completed(true)
            .projectId(UUID.randomUUID())
            .priority(Priority.URGENT)
            .status(TaskStatus.IN_PROGRESS)
            .dueDate(Instant.parse("2024-04-01T00:00:00Z"))
            .createdAt(CREATED)
            .updatedAt(CREATED.plusSeconds(3600))
            .build();

        Task decoded = codec.decode(codec.encode(task));

        assertEquals(task, decoded);
        assertEquals(task.getProjectId(), decoded.getProjectId());
        assertEquals(task.getDueDate(), decoded.getDueDate());
    }

    @Test
    void testEncodingIsDeterministic() throws Exception {
        Task task = minimalTask();
        Task sameFields = task.toBuilder().build();

        assertArrayEquals(codec.encode(task), codec.encode(task));
        assertArrayEquals(codec.encode(task), codec.encode(sameFields));
    }

    @Test
    void testMinimalTaskLayout() throws Exception {
        byte[] bytes = codec.encode(minimalTask());

        assertEquals(40, bytes.length);
        assertEquals(1, bytes[16]);
        assertEquals('a', bytes[17]);
        assertEquals(Priority.HIGH.discriminant(), bytes[21]);
        assertEquals(TaskStatus.TODO.discriminant(), bytes[22]);
        assertEquals(CREATED.getEpochSecond(), ByteBuffer.wrap(bytes, 24, 8).getLong());
    }

    @Test
    void testEveryTruncationIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());

        for (int length = 0; length < bytes.length; length++) {
            byte[] truncated = Arrays.copyOf(bytes, length);
            assertThrows(DecodingException.class, () -> codec.decode(truncated),
                "prefix of " + length + " bytes should not decode");
        }
    }

    @Test
    void testTrailingBytesAreIgnored() throws Exception {
        Task task = minimalTask();
        byte[] bytes = codec.encode(task);
        byte[] extended = Arrays.copyOf(bytes, bytes.length + 5);

        assertEquals(task, codec.decode(extended));
    }

    @Test
    void testUnknownPriorityDiscriminantIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        bytes[21] = 42;

        DecodingException e = assertThrows(DecodingException.class, () -> codec.decode(bytes));
        assertTrue(e.getMessage().contains("priority"));
    }

    @Test
    void testUnknownStatusDiscriminantIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        bytes[22] = 9;

        assertThrows(DecodingException.class, () -> codec.decode(bytes));
    }

    @Test
    void testZeroDiscriminantsDecodeToUnspecified() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        bytes[21] = 0;
        bytes[22] = 0;

        Task decoded = codec.decode(bytes);

        assertEquals(Priority.UNSPECIFIED, decoded.getPriority());
        assertEquals(TaskStatus.UNSPECIFIED, decoded.getStatus());
    }

    @Test
    void testMetadataSizeDoesNotDependOnText() throws Exception {
        Task base = minimalTask().toBuilder()
            .projectId(UUID.randomUUID())
            .dueDate(Instant.parse("2024-04-01T00:00:00Z"))
            .build();

        for (int textLength : new int[] {0, 1, 127, 128, 5000}) {
            String title = "t".repeat(textLength);
            String description = "d".repeat(textLength * 2);
            byte[] bytes = codec.encode(base.toBuilder().title(title).description(description).build());

            int textBytes = varintSize(textLength) + textLength + varintSize(textLength * 2) + textLength * 2;
            int nonText = bytes.length - textBytes;
            // completed byte and project_id with its presence byte
            int metadata = nonText - 1 - 17;

            assertEquals(61, nonText, "non-text bytes for text length " + textLength);
            assertEquals(43, metadata);
            assertTrue(metadata <= 58);
        }
    }

    @Test
    void testOverlongLengthPrefixIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        byte[] forged = new byte[bytes.length + 4];
        System.arraycopy(bytes, 0, forged, 0, 16);
        // five-byte varint whose high bits would shift out to a length of zero
        forged[16] = (byte) 0x80;
        forged[17] = (byte) 0x80;
        forged[18] = (byte) 0x80;
        forged[19] = (byte) 0x80;
        forged[20] = 0x10;
        System.arraycopy(bytes, 18, forged, 21, bytes.length - 18);

        DecodingException e = assertThrows(DecodingException.class, () -> codec.decode(forged));
        assertTrue(e.getMessage().contains("title"));
        assertThrows(DecodingException.class,
            () -> new WireReader(new byte[] {(byte) 0x80, (byte) 0x80, (byte) 0x80, (byte) 0x80, 0x10}).readVarint("title"));
        assertEquals(Integer.MAX_VALUE,
            new WireReader(new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x07}).readVarint("title"));
    }

    private static int varintSize(int value) {
        int size = 1;
        while ((value >>>= 7) != 0) {
            size++;
        }
        return size;
    }

    @Test
    void testInvalidUtf8IsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        bytes[17] = (byte) 0xFF;

        DecodingException e = assertThrows(DecodingException.class, () -> codec.decode(bytes));
        assertTrue(e.getMessage().contains("UTF-8"));
    }

    @Test
    void testCreatedAfterUpdatedIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        ByteBuffer.wrap(bytes).putLong(32, CREATED.getEpochSecond() - 100);

        assertThrows(DecodingException.class, () -> codec.decode(bytes));
    }

    @Test
    void testOutOfRangeTimestampIsRejected() throws Exception {
        byte[] bytes = codec.encode(minimalTask());
        ByteBuffer.wrap(bytes).putLong(24, Long.MAX_VALUE);
        ByteBuffer.wrap(bytes).putLong(32, Long.MAX_VALUE);

        assertThrows(DecodingException.class, () -> codec.decode(bytes));
    }

    @Test
    void testMissingPriorityFailsToEncode() {
        Task task = new Task(UUID.randomUUID(), "t", "", false, null, null, TaskStatus.TODO,
                             null, CREATED, CREATED);

        EncodingException e = assertThrows(EncodingException.class, () -> codec.encode(task));
        assertTrue(e.getMessage().contains("priority"));
    }

    @Test
    void testOversizedTitleFailsToEncode() {
        TaskWireCodec small = new TaskWireCodec(1024, 1024);
        Task task = minimalTask().toBuilder().title("x".repeat(2048)).build();

        assertThrows(EncodingException.class, () -> small.encode(task));
    }

    @Test
    void testOversizedMessageFailsToDecode() throws Exception {
        byte[] bytes = codec.encode(minimalTask().toBuilder().description("d".repeat(200)).build());
        TaskWireCodec small = new TaskWireCodec(1024, 64);

        assertThrows(DecodingException.class, () -> small.decode(bytes));
    }

    @Test
    void testNullValueFailsToEncode() {
        assertThrows(EncodingException.class, () -> codec.encode(TaskWireCodec.TASK_ID, null));
        assertThrows(DecodingException.class, () -> codec.decode(null));
    }

    @Test
    void testTaskListPreservesOrder() throws Exception {
        Task first = minimalTask();
        Task second = minimalTask().toBuilder().id(UUID.randomUUID()).title("b").build();

        List<Task> decoded = codec.decode(TaskWireCodec.TASK_LIST,
            codec.encode(TaskWireCodec.TASK_LIST, List.of(first, second)));

        assertEquals(List.of(first, second), decoded);
    }

    @Test
    void testForgedListCountIsRejected() throws Exception {
        byte[] bytes = codec.encode(TaskWireCodec.TASK_LIST, List.of(minimalTask()));
        // count is a single varint byte; claim 100 records
        bytes[0] = 100;

        assertThrows(DecodingException.class, () -> codec.decode(TaskWireCodec.TASK_LIST, bytes));
    }

    @Test
    void testQueryKeepsOptionalFilters() throws Exception {
        TaskQuery query = new TaskQuery(UUID.randomUUID(), TaskStatus.DONE, null, Boolean.FALSE, 10, 20);

        TaskQuery decoded = codec.decode(TaskWireCodec.TASK_QUERY, codec.encode(TaskWireCodec.TASK_QUERY, query));

        assertEquals(query, decoded);
        assertNull(decoded.getPriority());
        assertEquals(Boolean.FALSE, decoded.getCompleted());
    }

    @Test
    void testDraftDefaultsArePopulated() throws Exception {
        TaskDraft draft = new TaskDraft("New", null, null, null, null, null);

        TaskDraft decoded = codec.decode(TaskWireCodec.TASK_DRAFT, codec.encode(TaskWireCodec.TASK_DRAFT, draft));

        assertEquals(Priority.MEDIUM, decoded.getPriority());
        assertEquals(TaskStatus.TODO, decoded.getStatus());
        assertEquals("", decoded.getDescription());
    }
}
