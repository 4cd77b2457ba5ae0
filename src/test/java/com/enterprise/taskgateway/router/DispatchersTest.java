package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.GatewayFactory;
import com.enterprise.taskgateway.collaborator.AgentChunk;
import com.enterprise.taskgateway.collaborator.AgentEndpoint;
import com.enterprise.taskgateway.collaborator.AgentReply;
import com.enterprise.taskgateway.collaborator.DatastoreDriver;
import com.enterprise.taskgateway.exception.InvalidArgumentException;
import com.enterprise.taskgateway.exception.NotFoundException;
import com.enterprise.taskgateway.exception.UnavailableException;
import com.enterprise.taskgateway.queue.JobDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class DispatchersTest {

    private final ObjectMapper objectMapper = GatewayFactory.createObjectMapper();

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return e.getCause();
    }

    @Test
    void testDatastoreReturnsAllRows() throws Exception {
        List<Object> seenParams = new ArrayList<>();
        DatastoreDriver driver = (query, params) -> {
            seenParams.addAll(params);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", 7);
            row.put("name", "Launch");
            return CompletableFuture.completedFuture(List.of(row, Map.<String, Object>of("id", 8)));
        };
        DatastoreDispatcher dispatcher = new DatastoreDispatcher(driver, objectMapper);
        ObjectNode payload = objectMapper.createObjectNode().put("query", "select * from projects where owner = ?");
        payload.putArray("params").add("alice");

        JsonNode result = dispatcher.dispatch(
            GatewayRequest.builder(Operation.QUERY, "projects").payload(payload).build(), chunk -> { })
            .get(5, TimeUnit.SECONDS);

        assertEquals(List.of("alice"), seenParams);
        assertTrue(result.isArray());
        assertEquals(2, result.size());
        assertEquals("Launch", result.get(0).path("name").asText());
    }

    @Test
    void testDatastoreExpectOneWithoutRowsIsNotFound() {
        DatastoreDriver driver = (query, params) -> CompletableFuture.completedFuture(Collections.emptyList());
        DatastoreDispatcher dispatcher = new DatastoreDispatcher(driver, objectMapper);
        ObjectNode payload = objectMapper.createObjectNode()
            .put("query", "select * from users where id = 1")
            .put("expect_one", true);

        Throwable failure = failureOf(dispatcher.dispatch(
            GatewayRequest.builder(Operation.QUERY, "users").payload(payload).build(), chunk -> { }));

        assertInstanceOf(NotFoundException.class, failure);
        assertEquals("users", ((NotFoundException) failure).getResourceId());
    }

    @Test
    void testDatastoreRequiresQuery() {
        DatastoreDriver driver = (query, params) -> {
            throw new AssertionError("driver must not be called");
        };
        DatastoreDispatcher dispatcher = new DatastoreDispatcher(driver, objectMapper);

        Throwable missingQuery = failureOf(dispatcher.dispatch(
            GatewayRequest.builder(Operation.QUERY, "users").build(), chunk -> { }));
        Throwable badParams = failureOf(dispatcher.dispatch(GatewayRequest.builder(Operation.QUERY, "users")
            .payload(objectMapper.createObjectNode().put("query", "select 1").put("params", "oops"))
            .build(), chunk -> { }));

        assertInstanceOf(InvalidArgumentException.class, missingQuery);
        assertInstanceOf(InvalidArgumentException.class, badParams);
    }

    @Test
    void testQueuePublishesJobDescriptor() throws Exception {
        RpcDispatcherTest.RecordingPublisher publisher = new RpcDispatcherTest.RecordingPublisher();
        QueueDispatcher dispatcher = new QueueDispatcher(publisher, objectMapper);
        ObjectNode payload = objectMapper.createObjectNode().put("type", "welcome-email").put("to", "a@b.c");

        JsonNode ack = dispatcher.dispatch(GatewayRequest.builder(Operation.PUBLISH, "emails")
            .requestId("req-1")
            .caller(CallerContext.of("user-42"))
            .payload(payload)
            .build(), chunk -> { }).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("emails"), publisher.subjects);
        JobDescriptor job = objectMapper.readValue(publisher.messages.get(0), JobDescriptor.class);
        assertEquals("welcome-email", job.getType());
        assertEquals("req-1", job.getRequestId());
        assertEquals("user-42", job.getCallerId());
        assertEquals("a@b.c", job.getPayload().path("to").asText());
        assertNotNull(job.getEnqueuedAt());
        assertEquals(job.getJobId().toString(), ack.path("job_id").asText());
        assertEquals("emails", ack.path("subject").asText());
        assertEquals(1, ack.path("sequence").asLong());
    }

    @Test
    void testQueueJobTypeDefaultsToSubject() throws Exception {
        RpcDispatcherTest.RecordingPublisher publisher = new RpcDispatcherTest.RecordingPublisher();
        QueueDispatcher dispatcher = new QueueDispatcher(publisher, objectMapper);

        dispatcher.dispatch(GatewayRequest.builder(Operation.PUBLISH, "notifications").build(), chunk -> { })
            .get(5, TimeUnit.SECONDS);

        JobDescriptor job = objectMapper.readValue(publisher.messages.get(0), JobDescriptor.class);
        assertEquals("notifications", job.getType());
    }

    @Test
    void testAgentInvokeConvertsReply() throws Exception {
        AgentDispatcher dispatcher = new AgentDispatcher(new ScriptedAgent(), objectMapper);

        JsonNode reply = dispatcher.dispatch(GatewayRequest.builder(Operation.INVOKE, "agents")
            .payload(TextNode.valueOf("plan my week")).build(), chunk -> { }).get(5, TimeUnit.SECONDS);

        assertEquals("planner", reply.path("agent").asText());
        assertEquals("echo: plan my week", reply.path("output").asText());
    }

    @Test
    void testAgentStreamForwardsChunks() throws Exception {
        AgentDispatcher dispatcher = new AgentDispatcher(new ScriptedAgent(), objectMapper);
        List<JsonNode> chunks = new CopyOnWriteArrayList<>();

        JsonNode reply = dispatcher.dispatch(GatewayRequest.builder(Operation.STREAM, "agents")
            .payload(TextNode.valueOf("hi")).build(), chunks::add).get(5, TimeUnit.SECONDS);

        assertEquals(2, chunks.size());
        assertEquals("echo: ", chunks.get(0).path("content").asText());
        assertTrue(chunks.get(1).path("last").asBoolean());
        assertEquals("echo: hi", reply.path("output").asText());
    }

    @Test
    void testAgentWithoutEndpointIsUnavailable() {
        AgentDispatcher dispatcher = new AgentDispatcher(null, objectMapper);

        Throwable failure = failureOf(dispatcher.dispatch(
            GatewayRequest.builder(Operation.INVOKE, "agents").build(), chunk -> { }));

        assertInstanceOf(UnavailableException.class, failure);
    }

    private static class ScriptedAgent implements AgentEndpoint {
        @Override
        public CompletableFuture<AgentReply> invoke(JsonNode payload) {
            return CompletableFuture.completedFuture(
                new AgentReply("planner", TextNode.valueOf("echo: " + payload.asText())));
        }

        @Override
        public CompletableFuture<AgentReply> stream(JsonNode payload, Consumer<AgentChunk> sink) {
            sink.accept(new AgentChunk(0, "echo: ", false));
            sink.accept(new AgentChunk(1, payload.asText(), true));
            return invoke(payload);
        }
    }
}
