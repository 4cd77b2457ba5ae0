package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.GatewayFactory;
import com.enterprise.taskgateway.config.GatewayConfig;
import com.enterprise.taskgateway.error.ErrorUnifier;
import com.enterprise.taskgateway.exception.ErrorKind;
import com.enterprise.taskgateway.monitoring.GatewayMetrics;
import com.enterprise.taskgateway.rpc.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class RequestRouterTest {

    private final ObjectMapper objectMapper = GatewayFactory.createObjectMapper();
    private GatewayMetrics metrics;
    private RouteTable routeTable;

    private RecordingDispatcher datastore;
    private RecordingDispatcher rpc;
    private RecordingDispatcher queue;
    private RecordingDispatcher agent;
    private RequestRouter router;

    @BeforeEach
    void setUp() {
        metrics = new GatewayMetrics(new SimpleMeterRegistry());
        routeTable = new RouteTable(GatewayConfig.Defaults.defaultRouterConfig().getRoutes());

        datastore = new RecordingDispatcher(DispatchPattern.DIRECT_DATASTORE, (request, sink) ->
            CompletableFuture.completedFuture(objectMapper.createArrayNode()));
        rpc = new RecordingDispatcher(DispatchPattern.RPC, (request, sink) ->
            CompletableFuture.completedFuture(objectMapper.createObjectNode().put("id", "t-1")));
        queue = new RecordingDispatcher(DispatchPattern.QUEUE_PUBLISH, (request, sink) ->
            CompletableFuture.completedFuture(objectMapper.createObjectNode().put("sequence", 1)));
        agent = new RecordingDispatcher(DispatchPattern.AGENT_INVOKE, (request, sink) ->
            CompletableFuture.completedFuture(TextNode.valueOf("answer")));

        router = newRouter(List.of(datastore, rpc, queue, agent));
    }

    private RequestRouter newRouter(List<Dispatcher> dispatchers) {
        return new RequestRouter(routeTable, dispatchers, new ErrorUnifier(), metrics);
    }

    private static GatewayResponse await(CompletableFuture<GatewayResponse> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testEachDomainKindSelectsItsPattern() throws Exception {
        GatewayResponse table = await(router.route(GatewayRequest.builder(Operation.QUERY, "projects").build()));
        GatewayResponse service = await(router.route(GatewayRequest.builder(Operation.GET, "tasks").build()));
        GatewayResponse sideEffect = await(router.route(GatewayRequest.builder(Operation.PUBLISH, "emails").build()));
        GatewayResponse reasoning = await(router.route(GatewayRequest.builder(Operation.INVOKE, "agents").build()));

        assertEquals(DispatchPattern.DIRECT_DATASTORE, table.getPatternUsed());
        assertEquals(DispatchPattern.RPC, service.getPatternUsed());
        assertEquals(DispatchPattern.QUEUE_PUBLISH, sideEffect.getPatternUsed());
        assertEquals(DispatchPattern.AGENT_INVOKE, reasoning.getPatternUsed());
        assertEquals(1, datastore.calls.size());
        assertEquals(1, rpc.calls.size());
        assertEquals(1, queue.calls.size());
        assertEquals(1, agent.calls.size());
    }

    @Test
    void testQueuePublishIsAccepted() throws Exception {
        GatewayResponse response = await(router.route(
            GatewayRequest.builder(Operation.PUBLISH, "notifications").requestId("req-7").build()));

        assertEquals(ResponseStatus.ACCEPTED, response.getStatus());
        assertTrue(response.isSuccess());
        assertEquals("req-7", response.getRequestId());
        assertEquals(1, response.getResult().path("sequence").asInt());
    }

    @Test
    void testCompletedResponseCarriesResult() throws Exception {
        GatewayResponse response = await(router.route(GatewayRequest.builder(Operation.INVOKE, "agents").build()));

        assertEquals(ResponseStatus.COMPLETED, response.getStatus());
        assertEquals("answer", response.getResult().asText());
        assertNull(response.getError());
    }

    @Test
    void testClassificationIsDeterministic() throws Exception {
        GatewayRequest request = GatewayRequest.builder(Operation.LIST, "tasks").build();

        DispatchPattern first = await(router.route(request)).getPatternUsed();
        DispatchPattern second = await(router.route(request)).getPatternUsed();

        assertEquals(first, second);
        assertEquals(2, rpc.calls.size());
    }

    @Test
    void testUnknownDomainIsUnroutable() throws Exception {
        GatewayResponse response = await(router.route(GatewayRequest.builder(Operation.GET, "invoices").build()));

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertNull(response.getPatternUsed());
        assertEquals(ErrorKind.UNROUTABLE_REQUEST, response.getError().getKind());
        assertTrue(rpc.calls.isEmpty());
        assertEquals(1, metrics.getErrorCount(ErrorKind.UNROUTABLE_REQUEST));
    }

    @Test
    void testMissingDomainIsUnroutable() throws Exception {
        GatewayResponse response = await(router.route(GatewayRequest.builder(Operation.GET, "").build()));

        assertEquals(ErrorKind.UNROUTABLE_REQUEST, response.getError().getKind());
    }

    @Test
    void testOperationOutsidePatternIsUnroutable() throws Exception {
        GatewayResponse response = await(router.route(GatewayRequest.builder(Operation.PUBLISH, "tasks").build()));

        assertEquals(ErrorKind.UNROUTABLE_REQUEST, response.getError().getKind());
        assertTrue(rpc.calls.isEmpty());
        assertTrue(queue.calls.isEmpty());
    }

    @Test
    void testPatternWithoutDispatcherIsUnroutable() throws Exception {
        RequestRouter withoutDatastore = newRouter(List.of(rpc, queue, agent));

        GatewayResponse response = await(withoutDatastore.route(
            GatewayRequest.builder(Operation.QUERY, "users").build()));

        assertEquals(ErrorKind.UNROUTABLE_REQUEST, response.getError().getKind());
        assertNull(response.getPatternUsed());
    }

    @Test
    void testDuplicateDispatcherIsRejected() {
        RecordingDispatcher secondRpc = new RecordingDispatcher(DispatchPattern.RPC, (request, sink) ->
            CompletableFuture.completedFuture(null));

        assertThrows(IllegalArgumentException.class, () -> newRouter(List.of(rpc, secondRpc)));
    }

    @Test
    void testDatastoreFailureIsUnified() throws Exception {
        RecordingDispatcher failing = new RecordingDispatcher(DispatchPattern.DIRECT_DATASTORE, (request, sink) ->
            CompletableFuture.failedFuture(new SQLException("duplicate key", "23505")));
        RequestRouter failingRouter = newRouter(List.of(failing, rpc, queue, agent));

        GatewayResponse response = await(failingRouter.route(
            GatewayRequest.builder(Operation.QUERY, "projects").build()));

        assertEquals(ResponseStatus.FAILED, response.getStatus());
        assertEquals(DispatchPattern.DIRECT_DATASTORE, response.getPatternUsed());
        assertEquals(ErrorKind.INVALID_ARGUMENT, response.getError().getKind());
        assertEquals("23505", response.getError().getContext().get("sql.state"));
        assertEquals("DIRECT_DATASTORE", response.getError().getContext().get("pattern"));
        assertEquals(1, metrics.getRequestsFailed());
    }

    @Test
    void testSynchronousDispatcherFailureIsInternal() throws Exception {
        RecordingDispatcher throwing = new RecordingDispatcher(DispatchPattern.AGENT_INVOKE, (request, sink) -> {
            throw new IllegalStateException("bug");
        });
        RequestRouter throwingRouter = newRouter(List.of(datastore, rpc, queue, throwing));

        GatewayResponse response = await(throwingRouter.route(
            GatewayRequest.builder(Operation.INVOKE, "agents").build()));

        assertEquals(ErrorKind.INTERNAL, response.getError().getKind());
        assertFalse(response.getError().isRetryable());
    }

    @Test
    void testDeadlineBoundsNonRpcPatterns() throws Exception {
        RecordingDispatcher silentAgent = new RecordingDispatcher(DispatchPattern.AGENT_INVOKE, (request, sink) ->
            new CompletableFuture<>());
        RequestRouter slowRouter = newRouter(List.of(datastore, rpc, queue, silentAgent));

        GatewayResponse response = await(slowRouter.route(GatewayRequest.builder(Operation.INVOKE, "agents")
            .deadline(Duration.ofMillis(50))
            .build()));

        assertEquals(ErrorKind.DEADLINE_EXCEEDED, response.getError().getKind());
        assertTrue(response.getError().isRetryable());
        assertEquals(0, metrics.getActiveRequests());
    }

    @Test
    void testStreamingChunksReachSink() throws Exception {
        RecordingDispatcher streamingAgent = new RecordingDispatcher(DispatchPattern.AGENT_INVOKE, (request, sink) -> {
            sink.accept(TextNode.valueOf("partial-1"));
            sink.accept(TextNode.valueOf("partial-2"));
            return CompletableFuture.completedFuture(TextNode.valueOf("final"));
        });
        RequestRouter streamingRouter = newRouter(List.of(datastore, rpc, queue, streamingAgent));
        List<JsonNode> chunks = new CopyOnWriteArrayList<>();

        GatewayResponse response = await(streamingRouter.route(
            GatewayRequest.builder(Operation.STREAM, "agents").build(), chunks::add));

        assertEquals(List.of(TextNode.valueOf("partial-1"), TextNode.valueOf("partial-2")), chunks);
        assertEquals("final", response.getResult().asText());
    }

    @Test
    void testCancellationAbandonsAgentCall() throws Exception {
        CompletableFuture<JsonNode> agentWork = new CompletableFuture<>();
        RecordingDispatcher pendingAgent = new RecordingDispatcher(DispatchPattern.AGENT_INVOKE, (request, sink) ->
            agentWork);
        RequestRouter pendingRouter = newRouter(List.of(datastore, rpc, queue, pendingAgent));
        CancellationToken token = new CancellationToken();

        CompletableFuture<GatewayResponse> response = pendingRouter.route(
            GatewayRequest.builder(Operation.INVOKE, "agents").cancellationToken(token).build());
        token.cancel();

        assertTrue(response.isCancelled());
        assertThrows(CancellationException.class, () -> response.get(1, TimeUnit.SECONDS));
        assertTrue(agentWork.isCancelled());
        assertEquals(0, metrics.getActiveRequests());
    }

    @Test
    void testCancellationDoesNotWithdrawPublishedJob() throws Exception {
        CompletableFuture<JsonNode> publishWork = new CompletableFuture<>();
        RecordingDispatcher pendingQueue = new RecordingDispatcher(DispatchPattern.QUEUE_PUBLISH, (request, sink) ->
            publishWork);
        RequestRouter pendingRouter = newRouter(List.of(datastore, rpc, pendingQueue, agent));
        CancellationToken token = new CancellationToken();

        CompletableFuture<GatewayResponse> response = pendingRouter.route(
            GatewayRequest.builder(Operation.PUBLISH, "emails").cancellationToken(token).build());
        token.cancel();

        assertTrue(response.isCancelled());
        assertFalse(publishWork.isDone());
        publishWork.complete(objectMapper.createObjectNode());
        assertEquals(0, metrics.getActiveRequests());
    }

    @Test
    void testMetricsCountEveryRequest() throws Exception {
        await(router.route(GatewayRequest.builder(Operation.GET, "tasks").build()));
        await(router.route(GatewayRequest.builder(Operation.GET, "nowhere").build()));

        assertEquals(2, metrics.getRequestsReceived());
        assertEquals(1, metrics.getRequestsFailed());
        assertEquals(0, metrics.getActiveRequests());
    }

    static class RecordingDispatcher implements Dispatcher {
        final DispatchPattern pattern;
        final BiFunction<GatewayRequest, Consumer<JsonNode>, CompletableFuture<JsonNode>> behavior;
        final List<GatewayRequest> calls = new CopyOnWriteArrayList<>();

        RecordingDispatcher(DispatchPattern pattern,
                            BiFunction<GatewayRequest, Consumer<JsonNode>, CompletableFuture<JsonNode>> behavior) {
            this.pattern = pattern;
            this.behavior = behavior;
        }

        @Override
        public DispatchPattern pattern() {
            return pattern;
        }

        @Override
        public CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink) {
            calls.add(request);
            return behavior.apply(request, chunkSink);
        }
    }
}
