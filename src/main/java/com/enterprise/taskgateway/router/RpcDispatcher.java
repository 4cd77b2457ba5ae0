package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.exception.InvalidArgumentException;
import com.enterprise.taskgateway.exception.UnroutableRequestException;
import com.enterprise.taskgateway.rpc.RpcCallOptions;
import com.enterprise.taskgateway.rpc.TaskStream;
import com.enterprise.taskgateway.rpc.TasksRpcClient;
import com.enterprise.taskgateway.wire.Task;
import com.enterprise.taskgateway.wire.TaskDraft;
import com.enterprise.taskgateway.wire.TaskQuery;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Serves domain-service requests through the tasks RPC client. JSON payloads
 * are converted to wire types here, so malformed input fails before any call.
 */
public class RpcDispatcher implements Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(RpcDispatcher.class);

    public static final String TASKS_DOMAIN = "tasks";

    private final TasksRpcClient client;
    private final ObjectMapper objectMapper;
    private final TaskEventPublisher events;
    private final Set<String> servedDomains;

    /**
     * @param events null disables task events
     */
    public RpcDispatcher(TasksRpcClient client, ObjectMapper objectMapper, TaskEventPublisher events) {
        this(client, objectMapper, events, Collections.singleton(TASKS_DOMAIN));
    }

    public RpcDispatcher(TasksRpcClient client, ObjectMapper objectMapper, TaskEventPublisher events,
                         Set<String> servedDomains) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.events = events;
        this.servedDomains = Collections.unmodifiableSet(new LinkedHashSet<>(servedDomains));
    }

    @Override
    public DispatchPattern pattern() {
        return DispatchPattern.RPC;
    }

    @Override
    public boolean serves(String targetDomain) {
        return servedDomains.contains(targetDomain);
    }

    @Override
    public CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        RpcCallOptions options = RpcCallOptions.builder()
            .deadline(request.getDeadline())
            .cancellationToken(request.getCancellationToken())
            .requestId(request.getRequestId())
            .build();
        JsonNode payload = request.getPayload();

        try {
            switch (request.getOperation()) {
                case CREATE:
                    return DispatchFutures.linked(client.create(read(payload, TaskDraft.class), options),
                        task -> announce(TaskEventPublisher.TASK_CREATED, task, request));
                case GET:
                    return DispatchFutures.linked(client.getById(readId(payload), options), this::toJson);
                case LIST:
                    return DispatchFutures.linked(client.list(readQuery(payload), options),
                        tasks -> objectMapper.<JsonNode>valueToTree(tasks));
                case LIST_STREAM:
                    return stream(readQuery(payload), options, chunkSink);
                case UPDATE:
                    return DispatchFutures.linked(client.updateById(read(payload, Task.class), options),
                        task -> announce(TaskEventPublisher.TASK_UPDATED, task, request));
                case DELETE:
                    UUID id = readId(payload);
                    return DispatchFutures.linked(client.deleteById(id, options), ignored -> {
                        if (events != null) {
                            events.publish(TaskEventPublisher.TASK_DELETED, id, null, request.getRequestId());
                        }
                        ObjectNode result = objectMapper.createObjectNode();
                        result.put("id", id.toString());
                        result.put("deleted", true);
                        return result;
                    });
                default:
                    return CompletableFuture.failedFuture(new UnroutableRequestException(
                        request.getTargetDomain(), request.getOperation().name(), "not an RPC operation"));
            }
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<JsonNode> stream(TaskQuery query, RpcCallOptions options, Consumer<JsonNode> chunkSink) {
        TaskStream stream = client.listStream(query, new StreamObserver<>() {
            @Override
            public void onNext(Task task) {
                chunkSink.accept(toJson(task));
            }

            @Override
            public void onError(Throwable t) {
                logger.debug("ListStream ended with {}", t.getMessage());
            }

            @Override
            public void onCompleted() {
            }
        }, options);

        return DispatchFutures.linked(stream.completion(), count -> {
            ObjectNode result = objectMapper.createObjectNode();
            result.put("count", count);
            return result;
        });
    }

    private JsonNode announce(String eventType, Task task, GatewayRequest request) {
        JsonNode json = toJson(task);
        if (events != null) {
            events.publish(eventType, task.getId(), json, request.getRequestId());
        }
        return json;
    }

    private JsonNode toJson(Task task) {
        return objectMapper.valueToTree(task);
    }

    private <T> T read(JsonNode payload, Class<T> type) throws InvalidArgumentException {
        try {
            T value = objectMapper.treeToValue(payload, type);
            if (value == null) {
                throw new InvalidArgumentException(type.getSimpleName() + " payload is required");
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid " + type.getSimpleName() + " payload: " + e.getMessage(), e);
        }
    }

    private TaskQuery readQuery(JsonNode payload) throws InvalidArgumentException {
        if (payload == null || payload.isNull() || payload.isMissingNode() || payload.isEmpty()) {
            return TaskQuery.all();
        }
        return read(payload, TaskQuery.class);
    }

    private UUID readId(JsonNode payload) throws InvalidArgumentException {
        String id = payload.isTextual() ? payload.asText() : payload.path("id").asText("");
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Payload needs a task 'id' UUID, got '" + id + "'", e);
        }
    }
}
