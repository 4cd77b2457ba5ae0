package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.collaborator.DatastoreDriver;
import com.enterprise.taskgateway.exception.InvalidArgumentException;
import com.enterprise.taskgateway.exception.NotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Runs simple reads and writes on gateway-owned tables.
 * Payload: {@code {"query": "...", "params": [...], "expect_one": false}}.
 */
public class DatastoreDispatcher implements Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(DatastoreDispatcher.class);

    private final DatastoreDriver driver;
    private final ObjectMapper objectMapper;

    public DatastoreDispatcher(DatastoreDriver driver, ObjectMapper objectMapper) {
        this.driver = driver;
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchPattern pattern() {
        return DispatchPattern.DIRECT_DATASTORE;
    }

    @Override
    public CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        JsonNode payload = request.getPayload();
        String query = payload.path("query").asText("");
        if (query.trim().isEmpty()) {
            return CompletableFuture.failedFuture(
                new InvalidArgumentException("Datastore request needs a 'query' string"));
        }

        List<Object> params = new ArrayList<>();
        JsonNode paramsNode = payload.path("params");
        if (paramsNode.isArray()) {
            for (JsonNode param : paramsNode) {
                params.add(objectMapper.convertValue(param, Object.class));
            }
        } else if (!paramsNode.isMissingNode() && !paramsNode.isNull()) {
            return CompletableFuture.failedFuture(
                new InvalidArgumentException("Datastore 'params' must be an array"));
        }
        boolean expectOne = payload.path("expect_one").asBoolean(false);

        logger.debug("Request {} querying {} with {} param(s)", request.getRequestId(),
                    request.getTargetDomain(), params.size());

        return DispatchFutures.linked(driver.execute(query, params), rows -> toResult(request, rows, expectOne));
    }

    private JsonNode toResult(GatewayRequest request, List<Map<String, Object>> rows, boolean expectOne) {
        if (!expectOne) {
            return objectMapper.<JsonNode>valueToTree(rows);
        }
        if (rows.isEmpty()) {
            throw new CompletionException(new NotFoundException(request.getTargetDomain(),
                "No " + request.getTargetDomain() + " row matched", null));
        }
        return objectMapper.<JsonNode>valueToTree(rows.get(0));
    }
}
