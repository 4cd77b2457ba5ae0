package com.enterprise.taskgateway.router;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Serves classified requests for one dispatch pattern. Failures are reported
 * through the returned future, never thrown.
 */
public interface Dispatcher {

    DispatchPattern pattern();

    /**
     * Whether this dispatcher can serve the domain. Checked before dispatch,
     * so a domain nobody serves fails as unroutable.
     */
    default boolean serves(String targetDomain) {
        return true;
    }

    /**
     * @param chunkSink receives partial results of streaming operations
     */
    CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink);
}
