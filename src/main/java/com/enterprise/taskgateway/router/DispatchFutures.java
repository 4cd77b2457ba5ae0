package com.enterprise.taskgateway.router;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Futures returned by dispatchers. Cancelling or timing out the returned
 * future cancels the collaborator's own future as well.
 */
final class DispatchFutures {

    private DispatchFutures() {
    }

    static <T> CompletableFuture<JsonNode> linked(CompletableFuture<T> source,
                                                  Function<? super T, ? extends JsonNode> mapper) {
        CompletableFuture<JsonNode> result = source.thenApply(mapper);
        result.whenComplete((value, error) -> {
            if (error != null && !source.isDone()) {
                source.cancel(true);
            }
        });
        return result;
    }
}
