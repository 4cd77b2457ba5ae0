package com.enterprise.taskgateway.retry;

import com.enterprise.taskgateway.exception.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Re-issues an asynchronous operation according to a {@link RetryPolicy}.
 * Each attempt starts the operation again, so every retry is a fresh call.
 */
public class RetryingCaller {

    private static final Logger logger = LoggerFactory.getLogger(RetryingCaller.class);

    private final RetryPolicy policy;

    public RetryingCaller(RetryPolicy policy) {
        this.policy = policy;
    }

    public <T> CompletableFuture<T> call(AsyncOperation<T> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, 1, result);
        return result;
    }

    private <T> void attempt(AsyncOperation<T> operation, int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<T> future;
        try {
            future = operation.start();
        } catch (GatewayException | RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (!policy.shouldRetry(cause, attempt)) {
                result.completeExceptionally(cause);
                return;
            }
            Duration delay = policy.getRetryDelay(attempt);
            logger.debug("Attempt {} failed with {}; retrying in {}ms", attempt, cause.getMessage(), delay.toMillis());
            CompletableFuture.runAsync(() -> attempt(operation, attempt + 1, result),
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
