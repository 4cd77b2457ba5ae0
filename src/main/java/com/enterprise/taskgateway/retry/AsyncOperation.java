package com.enterprise.taskgateway.retry;

import com.enterprise.taskgateway.exception.GatewayException;

import java.util.concurrent.CompletableFuture;

/**
 * One attempt of a retried operation. Throwing counts as a failed attempt.
 */
@FunctionalInterface
public interface AsyncOperation<T> {

    CompletableFuture<T> start() throws GatewayException;
}
