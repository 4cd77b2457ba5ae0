package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.error.ErrorUnifier;
import com.enterprise.taskgateway.error.GatewayError;
import com.enterprise.taskgateway.exception.GatewayException;
import com.enterprise.taskgateway.exception.UnroutableRequestException;
import com.enterprise.taskgateway.monitoring.GatewayMetrics;
import com.enterprise.taskgateway.rpc.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Classifies each request by its target domain and hands it to exactly one
 * dispatcher. Every failure is normalized by the {@link ErrorUnifier}, so
 * callers see the same error shape whichever pattern served them.
 *
 * <p>Requests move RECEIVED, CLASSIFIED, DISPATCHED, then COMPLETED or FAILED.
 * A request whose cancellation token fires has its returned future cancelled
 * instead; a queue publish already handed off is not withdrawn.
 */
public class RequestRouter {

    private static final Logger logger = LoggerFactory.getLogger(RequestRouter.class);

    private static final Consumer<JsonNode> DISCARD = chunk -> { };

    private final RouteTable routeTable;
    private final Map<DispatchPattern, Dispatcher> dispatchers = new EnumMap<>(DispatchPattern.class);
    private final ErrorUnifier errorUnifier;
    private final GatewayMetrics metrics;

    public RequestRouter(RouteTable routeTable, Collection<? extends Dispatcher> dispatchers,
                         ErrorUnifier errorUnifier, GatewayMetrics metrics) {
        this.routeTable = routeTable;
        for (Dispatcher dispatcher : dispatchers) {
            if (this.dispatchers.put(dispatcher.pattern(), dispatcher) != null) {
                throw new IllegalArgumentException("Duplicate dispatcher for " + dispatcher.pattern());
            }
        }
        this.errorUnifier = errorUnifier;
        this.metrics = metrics;

        logger.info("RequestRouter initialized with {} route(s) and patterns {}",
                   routeTable.getRoutes().size(), this.dispatchers.keySet());
    }

    public CompletableFuture<GatewayResponse> route(GatewayRequest request) {
        return route(request, DISCARD);
    }

    /**
     * Route a request, forwarding partial results of streaming operations to the sink
     */
    public CompletableFuture<GatewayResponse> route(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        Lifecycle lifecycle = new Lifecycle(request.getRequestId());
        metrics.recordReceived();
        long started = System.nanoTime();

        DispatchPattern pattern;
        Dispatcher dispatcher;
        try {
            pattern = routeTable.classify(request.getTargetDomain(), request.getOperation());
            dispatcher = dispatchers.get(pattern);
            if (dispatcher == null) {
                throw new UnroutableRequestException(request.getTargetDomain(), request.getOperation().name(),
                    "no dispatcher is configured for " + pattern);
            }
            if (!dispatcher.serves(request.getTargetDomain())) {
                throw new UnroutableRequestException(request.getTargetDomain(), request.getOperation().name(),
                    "no " + pattern + " dispatcher serves this domain");
            }
        } catch (UnroutableRequestException e) {
            lifecycle.moveTo(RequestState.FAILED);
            metrics.recordUnroutable();
            logger.info("Request {} unroutable: {}", request.getRequestId(), e.getMessage());
            return CompletableFuture.completedFuture(
                GatewayResponse.failed(request.getRequestId(), null, GatewayError.of(e)));
        }
        lifecycle.moveTo(RequestState.CLASSIFIED);
        logger.debug("Request {} ({} on {}) classified as {}", request.getRequestId(),
                    request.getOperation(), request.getTargetDomain(), pattern);

        lifecycle.moveTo(RequestState.DISPATCHED);
        // Partial results stop as soon as the request is finished or cancelled
        AtomicBoolean open = new AtomicBoolean(true);
        Consumer<JsonNode> sink = chunkSink != null ? chunkSink : DISCARD;
        Consumer<JsonNode> gatedSink = chunk -> {
            if (open.get()) {
                sink.accept(chunk);
            }
        };
        CompletableFuture<JsonNode> dispatched;
        try {
            dispatched = dispatcher.dispatch(request, gatedSink);
        } catch (RuntimeException e) {
            dispatched = CompletableFuture.failedFuture(e);
        }

        // RPC calls carry the deadline on the wire; other patterns are bounded here
        if (request.getDeadline() != null && pattern != DispatchPattern.RPC) {
            dispatched = dispatched.orTimeout(request.getDeadline().toMillis(), TimeUnit.MILLISECONDS);
        }

        CompletableFuture<JsonNode> inFlight = dispatched;
        CompletableFuture<GatewayResponse> response = dispatched.handle((result, error) -> {
            open.set(false);
            long elapsed = System.nanoTime() - started;
            if (error == null) {
                lifecycle.moveTo(RequestState.COMPLETED);
                metrics.recordCompleted(pattern, elapsed);
                return pattern == DispatchPattern.QUEUE_PUBLISH
                    ? GatewayResponse.accepted(request.getRequestId(), pattern, result)
                    : GatewayResponse.completed(request.getRequestId(), pattern, result);
            }
            if (isCancellation(error) && isCancelledByCaller(request)) {
                lifecycle.moveTo(RequestState.FAILED);
                metrics.recordCancelled(pattern);
                throw new CancellationException("Request " + request.getRequestId() + " was cancelled");
            }
            GatewayException unified = errorUnifier.unify(error, pattern);
            lifecycle.moveTo(RequestState.FAILED);
            metrics.recordFailed(pattern, unified.getKind(), elapsed);
            logger.debug("Request {} failed via {}: {} {}", request.getRequestId(), pattern,
                        unified.getKind(), unified.getMessage());
            return GatewayResponse.failed(request.getRequestId(), pattern, GatewayError.of(unified));
        });

        if (request.getCancellationToken() != null) {
            CancellationToken.Registration registration = request.getCancellationToken().onCancel(() -> {
                open.set(false);
                response.cancel(false);
                if (pattern != DispatchPattern.QUEUE_PUBLISH) {
                    inFlight.cancel(false);
                }
            });
            response.whenComplete((value, error) -> registration.remove());
        }
        return response;
    }

    public RouteTable getRouteTable() {
        return routeTable;
    }

    private static boolean isCancellation(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof CancellationException;
    }

    private static boolean isCancelledByCaller(GatewayRequest request) {
        return request.getCancellationToken() != null && request.getCancellationToken().isCancelled();
    }

    /**
     * Tracks one request's state and rejects out-of-order moves
     */
    private static class Lifecycle {
        private final String requestId;
        private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.RECEIVED);

        Lifecycle(String requestId) {
            this.requestId = requestId;
        }

        void moveTo(RequestState next) {
            RequestState current = state.get();
            if (!current.canTransitionTo(next) || !state.compareAndSet(current, next)) {
                throw new IllegalStateException("Request " + requestId + " cannot move from "
                    + state.get() + " to " + next);
            }
            logger.trace("Request {} {} -> {}", requestId, current, next);
        }
    }
}
