package com.enterprise.taskgateway.monitoring;

import com.enterprise.taskgateway.exception.ErrorKind;
import com.enterprise.taskgateway.router.DispatchPattern;
import com.enterprise.taskgateway.transport.ConnectionPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the gateway
 */
public class GatewayMetrics {

    private static final Logger logger = LoggerFactory.getLogger(GatewayMetrics.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<DispatchPattern, Timer> patternTimers = new ConcurrentHashMap<>();

    private final Counter requestsReceived;
    private final Counter requestsCompleted;
    private final Counter requestsFailed;
    private final Counter requestsUnroutable;
    private final Counter taskEventsDropped;

    private final AtomicLong activeRequests = new AtomicLong(0);

    public GatewayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.requestsReceived = Counter.builder("gateway.requests.received")
            .description("Total number of requests received")
            .register(meterRegistry);

        this.requestsCompleted = Counter.builder("gateway.requests.completed")
            .description("Total number of requests completed or accepted")
            .register(meterRegistry);

        this.requestsFailed = Counter.builder("gateway.requests.failed")
            .description("Total number of requests that failed")
            .register(meterRegistry);

        this.requestsUnroutable = Counter.builder("gateway.requests.unroutable")
            .description("Total number of requests no dispatch pattern matched")
            .register(meterRegistry);

        this.taskEventsDropped = Counter.builder("gateway.task.events.dropped")
            .description("Task events that could not be published")
            .register(meterRegistry);

        Gauge.builder("gateway.requests.active", activeRequests, AtomicLong::get)
            .description("Requests dispatched and not yet finished")
            .register(meterRegistry);

        logger.info("GatewayMetrics initialized");
    }

    /**
     * Expose the pool's live handles and in-flight leases as gauges
     */
    public void bindConnectionPool(ConnectionPool pool) {
        Gauge.builder("gateway.pool.handles.live", pool, p -> p.statistics().getLiveHandles())
            .description("Transport handles installed in the pool")
            .tag("target", pool.getTarget())
            .register(meterRegistry);

        Gauge.builder("gateway.pool.leases.inflight", pool, p -> p.statistics().getInFlightLeases())
            .description("Calls currently running on pooled handles")
            .tag("target", pool.getTarget())
            .register(meterRegistry);

        Gauge.builder("gateway.pool.handles.retired", pool, p -> p.statistics().getHandlesRetired())
            .description("Handles retired after faults")
            .tag("target", pool.getTarget())
            .register(meterRegistry);
    }

    public void recordReceived() {
        requestsReceived.increment();
        activeRequests.incrementAndGet();
    }

    public void recordUnroutable() {
        requestsUnroutable.increment();
        requestsFailed.increment();
        activeRequests.decrementAndGet();
        errorCounter(ErrorKind.UNROUTABLE_REQUEST).increment();
    }

    /**
     * Record a request served by the pattern
     */
    public void recordCompleted(DispatchPattern pattern, long durationNanos) {
        requestsCompleted.increment();
        activeRequests.decrementAndGet();
        outcomeCounter(pattern, "completed").increment();
        patternTimer(pattern).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Record a request the pattern failed to serve
     */
    public void recordFailed(DispatchPattern pattern, ErrorKind kind, long durationNanos) {
        requestsFailed.increment();
        activeRequests.decrementAndGet();
        outcomeCounter(pattern, "failed").increment();
        errorCounter(kind).increment();
        patternTimer(pattern).record(durationNanos, TimeUnit.NANOSECONDS);

        logger.debug("Recorded {} failure for {}", kind, pattern);
    }

    /**
     * Record a request abandoned by its caller
     */
    public void recordCancelled(DispatchPattern pattern) {
        activeRequests.decrementAndGet();
        outcomeCounter(pattern, "cancelled").increment();
    }

    public void recordTaskEventDropped() {
        taskEventsDropped.increment();
    }

    private Counter outcomeCounter(DispatchPattern pattern, String outcome) {
        String key = pattern.name() + "." + outcome;
        return outcomeCounters.computeIfAbsent(key, k ->
            Counter.builder("gateway.requests")
                .tag("pattern", pattern.name())
                .tag("outcome", outcome)
                .description("Requests by dispatch pattern and outcome")
                .register(meterRegistry)
        );
    }

    private Counter errorCounter(ErrorKind kind) {
        return errorCounters.computeIfAbsent(kind, k ->
            Counter.builder("gateway.errors")
                .tag("kind", kind.name())
                .description("Failures by error kind")
                .register(meterRegistry)
        );
    }

    private Timer patternTimer(DispatchPattern pattern) {
        return patternTimers.computeIfAbsent(pattern, k ->
            Timer.builder("gateway.request.duration")
                .tag("pattern", pattern.name())
                .description("Request duration by dispatch pattern")
                .register(meterRegistry)
        );
    }

    public long getRequestsReceived() {
        return (long) requestsReceived.count();
    }

    public long getRequestsFailed() {
        return (long) requestsFailed.count();
    }

    public long getActiveRequests() {
        return activeRequests.get();
    }

    public long getErrorCount(ErrorKind kind) {
        Counter counter = errorCounters.get(kind);
        return counter != null ? (long) counter.count() : 0;
    }

    /**
     * Get the headline metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("requests.received", requestsReceived.count());
        metrics.put("requests.completed", requestsCompleted.count());
        metrics.put("requests.failed", requestsFailed.count());
        metrics.put("requests.unroutable", requestsUnroutable.count());
        metrics.put("requests.active", activeRequests.get());
        metrics.put("task.events.dropped", taskEventsDropped.count());
        for (Map.Entry<ErrorKind, Counter> entry : errorCounters.entrySet()) {
            metrics.put("errors." + entry.getKey().name(), entry.getValue().count());
        }

        return metrics;
    }
}
