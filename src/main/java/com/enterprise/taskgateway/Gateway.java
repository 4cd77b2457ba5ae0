package com.enterprise.taskgateway;

import com.enterprise.taskgateway.collaborator.AgentEndpoint;
import com.enterprise.taskgateway.collaborator.QueuePublisher;
import com.enterprise.taskgateway.config.GatewayConfig;
import com.enterprise.taskgateway.monitoring.GatewayMetrics;
import com.enterprise.taskgateway.monitoring.HealthChecker;
import com.enterprise.taskgateway.router.GatewayRequest;
import com.enterprise.taskgateway.router.GatewayResponse;
import com.enterprise.taskgateway.router.RequestRouter;
import com.enterprise.taskgateway.rpc.TasksRpcClient;
import com.enterprise.taskgateway.transport.ConnectionPool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An assembled gateway: router, RPC client, pool and collaborators
 */
public class Gateway implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Gateway.class);

    private final GatewayConfig config;
    private final ConnectionPool connectionPool;
    private final TasksRpcClient tasksClient;
    private final RequestRouter router;
    private final QueuePublisher queuePublisher;
    private final boolean ownsQueuePublisher;
    private final AgentEndpoint agentEndpoint;
    private final GatewayMetrics metrics;
    private final HealthChecker healthChecker;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper objectMapper;

    Gateway(GatewayConfig config, ConnectionPool connectionPool, TasksRpcClient tasksClient, RequestRouter router,
            QueuePublisher queuePublisher, boolean ownsQueuePublisher, AgentEndpoint agentEndpoint, GatewayMetrics metrics,
            HealthChecker healthChecker, MeterRegistry meterRegistry, ObjectMapper objectMapper) {
        this.config = config;
        this.connectionPool = connectionPool;
        this.tasksClient = tasksClient;
        this.router = router;
        this.queuePublisher = queuePublisher;
        this.ownsQueuePublisher = ownsQueuePublisher;
        this.agentEndpoint = agentEndpoint;
        this.metrics = metrics;
        this.healthChecker = healthChecker;
        this.meterRegistry = meterRegistry;
        this.objectMapper = objectMapper;
    }

    public CompletableFuture<GatewayResponse> handle(GatewayRequest request) {
        return router.route(request);
    }

    public CompletableFuture<GatewayResponse> handle(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        return router.route(request, chunkSink);
    }

    public GatewayConfig getConfig() { return config; }
    public ConnectionPool getConnectionPool() { return connectionPool; }
    public TasksRpcClient getTasksClient() { return tasksClient; }
    public RequestRouter getRouter() { return router; }
    public QueuePublisher getQueuePublisher() { return queuePublisher; }
    /** Null when no agent endpoint is configured */
    public AgentEndpoint getAgentEndpoint() { return agentEndpoint; }
    public GatewayMetrics getMetrics() { return metrics; }
    /** Null when health checks are disabled */
    public HealthChecker getHealthChecker() { return healthChecker; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public ObjectMapper getObjectMapper() { return objectMapper; }

    /**
     * Shut down the pool, and the queue publisher when the gateway created it.
     * A publisher supplied by the caller stays open.
     */
    @Override
    public void close() {
        logger.info("Shutting down gateway");
        connectionPool.close();
        if (!ownsQueuePublisher) {
            return;
        }
        try {
            queuePublisher.close();
        } catch (Exception e) {
            logger.warn("Error closing queue publisher", e);
        }
    }
}
