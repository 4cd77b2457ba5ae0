package com.enterprise.taskgateway;

import com.enterprise.taskgateway.agent.HttpAgentEndpoint;
import com.enterprise.taskgateway.collaborator.AgentEndpoint;
import com.enterprise.taskgateway.collaborator.DatastoreDriver;
import com.enterprise.taskgateway.collaborator.QueuePublisher;
import com.enterprise.taskgateway.config.ConfigValidator;
import com.enterprise.taskgateway.config.GatewayConfig;
import com.enterprise.taskgateway.error.ErrorUnifier;
import com.enterprise.taskgateway.exception.UnavailableException;
import com.enterprise.taskgateway.monitoring.GatewayMetrics;
import com.enterprise.taskgateway.monitoring.HealthChecker;
import com.enterprise.taskgateway.queue.MapDbQueuePublisher;
import com.enterprise.taskgateway.router.AgentDispatcher;
import com.enterprise.taskgateway.router.DatastoreDispatcher;
import com.enterprise.taskgateway.router.Dispatcher;
import com.enterprise.taskgateway.router.QueueDispatcher;
import com.enterprise.taskgateway.router.RequestRouter;
import com.enterprise.taskgateway.router.RouteTable;
import com.enterprise.taskgateway.router.RpcDispatcher;
import com.enterprise.taskgateway.router.TaskEventPublisher;
import com.enterprise.taskgateway.rpc.TasksRpcClient;
import com.enterprise.taskgateway.transport.ChannelFactory;
import com.enterprise.taskgateway.transport.ConnectionPool;
import com.enterprise.taskgateway.transport.NettyChannelFactory;
import com.enterprise.taskgateway.wire.TaskWireCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating and configuring the gateway
 */
public class GatewayFactory {

    private static final Logger logger = LoggerFactory.getLogger(GatewayFactory.class);

    /**
     * Create a gateway with default configuration
     */
    public static Gateway createDefault(DatastoreDriver datastore) {
        return create(GatewayConfig.builder().build(), datastore);
    }

    /**
     * Create a gateway with custom configuration and the default collaborators
     */
    public static Gateway create(GatewayConfig config, DatastoreDriver datastore) {
        return builder(config).datastore(datastore).build();
    }

    public static Builder builder(GatewayConfig config) {
        return new Builder(config);
    }

    /**
     * The JSON mapper used for payloads, job descriptors and agent exchange
     */
    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    static void validate(GatewayConfig config) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }

    /**
     * Assembles a gateway, letting callers replace individual collaborators
     */
    public static class Builder {
        private final GatewayConfig config;
        private ChannelFactory channelFactory = new NettyChannelFactory();
        private DatastoreDriver datastore;
        private QueuePublisher queuePublisher;
        private AgentEndpoint agentEndpoint;
        private MeterRegistry meterRegistry;
        private ObjectMapper objectMapper;

        Builder(GatewayConfig config) {
            this.config = config;
        }

        public Builder channelFactory(ChannelFactory channelFactory) {
            this.channelFactory = channelFactory;
            return this;
        }

        /**
         * Without a datastore, owned-table requests fail as unroutable
         */
        public Builder datastore(DatastoreDriver datastore) {
            this.datastore = datastore;
            return this;
        }

        public Builder queuePublisher(QueuePublisher queuePublisher) {
            this.queuePublisher = queuePublisher;
            return this;
        }

        public Builder agentEndpoint(AgentEndpoint agentEndpoint) {
            this.agentEndpoint = agentEndpoint;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Gateway build() {
            validate(config);
            logger.info("Creating gateway with configuration: {}", config);

            ObjectMapper mapper = objectMapper != null ? objectMapper : createObjectMapper();
            MeterRegistry registry = meterRegistry;
            if (registry == null) {
                registry = config.getMonitoringConfig().isEnableMetrics()
                    ? new SimpleMeterRegistry()
                    : new CompositeMeterRegistry();
            }
            GatewayMetrics metrics = new GatewayMetrics(registry);

            GatewayConfig.CodecConfig codecConfig = config.getCodecConfig();
            TaskWireCodec codec = new TaskWireCodec(codecConfig.getMaxEncodingMessageSize(),
                                                    codecConfig.getMaxDecodingMessageSize());
            ConnectionPool pool = new ConnectionPool(config.getChannelConfig(), channelFactory);
            metrics.bindConnectionPool(pool);
            if (config.getChannelConfig().isEagerConnect()) {
                try {
                    pool.warmUp();
                } catch (UnavailableException e) {
                    logger.warn("Could not warm up connections to {}; they will be created on first use",
                               config.getChannelConfig().getTarget(), e);
                }
            }
            TasksRpcClient tasksClient = new TasksRpcClient(pool, codec, config.getClientConfig());

            QueuePublisher publisher = queuePublisher;
            if (publisher == null) {
                GatewayConfig.QueueConfig queueConfig = config.getQueueConfig();
                publisher = new MapDbQueuePublisher(queueConfig.getDbPath(), queueConfig.getPublishTimeout());
            }

            AgentEndpoint agent = agentEndpoint;
            GatewayConfig.AgentConfig agentConfig = config.getAgentConfig();
            if (agent == null && agentConfig.getBaseUri() != null) {
                agent = new HttpAgentEndpoint(agentConfig.getBaseUri(), agentConfig.getConnectTimeout(),
                                              agentConfig.getInvokeTimeout(), mapper);
            }

            GatewayConfig.RouterConfig routerConfig = config.getRouterConfig();
            TaskEventPublisher events = routerConfig.isPublishTaskEvents()
                ? new TaskEventPublisher(publisher, routerConfig.getTaskEventSubject(), mapper, metrics)
                : null;

            List<Dispatcher> dispatchers = new ArrayList<>();
            if (datastore != null) {
                dispatchers.add(new DatastoreDispatcher(datastore, mapper));
            } else {
                logger.warn("No datastore driver supplied; owned-table requests will be unroutable");
            }
            dispatchers.add(new RpcDispatcher(tasksClient, mapper, events));
            dispatchers.add(new QueueDispatcher(publisher, mapper));
            dispatchers.add(new AgentDispatcher(agent, mapper));

            RequestRouter router = new RequestRouter(new RouteTable(routerConfig.getRoutes()), dispatchers,
                                                     new ErrorUnifier(), metrics);

            HealthChecker healthChecker = config.getMonitoringConfig().isEnableHealthChecks()
                ? new HealthChecker(pool, metrics, config.getMonitoringConfig().getMaxErrorRatePercent())
                : null;

            logger.info("Gateway created successfully");
            boolean ownsPublisher = queuePublisher == null;
            return new Gateway(config, pool, tasksClient, router, publisher, ownsPublisher, agent, metrics,
                               healthChecker, registry, mapper);
        }
    }
}
