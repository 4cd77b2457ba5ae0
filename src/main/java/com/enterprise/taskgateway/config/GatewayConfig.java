package com.enterprise.taskgateway.config;

import com.enterprise.taskgateway.router.DomainKind;
import com.enterprise.taskgateway.wire.TaskWireCodec;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration for the task gateway
 */
public class GatewayConfig {

    public static final String PREFIX = "gateway.";

    private final ChannelConfig channelConfig;
    private final CodecConfig codecConfig;
    private final ClientConfig clientConfig;
    private final RouterConfig routerConfig;
    private final QueueConfig queueConfig;
    private final AgentConfig agentConfig;
    private final MonitoringConfig monitoringConfig;

    public GatewayConfig(ChannelConfig channelConfig, CodecConfig codecConfig, ClientConfig clientConfig,
                         RouterConfig routerConfig, QueueConfig queueConfig, AgentConfig agentConfig,
                         MonitoringConfig monitoringConfig) {
        this.channelConfig = channelConfig;
        this.codecConfig = codecConfig;
        this.clientConfig = clientConfig;
        this.routerConfig = routerConfig;
        this.queueConfig = queueConfig;
        this.agentConfig = agentConfig;
        this.monitoringConfig = monitoringConfig;
    }

    public ChannelConfig getChannelConfig() { return channelConfig; }
    public CodecConfig getCodecConfig() { return codecConfig; }
    public ClientConfig getClientConfig() { return clientConfig; }
    public RouterConfig getRouterConfig() { return routerConfig; }
    public QueueConfig getQueueConfig() { return queueConfig; }
    public AgentConfig getAgentConfig() { return agentConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    @Override
    public String toString() {
        return "GatewayConfig{target=" + channelConfig.getTarget()
            + ", poolSlots=" + channelConfig.getPoolSlots()
            + ", routes=" + routerConfig.getRoutes().keySet() + "}";
    }

    /**
     * Transport tunables for the multiplexed HTTP/2 channels to the tasks service
     */
    public static class ChannelConfig {
        private final String target;
        private final boolean plaintext;
        private final int poolSlots;
        private final boolean eagerConnect;
        private final Duration keepAliveInterval;
        private final Duration keepAliveTimeout;
        private final boolean keepAliveWhileIdle;
        private final Duration connectTimeout;
        private final int initialWindowSize;
        private final boolean adaptiveWindow;
        private final boolean lowLatency;
        private final int maxInboundMessageSize;
        private final int maxConsecutiveTimeouts;

        public ChannelConfig(String target, boolean plaintext, int poolSlots, boolean eagerConnect,
                             Duration keepAliveInterval, Duration keepAliveTimeout, boolean keepAliveWhileIdle,
                             Duration connectTimeout, int initialWindowSize, boolean adaptiveWindow,
                             boolean lowLatency, int maxInboundMessageSize, int maxConsecutiveTimeouts) {
            this.target = target;
            this.plaintext = plaintext;
            this.poolSlots = poolSlots;
            this.eagerConnect = eagerConnect;
            this.keepAliveInterval = keepAliveInterval;
            this.keepAliveTimeout = keepAliveTimeout;
            this.keepAliveWhileIdle = keepAliveWhileIdle;
            this.connectTimeout = connectTimeout;
            this.initialWindowSize = initialWindowSize;
            this.adaptiveWindow = adaptiveWindow;
            this.lowLatency = lowLatency;
            this.maxInboundMessageSize = maxInboundMessageSize;
            this.maxConsecutiveTimeouts = maxConsecutiveTimeouts;
        }

        public String getTarget() { return target; }
        public boolean isPlaintext() { return plaintext; }
        public int getPoolSlots() { return poolSlots; }
        public boolean isEagerConnect() { return eagerConnect; }
        /** Null disables HTTP/2 keep-alive pings */
        public Duration getKeepAliveInterval() { return keepAliveInterval; }
        public Duration getKeepAliveTimeout() { return keepAliveTimeout; }
        public boolean isKeepAliveWhileIdle() { return keepAliveWhileIdle; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public int getInitialWindowSize() { return initialWindowSize; }
        public boolean isAdaptiveWindow() { return adaptiveWindow; }
        public boolean isLowLatency() { return lowLatency; }
        public int getMaxInboundMessageSize() { return maxInboundMessageSize; }
        public int getMaxConsecutiveTimeouts() { return maxConsecutiveTimeouts; }
    }

    /**
     * Wire codec size caps
     */
    public static class CodecConfig {
        private final int maxEncodingMessageSize;
        private final int maxDecodingMessageSize;

        public CodecConfig(int maxEncodingMessageSize, int maxDecodingMessageSize) {
            this.maxEncodingMessageSize = maxEncodingMessageSize;
            this.maxDecodingMessageSize = maxDecodingMessageSize;
        }

        public int getMaxEncodingMessageSize() { return maxEncodingMessageSize; }
        public int getMaxDecodingMessageSize() { return maxDecodingMessageSize; }
    }

    /**
     * RPC client call defaults
     */
    public static class ClientConfig {
        private final Duration defaultDeadline;
        private final boolean compressSingleRecordCalls;
        private final boolean compressListCalls;

        public ClientConfig(Duration defaultDeadline, boolean compressSingleRecordCalls, boolean compressListCalls) {
            this.defaultDeadline = defaultDeadline;
            this.compressSingleRecordCalls = compressSingleRecordCalls;
            this.compressListCalls = compressListCalls;
        }

        public Duration getDefaultDeadline() { return defaultDeadline; }
        public boolean isCompressSingleRecordCalls() { return compressSingleRecordCalls; }
        public boolean isCompressListCalls() { return compressListCalls; }
    }

    /**
     * Route table and event publishing
     */
    public static class RouterConfig {
        private final Map<String, DomainKind> routes;
        private final boolean publishTaskEvents;
        private final String taskEventSubject;

        public RouterConfig(Map<String, DomainKind> routes, boolean publishTaskEvents, String taskEventSubject) {
            this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
            this.publishTaskEvents = publishTaskEvents;
            this.taskEventSubject = taskEventSubject;
        }

        public Map<String, DomainKind> getRoutes() { return routes; }
        public boolean isPublishTaskEvents() { return publishTaskEvents; }
        public String getTaskEventSubject() { return taskEventSubject; }
    }

    /**
     * Local outbox queue configuration
     */
    public static class QueueConfig {
        private final String dbPath;
        private final Duration publishTimeout;

        public QueueConfig(String dbPath, Duration publishTimeout) {
            this.dbPath = dbPath;
            this.publishTimeout = publishTimeout;
        }

        /** Null keeps the outbox in memory */
        public String getDbPath() { return dbPath; }
        public Duration getPublishTimeout() { return publishTimeout; }
    }

    /**
     * Agent endpoint configuration
     */
    public static class AgentConfig {
        private final String baseUri;
        private final Duration connectTimeout;
        private final Duration invokeTimeout;

        public AgentConfig(String baseUri, Duration connectTimeout, Duration invokeTimeout) {
            this.baseUri = baseUri;
            this.connectTimeout = connectTimeout;
            this.invokeTimeout = invokeTimeout;
        }

        /** Null when no agent endpoint is deployed */
        public String getBaseUri() { return baseUri; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public Duration getInvokeTimeout() { return invokeTimeout; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;
        private final Duration healthCheckInterval;
        private final double maxErrorRatePercent;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks,
                                Duration healthCheckInterval, double maxErrorRatePercent) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
            this.healthCheckInterval = healthCheckInterval;
            this.maxErrorRatePercent = maxErrorRatePercent;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public double getMaxErrorRatePercent() { return maxErrorRatePercent; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ChannelConfig channelConfig = Defaults.defaultChannelConfig();
        private CodecConfig codecConfig = Defaults.defaultCodecConfig();
        private ClientConfig clientConfig = Defaults.defaultClientConfig();
        private RouterConfig routerConfig = Defaults.defaultRouterConfig();
        private QueueConfig queueConfig = Defaults.defaultQueueConfig();
        private AgentConfig agentConfig = Defaults.defaultAgentConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();

        public Builder channelConfig(ChannelConfig channelConfig) {
            this.channelConfig = channelConfig;
            return this;
        }

        public Builder codecConfig(CodecConfig codecConfig) {
            this.codecConfig = codecConfig;
            return this;
        }

        public Builder clientConfig(ClientConfig clientConfig) {
            this.clientConfig = clientConfig;
            return this;
        }

        public Builder routerConfig(RouterConfig routerConfig) {
            this.routerConfig = routerConfig;
            return this;
        }

        public Builder queueConfig(QueueConfig queueConfig) {
            this.queueConfig = queueConfig;
            return this;
        }

        public Builder agentConfig(AgentConfig agentConfig) {
            this.agentConfig = agentConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(channelConfig, codecConfig, clientConfig, routerConfig,
                                     queueConfig, agentConfig, monitoringConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Overlay deployment properties on the defaults. Keys are prefixed with
     * {@code gateway.}; durations are given in milliseconds. Routes are
     * declared as {@code gateway.route.<domain>=<DomainKind>}.
     */
    public static GatewayConfig fromProperties(Properties props) {
        ChannelConfig c = Defaults.defaultChannelConfig();
        long keepAliveMs = longProp(props, "channel.keepAliveIntervalMs",
            c.getKeepAliveInterval() != null ? c.getKeepAliveInterval().toMillis() : 0);
        ChannelConfig channel = new ChannelConfig(
            props.getProperty(PREFIX + "channel.target", c.getTarget()),
            boolProp(props, "channel.plaintext", c.isPlaintext()),
            (int) longProp(props, "channel.poolSlots", c.getPoolSlots()),
            boolProp(props, "channel.eagerConnect", c.isEagerConnect()),
            keepAliveMs > 0 ? Duration.ofMillis(keepAliveMs) : null,
            durationProp(props, "channel.keepAliveTimeoutMs", c.getKeepAliveTimeout()),
            boolProp(props, "channel.keepAliveWhileIdle", c.isKeepAliveWhileIdle()),
            durationProp(props, "channel.connectTimeoutMs", c.getConnectTimeout()),
            (int) longProp(props, "channel.initialWindowSize", c.getInitialWindowSize()),
            boolProp(props, "channel.adaptiveWindow", c.isAdaptiveWindow()),
            boolProp(props, "channel.lowLatency", c.isLowLatency()),
            (int) longProp(props, "channel.maxInboundMessageSize", c.getMaxInboundMessageSize()),
            (int) longProp(props, "channel.maxConsecutiveTimeouts", c.getMaxConsecutiveTimeouts()));

        CodecConfig k = Defaults.defaultCodecConfig();
        CodecConfig codec = new CodecConfig(
            (int) longProp(props, "codec.maxEncodingMessageSize", k.getMaxEncodingMessageSize()),
            (int) longProp(props, "codec.maxDecodingMessageSize", k.getMaxDecodingMessageSize()));

        ClientConfig cl = Defaults.defaultClientConfig();
        ClientConfig client = new ClientConfig(
            durationProp(props, "client.defaultDeadlineMs", cl.getDefaultDeadline()),
            boolProp(props, "client.compressSingleRecordCalls", cl.isCompressSingleRecordCalls()),
            boolProp(props, "client.compressListCalls", cl.isCompressListCalls()));

        RouterConfig r = Defaults.defaultRouterConfig();
        Map<String, DomainKind> routes = new LinkedHashMap<>(r.getRoutes());
        String routePrefix = PREFIX + "route.";
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(routePrefix)) {
                String domain = name.substring(routePrefix.length());
                String kind = props.getProperty(name).trim();
                if (kind.isEmpty() || kind.equalsIgnoreCase("none")) {
                    routes.remove(domain);
                } else {
                    routes.put(domain, DomainKind.valueOf(kind.toUpperCase(Locale.ROOT)));
                }
            }
        }
        RouterConfig router = new RouterConfig(routes,
            boolProp(props, "router.publishTaskEvents", r.isPublishTaskEvents()),
            props.getProperty(PREFIX + "router.taskEventSubject", r.getTaskEventSubject()));

        QueueConfig q = Defaults.defaultQueueConfig();
        QueueConfig queue = new QueueConfig(
            props.getProperty(PREFIX + "queue.dbPath", q.getDbPath()),
            durationProp(props, "queue.publishTimeoutMs", q.getPublishTimeout()));

        AgentConfig a = Defaults.defaultAgentConfig();
        AgentConfig agent = new AgentConfig(
            props.getProperty(PREFIX + "agent.baseUri", a.getBaseUri()),
            durationProp(props, "agent.connectTimeoutMs", a.getConnectTimeout()),
            durationProp(props, "agent.invokeTimeoutMs", a.getInvokeTimeout()));

        MonitoringConfig m = Defaults.defaultMonitoringConfig();
        MonitoringConfig monitoring = new MonitoringConfig(
            boolProp(props, "monitoring.enableMetrics", m.isEnableMetrics()),
            boolProp(props, "monitoring.enableHealthChecks", m.isEnableHealthChecks()),
            durationProp(props, "monitoring.healthCheckIntervalMs", m.getHealthCheckInterval()),
            Double.parseDouble(props.getProperty(PREFIX + "monitoring.maxErrorRatePercent",
                String.valueOf(m.getMaxErrorRatePercent()))));

        return new GatewayConfig(channel, codec, client, router, queue, agent, monitoring);
    }

    private static long longProp(Properties props, String key, long fallback) {
        String value = props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + PREFIX + key + " is not a number: " + value, e);
        }
    }

    private static boolean boolProp(Properties props, String key, boolean fallback) {
        String value = props.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static Duration durationProp(Properties props, String key, Duration fallback) {
        String value = props.getProperty(PREFIX + key);
        return value == null || value.isBlank() ? fallback : Duration.ofMillis(longProp(props, key, 0));
    }

    /**
     * Default configurations. Channel values follow the benchmarked production
     * settings of the tasks service (30s keep-alive, 1 MiB windows, adaptive
     * window, TCP_NODELAY, 8 MiB message caps).
     */
    public static class Defaults {
        public static ChannelConfig defaultChannelConfig() {
            return new ChannelConfig(
                "localhost:50051", true, 1, false,
                Duration.ofSeconds(30), Duration.ofSeconds(10), true,
                Duration.ofSeconds(5), 1024 * 1024, true, true,
                TaskWireCodec.DEFAULT_MAX_MESSAGE_SIZE, 3
            );
        }

        public static CodecConfig defaultCodecConfig() {
            return new CodecConfig(TaskWireCodec.DEFAULT_MAX_MESSAGE_SIZE, TaskWireCodec.DEFAULT_MAX_MESSAGE_SIZE);
        }

        public static ClientConfig defaultClientConfig() {
            return new ClientConfig(Duration.ofSeconds(30), false, true);
        }

        public static RouterConfig defaultRouterConfig() {
            Map<String, DomainKind> routes = new LinkedHashMap<>();
            routes.put("tasks", DomainKind.DOMAIN_SERVICE);
            routes.put("vectors", DomainKind.DOMAIN_SERVICE);
            routes.put("projects", DomainKind.OWNED_TABLE);
            routes.put("users", DomainKind.OWNED_TABLE);
            routes.put("notifications", DomainKind.SIDE_EFFECT);
            routes.put("emails", DomainKind.SIDE_EFFECT);
            routes.put("task-events", DomainKind.SIDE_EFFECT);
            routes.put("agents", DomainKind.REASONING);
            return new RouterConfig(routes, true, "task-events");
        }

        public static QueueConfig defaultQueueConfig() {
            return new QueueConfig(null, Duration.ofSeconds(5));
        }

        public static AgentConfig defaultAgentConfig() {
            return new AgentConfig(null, Duration.ofSeconds(5), Duration.ofSeconds(120));
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true, Duration.ofMinutes(1), 20.0);
        }
    }
}
