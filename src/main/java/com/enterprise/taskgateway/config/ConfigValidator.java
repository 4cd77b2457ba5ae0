package com.enterprise.taskgateway.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates gateway configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(GatewayConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateChannelConfig(config.getChannelConfig(), errors);
        validateCodecConfig(config.getCodecConfig(), errors);
        validateClientConfig(config.getClientConfig(), errors);
        validateRouterConfig(config.getRouterConfig(), errors);
        validateQueueConfig(config.getQueueConfig(), errors);
        validateAgentConfig(config.getAgentConfig(), errors);
        validateMonitoringConfig(config.getMonitoringConfig(), errors);

        return errors;
    }

    private void validateChannelConfig(GatewayConfig.ChannelConfig config, List<ValidationError> errors) {
        if (config.getTarget() == null || config.getTarget().trim().isEmpty()) {
            errors.add(new ValidationError("channel.target", "Target address is required"));
        }

        if (config.getPoolSlots() <= 0) {
            errors.add(new ValidationError("channel.poolSlots", "Pool slots must be greater than 0"));
        }

        if (config.getKeepAliveInterval() != null && !isPositive(config.getKeepAliveInterval())) {
            errors.add(new ValidationError("channel.keepAliveInterval",
                "Keep-alive interval must be positive when set"));
        }

        if (!isPositive(config.getKeepAliveTimeout())) {
            errors.add(new ValidationError("channel.keepAliveTimeout", "Keep-alive timeout must be positive"));
        }

        if (!isPositive(config.getConnectTimeout())) {
            errors.add(new ValidationError("channel.connectTimeout", "Connect timeout must be positive"));
        }

        if (config.getInitialWindowSize() <= 0) {
            errors.add(new ValidationError("channel.initialWindowSize",
                "Initial window size must be greater than 0"));
        }

        if (config.getMaxInboundMessageSize() <= 0) {
            errors.add(new ValidationError("channel.maxInboundMessageSize",
                "Maximum inbound message size must be greater than 0"));
        }

        if (config.getMaxConsecutiveTimeouts() <= 0) {
            errors.add(new ValidationError("channel.maxConsecutiveTimeouts",
                "Maximum consecutive timeouts must be greater than 0"));
        }
    }

    private void validateCodecConfig(GatewayConfig.CodecConfig config, List<ValidationError> errors) {
        if (config.getMaxEncodingMessageSize() <= 0) {
            errors.add(new ValidationError("codec.maxEncodingMessageSize",
                "Maximum encoding size must be greater than 0"));
        }

        if (config.getMaxDecodingMessageSize() <= 0) {
            errors.add(new ValidationError("codec.maxDecodingMessageSize",
                "Maximum decoding size must be greater than 0"));
        }
    }

    private void validateClientConfig(GatewayConfig.ClientConfig config, List<ValidationError> errors) {
        if (!isPositive(config.getDefaultDeadline())) {
            errors.add(new ValidationError("client.defaultDeadline", "Default deadline must be positive"));
        }
    }

    private void validateRouterConfig(GatewayConfig.RouterConfig config, List<ValidationError> errors) {
        for (String domain : config.getRoutes().keySet()) {
            if (domain == null || domain.trim().isEmpty()) {
                errors.add(new ValidationError("router.routes", "Route domain names cannot be blank"));
            } else if (config.getRoutes().get(domain) == null) {
                errors.add(new ValidationError("router.routes." + domain, "Route has no domain kind"));
            }
        }

        if (config.isPublishTaskEvents()
            && (config.getTaskEventSubject() == null || config.getTaskEventSubject().trim().isEmpty())) {
            errors.add(new ValidationError("router.taskEventSubject",
                "Task event subject is required when task events are published"));
        }
    }

    private void validateQueueConfig(GatewayConfig.QueueConfig config, List<ValidationError> errors) {
        if (config.getDbPath() != null && config.getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("queue.dbPath", "Database path cannot be blank"));
        }

        if (!isPositive(config.getPublishTimeout())) {
            errors.add(new ValidationError("queue.publishTimeout", "Publish timeout must be positive"));
        }
    }

    private void validateAgentConfig(GatewayConfig.AgentConfig config, List<ValidationError> errors) {
        if (config.getBaseUri() != null
            && !(config.getBaseUri().startsWith("http://") || config.getBaseUri().startsWith("https://"))) {
            errors.add(new ValidationError("agent.baseUri", "Agent base URI must be an http or https URI"));
        }

        if (!isPositive(config.getConnectTimeout())) {
            errors.add(new ValidationError("agent.connectTimeout", "Connect timeout must be positive"));
        }

        if (!isPositive(config.getInvokeTimeout())) {
            errors.add(new ValidationError("agent.invokeTimeout", "Invoke timeout must be positive"));
        }
    }

    private void validateMonitoringConfig(GatewayConfig.MonitoringConfig config, List<ValidationError> errors) {
        if (config.getHealthCheckInterval() == null || config.getHealthCheckInterval().isNegative()) {
            errors.add(new ValidationError("monitoring.healthCheckInterval",
                "Health check interval cannot be negative"));
        }

        if (config.getMaxErrorRatePercent() < 0 || config.getMaxErrorRatePercent() > 100) {
            errors.add(new ValidationError("monitoring.maxErrorRatePercent",
                "Maximum error rate must be between 0 and 100"));
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
