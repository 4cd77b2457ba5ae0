package com.enterprise.taskgateway.monitoring;

import com.enterprise.taskgateway.transport.ConnectionPool;
import com.enterprise.taskgateway.transport.PoolStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the gateway
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private final ConnectionPool pool;
    private final GatewayMetrics metrics;
    private final double maxErrorRatePercent;

    public HealthChecker(ConnectionPool pool, GatewayMetrics metrics, double maxErrorRatePercent) {
        this.pool = pool;
        this.metrics = metrics;
        this.maxErrorRatePercent = maxErrorRatePercent;
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            HealthStatus.Builder builder = HealthStatus.builder();

            checkConnectionPool(builder);
            checkErrorRate(builder);
            checkSystemResources(builder);

            HealthStatus status = builder.build();
            if (!status.isHealthy()) {
                logger.warn("Gateway health check failed: {}", status.getFailedChecks().keySet());
            }
            return status;
        });
    }

    private void checkConnectionPool(HealthStatus.Builder builder) {
        try {
            builder.addCheck("pool.open", !pool.isClosed(),
                pool.isClosed() ? "Connection pool is closed" : "Connection pool is open");

            boolean healthy = pool.isHealthy();
            PoolStatistics stats = pool.statistics();
            builder.addCheck("pool.connectivity", healthy,
                String.format("%d/%d live handle(s) to %s, %d in flight, %d retired",
                    stats.getLiveHandles(), stats.getSlots(), pool.getTarget(),
                    stats.getInFlightLeases(), stats.getHandlesRetired()));

        } catch (Exception e) {
            builder.addCheck("pool.status", false, "Error checking connection pool: " + e.getMessage());
        }
    }

    private void checkErrorRate(HealthStatus.Builder builder) {
        long received = metrics.getRequestsReceived();
        if (received > 0) {
            double errorRate = (double) metrics.getRequestsFailed() / received * 100;
            boolean healthy = errorRate <= maxErrorRatePercent;
            builder.addCheck("requests.error_rate", healthy,
                String.format("Request error rate: %.2f%% (%d/%d)", errorRate, metrics.getRequestsFailed(), received));
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long totalMemory = runtime.totalMemory();
        long usedMemory = totalMemory - runtime.freeMemory();
        double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

        boolean memoryHealthy = memoryUsagePercent < 90;
        builder.addCheck("system.memory", memoryHealthy,
            String.format("Memory usage: %.2f%% (%d/%d MB)",
                memoryUsagePercent, usedMemory / 1024 / 1024, runtime.maxMemory() / 1024 / 1024));
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public Map<String, CheckResult> getFailedChecks() {
            Map<String, CheckResult> failed = new ConcurrentHashMap<>();
            checks.forEach((name, result) -> {
                if (!result.isPassed()) {
                    failed.put(name, result);
                }
            });
            return failed;
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
