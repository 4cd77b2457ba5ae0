package com.enterprise.taskgateway.config;

import com.enterprise.taskgateway.router.DomainKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    @Test
    void testDefaults() {
        GatewayConfig config = GatewayConfig.builder().build();

        assertEquals("localhost:50051", config.getChannelConfig().getTarget());
        assertEquals(1, config.getChannelConfig().getPoolSlots());
        assertEquals(Duration.ofSeconds(30), config.getChannelConfig().getKeepAliveInterval());
        assertEquals(1024 * 1024, config.getChannelConfig().getInitialWindowSize());
        assertTrue(config.getChannelConfig().isAdaptiveWindow());
        assertTrue(config.getChannelConfig().isLowLatency());
        assertEquals(Duration.ofSeconds(30), config.getClientConfig().getDefaultDeadline());
        assertFalse(config.getClientConfig().isCompressSingleRecordCalls());
        assertTrue(config.getClientConfig().isCompressListCalls());
        assertEquals(DomainKind.DOMAIN_SERVICE, config.getRouterConfig().getRoutes().get("tasks"));
        assertEquals(DomainKind.REASONING, config.getRouterConfig().getRoutes().get("agents"));
        assertNull(config.getQueueConfig().getDbPath());
        assertNull(config.getAgentConfig().getBaseUri());
    }

    @Test
    void testPropertiesOverlayDefaults() {
        Properties props = new Properties();
        props.setProperty("gateway.channel.target", "tasks.internal:443");
        props.setProperty("gateway.channel.plaintext", "false");
        props.setProperty("gateway.channel.poolSlots", "4");
        props.setProperty("gateway.client.defaultDeadlineMs", "1500");
        props.setProperty("gateway.route.invoices", "owned_table");
        props.setProperty("gateway.route.vectors", "none");
        props.setProperty("gateway.agent.baseUri", "http://agents:8080");
        props.setProperty("gateway.monitoring.maxErrorRatePercent", "5.5");

        GatewayConfig config = GatewayConfig.fromProperties(props);

        assertEquals("tasks.internal:443", config.getChannelConfig().getTarget());
        assertFalse(config.getChannelConfig().isPlaintext());
        assertEquals(4, config.getChannelConfig().getPoolSlots());
        assertEquals(Duration.ofMillis(1500), config.getClientConfig().getDefaultDeadline());
        assertEquals(DomainKind.OWNED_TABLE, config.getRouterConfig().getRoutes().get("invoices"));
        assertFalse(config.getRouterConfig().getRoutes().containsKey("vectors"));
        assertEquals(DomainKind.DOMAIN_SERVICE, config.getRouterConfig().getRoutes().get("tasks"));
        assertEquals("http://agents:8080", config.getAgentConfig().getBaseUri());
        assertEquals(5.5, config.getMonitoringConfig().getMaxErrorRatePercent());
    }

    @Test
    void testKeepAliveCanBeDisabled() {
        Properties props = new Properties();
        props.setProperty("gateway.channel.keepAliveIntervalMs", "0");

        assertNull(GatewayConfig.fromProperties(props).getChannelConfig().getKeepAliveInterval());
    }

    @Test
    void testNonNumericPropertyIsRejected() {
        Properties props = new Properties();
        props.setProperty("gateway.channel.poolSlots", "many");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> GatewayConfig.fromProperties(props));
        assertTrue(e.getMessage().contains("gateway.channel.poolSlots"));
    }

    @Test
    void testUnknownDomainKindIsRejected() {
        Properties props = new Properties();
        props.setProperty("gateway.route.invoices", "LEDGER");

        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.fromProperties(props));
    }
}
