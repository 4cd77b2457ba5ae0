package com.enterprise.taskgateway.config;

import com.enterprise.taskgateway.router.DomainKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator();
    }

    private List<String> invalidFields(GatewayConfig config) {
        return validator.validate(config).stream()
            .map(ConfigValidator.ValidationError::getField)
            .collect(Collectors.toList());
    }

    @Test
    void testDefaultsAreValid() {
        assertTrue(validator.validate(GatewayConfig.builder().build()).isEmpty());
    }

    @Test
    void testChannelErrorsAreCollected() {
        GatewayConfig config = GatewayConfig.builder()
            .channelConfig(new GatewayConfig.ChannelConfig("", true, 0, false,
                null, Duration.ofSeconds(10), false, Duration.ZERO,
                1024 * 1024, true, true, 8 * 1024 * 1024, 0))
            .build();

        List<String> fields = invalidFields(config);

        assertTrue(fields.contains("channel.target"));
        assertTrue(fields.contains("channel.poolSlots"));
        assertTrue(fields.contains("channel.connectTimeout"));
        assertTrue(fields.contains("channel.maxConsecutiveTimeouts"));
        assertFalse(fields.contains("channel.keepAliveInterval"));
    }

    @Test
    void testNonPositiveDeadlineIsInvalid() {
        GatewayConfig config = GatewayConfig.builder()
            .clientConfig(new GatewayConfig.ClientConfig(Duration.ofMillis(-1), false, true))
            .build();

        assertEquals(List.of("client.defaultDeadline"), invalidFields(config));
    }

    @Test
    void testAgentUriMustBeHttp() {
        GatewayConfig config = GatewayConfig.builder()
            .agentConfig(new GatewayConfig.AgentConfig("ftp://agents", Duration.ofSeconds(1), Duration.ofSeconds(1)))
            .build();

        assertEquals(List.of("agent.baseUri"), invalidFields(config));
    }

    @Test
    void testRouteWithoutKindIsInvalid() {
        Map<String, DomainKind> routes = new LinkedHashMap<>();
        routes.put("tasks", DomainKind.DOMAIN_SERVICE);
        routes.put("ghost", null);
        GatewayConfig config = GatewayConfig.builder()
            .routerConfig(new GatewayConfig.RouterConfig(routes, false, "task-events"))
            .build();

        assertEquals(List.of("router.routes.ghost"), invalidFields(config));
    }

    @Test
    void testErrorRendersFieldAndMessage() {
        ConfigValidator.ValidationError error = new ConfigValidator.ValidationError("queue.dbPath", "blank");

        assertEquals("queue.dbPath: blank", error.toString());
    }
}
