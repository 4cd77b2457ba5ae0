package com.enterprise.taskgateway.transport;

import com.enterprise.taskgateway.config.GatewayConfig;
import io.grpc.ManagedChannel;

/**
 * Creates the channel behind one pool slot
 */
@FunctionalInterface
public interface ChannelFactory {

    /**
     * Build a new channel for the configured target. Must not block on connecting.
     */
    ManagedChannel create(GatewayConfig.ChannelConfig config);
}
