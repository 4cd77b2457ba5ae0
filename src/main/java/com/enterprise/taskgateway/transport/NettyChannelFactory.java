package com.enterprise.taskgateway.transport;

import com.enterprise.taskgateway.config.GatewayConfig;
import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.shaded.io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP/2 channels on the Netty transport with the configured tunables
 */
public class NettyChannelFactory implements ChannelFactory {

    private static final Logger logger = LoggerFactory.getLogger(NettyChannelFactory.class);

    @Override
    public ManagedChannel create(GatewayConfig.ChannelConfig config) {
        NettyChannelBuilder builder = NettyChannelBuilder.forTarget(config.getTarget())
            .maxInboundMessageSize(config.getMaxInboundMessageSize())
            .withOption(ChannelOption.TCP_NODELAY, config.isLowLatency())
            .withOption(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis());

        if (config.getKeepAliveInterval() != null) {
            builder.keepAliveTime(config.getKeepAliveInterval().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveTimeout(config.getKeepAliveTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .keepAliveWithoutCalls(config.isKeepAliveWhileIdle());
        }

        // Adaptive sizing starts from the initial window and grows with measured bandwidth
        if (config.isAdaptiveWindow()) {
            builder.initialFlowControlWindow(config.getInitialWindowSize());
        } else {
            builder.flowControlWindow(config.getInitialWindowSize());
        }

        if (config.isPlaintext()) {
            builder.usePlaintext();
        } else {
            builder.useTransportSecurity();
        }

        logger.debug("Building channel to {} (plaintext={}, window={}, adaptive={})",
                    config.getTarget(), config.isPlaintext(), config.getInitialWindowSize(),
                    config.isAdaptiveWindow());
        return builder.build();
    }
}
