package com.enterprise.taskgateway.transport;

import com.enterprise.taskgateway.config.GatewayConfig;
import com.enterprise.taskgateway.exception.UnavailableException;
import io.grpc.ConnectivityState;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Pool of shared transport handles to the tasks service.
 *
 * <p>Handles are multiplexed: {@link #acquire()} hands out a lease on a shared
 * handle and never waits for other callers. Slots are filled lazily, or up
 * front by {@link #warmUp()}, and replaced with compare-and-set after a fatal
 * fault. The pool never retries a call.
 */
public class ConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final GatewayConfig.ChannelConfig config;
    private final ChannelFactory channelFactory;
    private final AtomicReferenceArray<PooledHandle> slots;
    private final AtomicInteger nextSlot = new AtomicInteger();
    private final AtomicLong handleIds = new AtomicLong();
    private final AtomicLong handlesCreated = new AtomicLong();
    private final AtomicLong handlesRetired = new AtomicLong();
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean closed;

    public ConnectionPool(GatewayConfig.ChannelConfig config) {
        this(config, new NettyChannelFactory());
    }

    public ConnectionPool(GatewayConfig.ChannelConfig config, ChannelFactory channelFactory) {
        if (config.getPoolSlots() <= 0) {
            throw new IllegalArgumentException("Pool slots must be greater than 0");
        }
        this.config = config;
        this.channelFactory = channelFactory;
        this.slots = new AtomicReferenceArray<>(config.getPoolSlots());

        logger.info("ConnectionPool initialized for {} with {} slot(s), eagerConnect={}",
                   config.getTarget(), config.getPoolSlots(), config.isEagerConnect());
    }

    /**
     * Lease a shared handle, creating the slot's channel if it is empty or retired
     */
    public HandleLease acquire() throws UnavailableException {
        if (closed) {
            throw new UnavailableException("Connection pool for " + config.getTarget() + " is closed");
        }

        int slot = Math.floorMod(nextSlot.getAndIncrement(), slots.length());
        PooledHandle handle = slots.get(slot);
        while (handle == null || handle.isRetired()) {
            handle = installHandle(slot, handle);
        }

        handle.beginCall();
        inFlight.incrementAndGet();
        return new HandleLease(this, handle);
    }

    /**
     * Connect every slot now instead of on first use
     */
    public void warmUp() throws UnavailableException {
        for (int slot = 0; slot < slots.length(); slot++) {
            PooledHandle handle = slots.get(slot);
            while (handle == null || handle.isRetired()) {
                handle = installHandle(slot, handle);
            }
            handle.getChannel().getState(true);
        }
        logger.info("Warmed up {} handle(s) to {}", slots.length(), config.getTarget());
    }

    /**
     * Report how a call on the handle ended. OK resets the timeout counter;
     * UNAVAILABLE carrying a transport cause retires the handle at once;
     * DEADLINE_EXCEEDED retires it after the configured number in a row.
     */
    public void reportFault(PooledHandle handle, Status status) {
        switch (status.getCode()) {
            case OK:
                handle.resetTimeouts();
                break;
            case UNAVAILABLE:
                if (status.getCause() != null) {
                    retire(handle, "transport fault: " + status.getCause());
                }
                break;
            case DEADLINE_EXCEEDED:
                int timeouts = handle.recordTimeout();
                if (timeouts >= config.getMaxConsecutiveTimeouts()) {
                    retire(handle, timeouts + " consecutive deadline expirations");
                } else {
                    logger.debug("Handle {} timed out ({} of {})", handle.getId(), timeouts,
                                config.getMaxConsecutiveTimeouts());
                }
                break;
            default:
                break;
        }
    }

    /**
     * Report a successful call on the handle
     */
    public void reportSuccess(PooledHandle handle) {
        handle.resetTimeouts();
    }

    public PoolStatistics statistics() {
        int live = 0;
        for (int slot = 0; slot < slots.length(); slot++) {
            PooledHandle handle = slots.get(slot);
            if (handle != null && !handle.isRetired()) {
                live++;
            }
        }
        return new Snapshot(slots.length(), live, handlesCreated.get(), handlesRetired.get(), inFlight.get());
    }

    /**
     * False once closed or while a live handle is in transient failure
     */
    public boolean isHealthy() {
        if (closed) {
            return false;
        }
        for (int slot = 0; slot < slots.length(); slot++) {
            PooledHandle handle = slots.get(slot);
            if (handle != null && !handle.isRetired()
                && handle.getChannel().getState(false) == ConnectivityState.TRANSIENT_FAILURE) {
                return false;
            }
        }
        return true;
    }

    public String getTarget() {
        return config.getTarget();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing connection pool for {}", config.getTarget());

        for (int slot = 0; slot < slots.length(); slot++) {
            PooledHandle handle = slots.getAndSet(slot, null);
            if (handle != null && handle.markRetired()) {
                handlesRetired.incrementAndGet();
                ManagedChannel channel = handle.getChannel();
                channel.shutdown();
                try {
                    if (!channel.awaitTermination(5, TimeUnit.SECONDS)) {
                        channel.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    channel.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    void release(PooledHandle handle) {
        handle.endCall();
        inFlight.decrementAndGet();
    }

    private PooledHandle installHandle(int slot, PooledHandle expected) throws UnavailableException {
        ManagedChannel channel;
        try {
            channel = channelFactory.create(config);
        } catch (RuntimeException e) {
            throw new UnavailableException("Failed to create channel to " + config.getTarget(), e);
        }

        PooledHandle fresh = new PooledHandle(handleIds.incrementAndGet(), slot, channel);
        if (slots.compareAndSet(slot, expected, fresh)) {
            handlesCreated.incrementAndGet();
            if (config.isEagerConnect()) {
                channel.getState(true);
            }
            logger.info("Created handle {} in slot {} for {}", fresh.getId(), slot, config.getTarget());
            if (closed) {
                retire(fresh, "pool closed");
                throw new UnavailableException("Connection pool for " + config.getTarget() + " is closed");
            }
            return fresh;
        }

        // Another caller filled the slot first
        channel.shutdownNow();
        return slots.get(slot);
    }

    private void retire(PooledHandle handle, String reason) {
        if (!handle.markRetired()) {
            return;
        }
        handlesRetired.incrementAndGet();
        slots.compareAndSet(handle.getSlot(), handle, null);
        logger.warn("Retiring handle {} in slot {} ({}); {} call(s) in flight will fail",
                   handle.getId(), handle.getSlot(), reason, handle.getInFlight());
        handle.getChannel().shutdownNow();
    }

    private static class Snapshot implements PoolStatistics {
        private final int slots;
        private final int liveHandles;
        private final long handlesCreated;
        private final long handlesRetired;
        private final int inFlightLeases;

        Snapshot(int slots, int liveHandles, long handlesCreated, long handlesRetired, int inFlightLeases) {
            this.slots = slots;
            this.liveHandles = liveHandles;
            this.handlesCreated = handlesCreated;
            this.handlesRetired = handlesRetired;
            this.inFlightLeases = inFlightLeases;
        }

        @Override public int getSlots() { return slots; }
        @Override public int getLiveHandles() { return liveHandles; }
        @Override public long getHandlesCreated() { return handlesCreated; }
        @Override public long getHandlesRetired() { return handlesRetired; }
        @Override public int getInFlightLeases() { return inFlightLeases; }

        @Override
        public String toString() {
            return "PoolStatistics{slots=" + slots + ", live=" + liveHandles + ", created=" + handlesCreated
                + ", retired=" + handlesRetired + ", inFlight=" + inFlightLeases + "}";
        }
    }
}
