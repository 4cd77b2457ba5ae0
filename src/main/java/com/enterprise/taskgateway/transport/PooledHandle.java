package com.enterprise.taskgateway.transport;

import io.grpc.ManagedChannel;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One shared transport handle. Any number of calls may run on it at once.
 */
public class PooledHandle {

    private final long id;
    private final int slot;
    private final ManagedChannel channel;
    private final Instant createdAt;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger consecutiveTimeouts = new AtomicInteger();
    private final AtomicBoolean retired = new AtomicBoolean();

    PooledHandle(long id, int slot, ManagedChannel channel) {
        this.id = id;
        this.slot = slot;
        this.channel = channel;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public int getSlot() { return slot; }
    public ManagedChannel getChannel() { return channel; }
    public Instant getCreatedAt() { return createdAt; }
    public int getInFlight() { return inFlight.get(); }
    public int getConsecutiveTimeouts() { return consecutiveTimeouts.get(); }
    public boolean isRetired() { return retired.get(); }

    void beginCall() {
        inFlight.incrementAndGet();
    }

    void endCall() {
        inFlight.decrementAndGet();
    }

    int recordTimeout() {
        return consecutiveTimeouts.incrementAndGet();
    }

    void resetTimeouts() {
        consecutiveTimeouts.set(0);
    }

    /**
     * Mark retired. Returns true only for the caller that performed the transition.
     */
    boolean markRetired() {
        return retired.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "PooledHandle{id=" + id + ", slot=" + slot + ", inFlight=" + inFlight.get()
            + ", retired=" + retired.get() + "}";
    }
}
