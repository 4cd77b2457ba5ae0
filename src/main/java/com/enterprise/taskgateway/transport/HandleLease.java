package com.enterprise.taskgateway.transport;

import io.grpc.ManagedChannel;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Counts one call's use of a shared handle. Closing is idempotent.
 */
public class HandleLease implements AutoCloseable {

    private final ConnectionPool pool;
    private final PooledHandle handle;
    private final AtomicBoolean released = new AtomicBoolean();

    HandleLease(ConnectionPool pool, PooledHandle handle) {
        this.pool = pool;
        this.handle = handle;
    }

    public PooledHandle handle() {
        return handle;
    }

    public ManagedChannel channel() {
        return handle.getChannel();
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(handle);
        }
    }
}
