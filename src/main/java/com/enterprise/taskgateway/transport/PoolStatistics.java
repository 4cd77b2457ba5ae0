package com.enterprise.taskgateway.transport;

/**
 * Point-in-time view of the connection pool
 */
public interface PoolStatistics {

    /**
     * Number of slots configured
     */
    int getSlots();

    /**
     * Handles currently installed in a slot
     */
    int getLiveHandles();

    /**
     * Handles created since the pool started
     */
    long getHandlesCreated();

    /**
     * Handles retired after a fault or on close
     */
    long getHandlesRetired();

    /**
     * Leases not yet released, across all handles
     */
    int getInFlightLeases();
}
