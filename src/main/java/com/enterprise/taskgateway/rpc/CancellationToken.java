package com.enterprise.taskgateway.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-held signal that an operation should stop. Listeners registered after
 * cancellation run immediately. A token may be shared by many calls; each call
 * removes its listener once it finishes.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            // Whoever removes a registration runs it, so a concurrent onCancel cannot lose one
            for (Registration registration : registrations) {
                if (registrations.remove(registration)) {
                    runQuietly(registration.listener);
                }
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Registration onCancel(Runnable listener) {
        Registration registration = new Registration(listener);
        registrations.add(registration);
        if (cancelled.get() && registrations.remove(registration)) {
            runQuietly(listener);
        }
        return registration;
    }

    /**
     * Number of listeners still waiting for cancellation
     */
    public int getListenerCount() {
        return registrations.size();
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation listener failed", e);
        }
    }

    /**
     * A registered listener. Removing it is idempotent.
     */
    public final class Registration {
        private final Runnable listener;

        private Registration(Runnable listener) {
            this.listener = listener;
        }

        public void remove() {
            registrations.remove(this);
        }
    }
}
