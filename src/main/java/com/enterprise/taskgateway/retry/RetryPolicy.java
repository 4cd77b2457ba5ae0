package com.enterprise.taskgateway.retry;

import com.enterprise.taskgateway.exception.GatewayException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Caller-side retry policy for gateway operations. The gateway core never
 * retries on its own.
 */
public interface RetryPolicy {

    /**
     * Determine if a failed attempt should be retried
     *
     * @param attempt number of attempts already made, starting at 1
     */
    boolean shouldRetry(Throwable failure, int attempt);

    /**
     * Calculate the delay before the next attempt
     */
    Duration getRetryDelay(int attempt);

    /**
     * Get the maximum number of retries after the first attempt
     */
    int getMaxRetries();

    /**
     * Exponential backoff with jitter
     */
    class DefaultRetryPolicy implements RetryPolicy {
        private final int maxRetries;
        private final Duration baseDelay;
        private final double backoffMultiplier;
        private final Duration maxDelay;
        private final double jitterFactor;
        private final Predicate<Throwable> retryable;

        public DefaultRetryPolicy(int maxRetries, Duration baseDelay, double backoffMultiplier,
                                  Duration maxDelay, double jitterFactor, Predicate<Throwable> retryable) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.backoffMultiplier = backoffMultiplier;
            this.maxDelay = maxDelay;
            this.jitterFactor = jitterFactor;
            this.retryable = retryable;
        }

        @Override
        public boolean shouldRetry(Throwable failure, int attempt) {
            return attempt <= maxRetries && failure != null && retryable.test(failure);
        }

        @Override
        public Duration getRetryDelay(int attempt) {
            long delayMs = (long) (baseDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1)));
            long actualDelay = Math.min(delayMs, maxDelay.toMillis());

            // Spread retries from many callers
            if (jitterFactor > 0 && actualDelay > 0) {
                actualDelay += (long) (actualDelay * jitterFactor * ThreadLocalRandom.current().nextDouble());
            }
            return Duration.ofMillis(actualDelay);
        }

        @Override
        public int getMaxRetries() {
            return maxRetries;
        }
    }

    /**
     * Builder for creating retry policies
     */
    class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(100);
        private double backoffMultiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(5);
        private double jitterFactor = 0.1;
        private Predicate<Throwable> retryable = RetryPolicy::isRetryableGatewayFailure;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryable(Predicate<Throwable> retryable) {
            this.retryable = retryable;
            return this;
        }

        public RetryPolicy build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Maximum retries cannot be negative");
            }
            if (backoffMultiplier <= 0) {
                throw new IllegalArgumentException("Backoff multiplier must be greater than 0");
            }
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot be greater than maximum delay");
            }
            return new DefaultRetryPolicy(maxRetries, baseDelay, backoffMultiplier, maxDelay, jitterFactor, retryable);
        }
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * True for gateway failures whose kind is retryable
     */
    static boolean isRetryableGatewayFailure(Throwable failure) {
        return failure instanceof GatewayException && ((GatewayException) failure).isRetryable();
    }

    /**
     * Predefined retry policies
     */
    class Predefined {

        /**
         * No retry policy
         */
        public static RetryPolicy noRetry() {
            return builder().maxRetries(0).build();
        }

        /**
         * Three quick retries for transient transport failures
         */
        public static RetryPolicy transientFailures() {
            return builder().build();
        }

        /**
         * Longer backoff for a backend that is restarting
         */
        public static RetryPolicy patient() {
            return builder()
                .maxRetries(6)
                .baseDelay(Duration.ofMillis(500))
                .backoffMultiplier(2.0)
                .maxDelay(Duration.ofSeconds(30))
                .build();
        }
    }
}
