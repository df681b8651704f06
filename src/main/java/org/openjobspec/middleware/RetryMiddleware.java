package org.openjobspec.middleware;

import java.time.Duration;

import static java.lang.System.Logger.Level;

/**
 * Retry middleware with configurable exponential backoff.
 *
 * <p>Catches exceptions from downstream handlers and retries with increasing
 * delays. If all retries are exhausted, or the context is cancelled, the last
 * exception is rethrown.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Default: 3 retries with 100ms base delay
 * stack.finalizeStep().add(RetryMiddleware.create("retry"), RelativePosition.BEFORE);
 *
 * // Custom configuration
 * stack.finalizeStep().add(RetryMiddleware.builder()
 *     .maxRetries(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(60))
 *     .jitter(true)
 *     .build("retry"), RelativePosition.BEFORE);
 * }</pre>
 *
 * <p>Downstream middleware run again on every attempt, so retry middleware belongs in the
 * finalize step, ahead of signing.
 */
public final class RetryMiddleware {

    private static final System.Logger logger = System.getLogger(RetryMiddleware.class.getName());

    private RetryMiddleware() {
    }

    /**
     * Create a retry middleware with default settings (3 retries, 100ms base delay).
     *
     * @param id the middleware id
     * @return the middleware
     */
    public static <I, O> Middleware<I, O> create(String id) {
        return builder().build(id);
    }

    /**
     * Create a new builder for configuring retry behavior.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for configuring retry middleware. */
    public static final class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(30);
        private boolean jitter = true;

        private Builder() {
        }

        /** Set the maximum number of retry attempts. */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /** Set the base delay for exponential backoff. */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        /** Set the maximum delay between retries. */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        /** Whether to add random jitter to the delay. Defaults to {@code true}. */
        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Build the retry middleware.
         *
         * @param id the middleware id
         */
        public <I, O> Middleware<I, O> build(String id) {
            int retries = this.maxRetries;
            long baseMs = this.baseDelay.toMillis();
            long maxMs = this.maxDelay.toMillis();
            boolean useJitter = this.jitter;

            return Middleware.of(id, (ctx, input, next) -> {
                Exception lastError = null;

                for (int attempt = 0; attempt <= retries; attempt++) {
                    try {
                        return next.handle(ctx, input);
                    } catch (Exception e) {
                        lastError = e;

                        if (attempt >= retries || ctx.isCancelled()) {
                            break;
                        }

                        long cappedDelay = backoffMillis(baseMs, maxMs, attempt);
                        long finalDelay = useJitter
                                ? (long) (cappedDelay * (0.5 + Math.random() * 0.5))
                                : cappedDelay;

                        logger.log(Level.DEBUG, "{0} attempt {1} failed, retrying in {2}ms: {3}",
                                id, attempt + 1, finalDelay, e.getMessage());
                        Thread.sleep(finalDelay);
                    }
                }

                throw lastError;
            });
        }
    }

    /**
     * Exponential delay {@code baseMs * 2^attempt}, clamped to {@code [0, maxMs]}.
     * Stops doubling before the shift would overflow.
     */
    static long backoffMillis(long baseMs, long maxMs, int attempt) {
        long cap = Math.max(0, maxMs);
        if (baseMs <= 0) {
            return 0;
        }
        if (attempt >= Long.numberOfLeadingZeros(baseMs) - 1) {
            return cap;
        }
        return Math.min(baseMs << attempt, cap);
    }
}
