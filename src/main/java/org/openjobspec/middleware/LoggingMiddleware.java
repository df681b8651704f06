package org.openjobspec.middleware;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Logging middleware for chain instrumentation.
 *
 * <p>Logs start, completion, and failure events with timing information
 * using {@link System.Logger} (part of java.base, no additional module required).
 * Failures are rethrown unchanged.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * stack.finalizeStep().add(LoggingMiddleware.create("log"), RelativePosition.BEFORE);
 *
 * // With a custom logger
 * step.add(LoggingMiddleware.create("log", System.getLogger("my.client")), RelativePosition.AFTER);
 * }</pre>
 */
public final class LoggingMiddleware {

    private LoggingMiddleware() {
    }

    /**
     * Create a logging middleware with the default logger.
     *
     * @param id the middleware id
     * @return the middleware
     */
    public static <I, O> Middleware<I, O> create(String id) {
        return create(id, System.getLogger("org.openjobspec.middleware"));
    }

    /**
     * Create a logging middleware with a custom logger.
     *
     * @param id     the middleware id
     * @param logger the logger to use
     * @return the middleware
     */
    public static <I, O> Middleware<I, O> create(String id, System.Logger logger) {
        Objects.requireNonNull(logger, "logger must not be null");
        return Middleware.of(id, (ctx, input, next) -> {
            logger.log(System.Logger.Level.DEBUG, "{0} started", id);

            var start = Instant.now();

            try {
                var output = next.handle(ctx, input);
                var duration = Duration.between(start, Instant.now());

                logger.log(System.Logger.Level.DEBUG, "{0} completed ({1}ms)",
                        id, duration.toMillis());
                return output;
            } catch (Exception e) {
                var duration = Duration.between(start, Instant.now());

                logger.log(System.Logger.Level.ERROR,
                        "%s failed (%dms): %s".formatted(id, duration.toMillis(), e.getMessage()),
                        e);
                throw e;
            }
        });
    }
}
