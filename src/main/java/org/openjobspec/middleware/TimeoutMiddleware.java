package org.openjobspec.middleware;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Timeout middleware.
 *
 * <p>Enforces a maximum execution time for the rest of the chain. Downstream handlers
 * receive a context carrying the deadline. If they do not complete in time, that context
 * is cancelled and a {@link TimeoutException} is thrown.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * stack.initialize().add(TimeoutMiddleware.create("timeout", Duration.ofSeconds(30)),
 *     RelativePosition.BEFORE);
 * }</pre>
 */
public final class TimeoutMiddleware {

    private TimeoutMiddleware() {
    }

    /**
     * Create a timeout middleware with the specified duration.
     *
     * @param id      the middleware id
     * @param timeout the maximum execution time
     * @return the middleware
     */
    public static <I, O> Middleware<I, O> create(String id, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return Middleware.of(id, (ctx, input, next) -> {
            var scoped = ctx.withTimeout(timeout);
            var future = CompletableFuture.supplyAsync(() -> {
                try {
                    return next.handle(scoped, input);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            });

            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                scoped.cancel();
                future.cancel(true);
                throw new TimeoutException(String.format(
                        "%s timed out after %dms", id, timeout.toMillis()));
            } catch (ExecutionException e) {
                var cause = e.getCause();
                if (cause instanceof Exception ex) {
                    throw ex;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw new RuntimeException(cause);
            }
        });
    }
}
