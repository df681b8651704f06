package org.openjobspec.middleware;

import java.util.Objects;

/**
 * A named unit of processing that wraps the next handler in a chain.
 *
 * <p>Middleware follows the onion model (outer layers execute first):
 * <pre>{@code
 * step.add(Middleware.of("timing", (ctx, in, next) -> {
 *     var start = Instant.now();
 *     var out = next.handle(ctx, in);
 *     System.out.printf("Done in %dms%n",
 *         Duration.between(start, Instant.now()).toMillis());
 *     return out;
 * }), RelativePosition.AFTER);
 * }</pre>
 *
 * <p>Middleware may call {@code next.handle(ctx, input)} to continue the chain, or
 * return without calling it to short-circuit the rest of the chain.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public interface Middleware<I, O> {

    /**
     * The id of this middleware. Ids are unique within a step.
     */
    String id();

    /**
     * Apply this middleware around the next handler in the chain.
     *
     * @param ctx   the invocation context
     * @param input the input value
     * @param next  the next handler in the chain (eventually the terminal handler)
     * @return the output
     * @throws Exception if the middleware or a downstream handler fails
     */
    O handle(Context ctx, I input, Handler<I, O> next) throws Exception;

    /**
     * Create a middleware with the given id that invokes {@code fn}.
     *
     * @param id the unique id
     * @param fn the middleware function
     * @param <I> the input type
     * @param <O> the output type
     * @return the middleware
     */
    static <I, O> Middleware<I, O> of(String id, MiddlewareFunction<I, O> fn) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fn, "fn must not be null");
        return new FunctionMiddleware<>(id, fn);
    }

    /** Middleware backed by a {@link MiddlewareFunction}. */
    record FunctionMiddleware<I, O>(String id, MiddlewareFunction<I, O> fn) implements Middleware<I, O> {

        @Override
        public O handle(Context ctx, I input, Handler<I, O> next) throws Exception {
            return fn.apply(ctx, input, next);
        }
    }
}
