package org.openjobspec.middleware;

/**
 * The call signature of a middleware, without its id. Adapted into a {@link Middleware}
 * by {@link Middleware#of(String, MiddlewareFunction)}.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@FunctionalInterface
public interface MiddlewareFunction<I, O> {

    O apply(Context ctx, I input, Handler<I, O> next) throws Exception;
}
