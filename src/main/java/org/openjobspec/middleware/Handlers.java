package org.openjobspec.middleware;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Composes middleware around a handler.
 */
public final class Handlers {

    private Handlers() {
    }

    /**
     * Decorate a handler with middleware. The first middleware is outermost: it sees the
     * input first and the output last.
     *
     * @param handler the terminal handler
     * @param with    the middleware, in execution order
     * @param <I>     the input type
     * @param <O>     the output type
     * @return the composed handler
     */
    @SafeVarargs
    public static <I, O> Handler<I, O> decorate(Handler<I, O> handler, Middleware<I, O>... with) {
        return decorate(handler, Arrays.asList(with));
    }

    /**
     * Decorate a handler with a list of middleware. The list is read once; later changes to
     * it do not affect the returned handler.
     *
     * @param handler the terminal handler
     * @param with    the middleware, in execution order
     * @param <I>     the input type
     * @param <O>     the output type
     * @return the composed handler
     */
    public static <I, O> Handler<I, O> decorate(Handler<I, O> handler,
                                                List<? extends Middleware<I, O>> with) {
        Objects.requireNonNull(handler, "handler must not be null");
        Objects.requireNonNull(with, "middleware list must not be null");

        var chain = handler;
        // Wrap in reverse order so first middleware is outermost
        for (int i = with.size() - 1; i >= 0; i--) {
            Middleware<I, O> mw = Objects.requireNonNull(with.get(i), "middleware must not be null");
            var next = chain;
            chain = (ctx, input) -> mw.handle(ctx, input, next);
        }
        return chain;
    }

    /**
     * Group middleware into a single middleware that runs them in order around
     * the next handler. The list is copied; later changes to it do not affect the group.
     *
     * @param id      the id of the group
     * @param members the middleware, in execution order
     * @param <I>     the input type
     * @param <O>     the output type
     * @return the grouped middleware
     */
    public static <I, O> Middleware<I, O> group(String id, List<? extends Middleware<I, O>> members) {
        Objects.requireNonNull(members, "members must not be null");
        List<Middleware<I, O>> snapshot = List.copyOf(members);
        return Middleware.of(id, (ctx, input, next) -> decorate(next, snapshot).handle(ctx, input));
    }
}
