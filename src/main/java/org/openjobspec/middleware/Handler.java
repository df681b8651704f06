package org.openjobspec.middleware;

/**
 * Functional interface for handlers. A handler takes an input and produces an output.
 *
 * <p>A handler is either the terminal of a chain (a network call, a mock, business logic)
 * or a chain that has been decorated with middleware:
 * <pre>{@code
 * Handler<Object, Object> send = (ctx, request) -> transport.send(request);
 * var decorated = Handlers.decorate(send, LoggingMiddleware.create("log"));
 * var response = decorated.handle(Context.background(), request);
 * }</pre>
 *
 * @param <I> the input type
 * @param <O> the output type
 */
@FunctionalInterface
public interface Handler<I, O> {

    /**
     * Handle an input.
     *
     * @param ctx   the invocation context
     * @param input the input value (may be null)
     * @return the output (may be null)
     * @throws Exception if the handler fails
     */
    O handle(Context ctx, I input) throws Exception;
}
