package org.openjobspec.middleware;

import java.util.Objects;

/**
 * A middleware that receives the operation parameters converted to a typed object.
 *
 * <p>Parameters already of the requested type are passed as-is. Anything else (typically a
 * {@code Map}) is converted with Jackson's {@code ObjectMapper}, which must then be on the
 * classpath.
 *
 * <pre>{@code
 * public record PutObjectInput(String bucket, String key) {}
 *
 * stack.serialize().add(TypedMiddleware.of("serialize", PutObjectInput.class,
 *     (params, ctx, in, next) -> {
 *         in.request(Request.class).header("x-bucket", params.bucket());
 *         return next.handle(ctx, in);
 *     }), RelativePosition.AFTER);
 * }</pre>
 *
 * @param <P> the parameters type
 * @param <I> the step input type
 * @param <O> the step output type
 */
@FunctionalInterface
public interface TypedMiddleware<P, I extends ParametersInput, O> {

    /**
     * Handle a step input with typed parameters.
     *
     * @param parameters the converted parameters (null if the input carried none)
     * @param ctx        the invocation context
     * @param input      the step input
     * @param next       the next handler in the chain
     * @return the step output
     * @throws Exception if the middleware or a downstream handler fails
     */
    O handle(P parameters, Context ctx, I input, Handler<I, O> next) throws Exception;

    /**
     * Create a {@link Middleware} that converts the input's parameters to {@code type}, then
     * delegates to the typed middleware.
     *
     * @param id      the middleware id
     * @param type    the class to convert the parameters to
     * @param handler the typed middleware
     * @return a standard middleware
     * @throws StackError.StackException {@code type_mismatch}, when invoked, if the parameters
     *                                   cannot be converted
     */
    static <P, I extends ParametersInput, O> Middleware<I, O> of(String id, Class<P> type,
                                                                 TypedMiddleware<P, I, O> handler) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        return Middleware.of(id, (ctx, input, next) -> {
            P parameters = JacksonSupport.convert(input.parameters(), type);
            return handler.handle(parameters, ctx, input, next);
        });
    }
}
