package org.openjobspec.middleware;

/**
 * Third step of a {@link Stack}. Middleware here add to the serialized request: content
 * length, checksums, user agent, and other headers that do not depend on retries.
 *
 * <pre>{@code
 * stack.build().add(Middleware.of("user-agent", (ctx, in, next) -> {
 *     in.request(Request.class).header("user-agent", "ojs/0.1.0");
 *     return next.handle(ctx, in);
 * }), RelativePosition.AFTER);
 * }</pre>
 */
public final class BuildStep extends Step<BuildStep.Input, BuildStep.Output> {

    public static final String ID = "Build stack step";

    /** Input of the build step. */
    public record Input(Object request) {

        /** The request narrowed to {@code type}. */
        public <T> T request(Class<T> type) {
            return Payloads.narrow(request, type, "request");
        }

        public Input withRequest(Object request) {
            return new Input(request);
        }
    }

    /** Output of the build step. */
    public record Output(Object result) {

        public <T> T result(Class<T> type) {
            return Payloads.narrow(result, type, "result");
        }
    }

    public BuildStep() {
        super(ID, Input.class, Output.class);
    }

    @Override
    protected Input wrapInput(Object input) {
        return new Input(input);
    }

    @Override
    protected Object unwrapInput(Input input) {
        return input.request();
    }

    @Override
    protected Output wrapResult(Object result) {
        return new Output(result);
    }

    @Override
    protected Object unwrapOutput(Output output) {
        return output.result();
    }
}
