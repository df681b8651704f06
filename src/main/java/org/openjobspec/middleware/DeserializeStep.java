package org.openjobspec.middleware;

/**
 * Last step of a {@link Stack}. The response of the terminal handler arrives as the raw
 * response; middleware here turn it into the operation result.
 *
 * <p>The step returns {@link Output#result()} when a middleware set it, and the raw
 * response otherwise.
 */
public final class DeserializeStep extends Step<DeserializeStep.Input, DeserializeStep.Output> {

    public static final String ID = "Deserialize stack step";

    /** Input of the deserialize step. */
    public record Input(Object request) {

        public <T> T request(Class<T> type) {
            return Payloads.narrow(request, type, "request");
        }

        public Input withRequest(Object request) {
            return new Input(request);
        }
    }

    /** Output of the deserialize step. */
    public record Output(Object rawResponse, Object result) {

        /** The raw response narrowed to {@code type}. */
        public <T> T rawResponse(Class<T> type) {
            return Payloads.narrow(rawResponse, type, "raw response");
        }

        public <T> T result(Class<T> type) {
            return Payloads.narrow(result, type, "result");
        }

        public Output withResult(Object result) {
            return new Output(rawResponse, result);
        }
    }

    public DeserializeStep() {
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
        return new Output(result, null);
    }

    @Override
    protected Object unwrapOutput(Output output) {
        return output.result() != null ? output.result() : output.rawResponse();
    }
}
