package org.openjobspec.middleware;

/**
 * First step of a {@link Stack}. Middleware here see the caller's parameters before any
 * request exists: validation, defaults, idempotency tokens.
 */
public final class InitializeStep extends Step<InitializeStep.Input, InitializeStep.Output> {

    public static final String ID = "Initialize stack step";

    /** Input of the initialize step. */
    public record Input(Object parameters) implements ParametersInput {

        /** The parameters narrowed to {@code type}. */
        public <T> T parameters(Class<T> type) {
            return Payloads.narrow(parameters, type, "parameters");
        }

        public Input withParameters(Object parameters) {
            return new Input(parameters);
        }
    }

    /** Output of the initialize step. */
    public record Output(Object result) {

        public <T> T result(Class<T> type) {
            return Payloads.narrow(result, type, "result");
        }
    }

    public InitializeStep() {
        super(ID, Input.class, Output.class);
    }

    @Override
    protected Input wrapInput(Object input) {
        return new Input(input);
    }

    @Override
    protected Object unwrapInput(Input input) {
        return input.parameters();
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
