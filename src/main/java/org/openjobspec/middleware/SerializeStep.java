package org.openjobspec.middleware;

import java.util.function.Supplier;

/**
 * Second step of a {@link Stack}. Each invocation gets a fresh request from the request
 * factory; middleware here write the parameters into it. Only the request is passed on
 * to the following steps.
 */
public final class SerializeStep extends Step<SerializeStep.Input, SerializeStep.Output> {

    public static final String ID = "Serialize stack step";

    /** Input of the serialize step. */
    public record Input(Object parameters, Object request) implements ParametersInput {

        public <T> T parameters(Class<T> type) {
            return Payloads.narrow(parameters, type, "parameters");
        }

        /** The request narrowed to {@code type}. */
        public <T> T request(Class<T> type) {
            return Payloads.narrow(request, type, "request");
        }

        public Input withParameters(Object parameters) {
            return new Input(parameters, request);
        }

        public Input withRequest(Object request) {
            return new Input(parameters, request);
        }
    }

    /** Output of the serialize step. */
    public record Output(Object result) {

        public <T> T result(Class<T> type) {
            return Payloads.narrow(result, type, "result");
        }
    }

    private final Supplier<?> requestFactory;

    /** Create a serialize step whose requests start out null. */
    public SerializeStep() {
        this(() -> null);
    }

    /**
     * Create a serialize step.
     *
     * @param requestFactory creates the request for each invocation
     */
    public SerializeStep(Supplier<?> requestFactory) {
        super(ID, Input.class, Output.class);
        this.requestFactory = requestFactory != null ? requestFactory : () -> null;
    }

    @Override
    protected Input wrapInput(Object input) {
        return new Input(input, requestFactory.get());
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
