package org.openjobspec.middleware;

/**
 * Fourth step of a {@link Stack}. Middleware here run once per attempt: retries, signing,
 * and anything else that must see the request as it goes out.
 */
public final class FinalizeStep extends Step<FinalizeStep.Input, FinalizeStep.Output> {

    public static final String ID = "Finalize stack step";

    /** Input of the finalize step. */
    public record Input(Object request) {

        public <T> T request(Class<T> type) {
            return Payloads.narrow(request, type, "request");
        }

        public Input withRequest(Object request) {
            return new Input(request);
        }
    }

    /** Output of the finalize step. */
    public record Output(Object result) {

        public <T> T result(Class<T> type) {
            return Payloads.narrow(result, type, "result");
        }
    }

    public FinalizeStep() {
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
