package org.openjobspec.middleware;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import static java.lang.System.Logger.Level;

/**
 * A middleware stack: five ordered steps that decorate a terminal handler.
 *
 * <pre>{@code
 * var stack = Stack.builder()
 *     .id("PutObject")
 *     .requestFactory(Request::new)
 *     .build();
 *
 * stack.serialize().add(Middleware.of("serialize", (ctx, in, next) -> {
 *     var params = in.parameters(PutObjectInput.class);
 *     in.request(Request.class).header("x-key", params.key());
 *     return next.handle(ctx, in);
 * }), RelativePosition.AFTER);
 *
 * var handler = stack.decorate((ctx, request) -> transport.send((Request) request));
 * var result = handler.handle(Context.background(), new PutObjectInput("a", "b"));
 * }</pre>
 *
 * <p>Steps execute in the order initialize, serialize, build, finalize, deserialize. Each
 * step composes its middleware on every invocation, so middleware may be added or removed
 * between invocations. Mutation is not thread-safe: configure the stack before invoking it
 * from multiple threads.
 */
public final class Stack implements Middleware<Object, Object> {

    private static final System.Logger logger = System.getLogger(Stack.class.getName());

    private final String id;
    private final InitializeStep initialize;
    private final SerializeStep serialize;
    private final BuildStep build;
    private final FinalizeStep finalizeStep;
    private final DeserializeStep deserialize;

    private Stack(Builder builder) {
        this.id = builder.id;
        this.initialize = new InitializeStep();
        this.serialize = new SerializeStep(builder.requestFactory);
        this.build = new BuildStep();
        this.finalizeStep = new FinalizeStep();
        this.deserialize = new DeserializeStep();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The stack id, e.g. the operation name. */
    @Override
    public String id() {
        return id;
    }

    public InitializeStep initialize() {
        return initialize;
    }

    public SerializeStep serialize() {
        return serialize;
    }

    public BuildStep build() {
        return build;
    }

    public FinalizeStep finalizeStep() {
        return finalizeStep;
    }

    public DeserializeStep deserialize() {
        return deserialize;
    }

    /** The steps in execution order. */
    public List<Step<?, ?>> steps() {
        return List.of(initialize, serialize, build, finalizeStep, deserialize);
    }

    /**
     * Run the input through every step, then hand the request to {@code next}.
     */
    @Override
    public Object handle(Context ctx, Object input, Handler<Object, Object> next) throws Exception {
        logger.log(Level.DEBUG, "Stack {0} invoked", id);
        return Handlers.decorate(next, List.<Middleware<Object, Object>>of(
                initialize, serialize, build, finalizeStep, deserialize)).handle(ctx, input);
    }

    /**
     * Decorate a terminal handler with this stack.
     *
     * @param terminal the handler the last step delegates to
     * @return the decorated handler
     */
    public Handler<Object, Object> decorate(Handler<Object, Object> terminal) {
        Objects.requireNonNull(terminal, "terminal must not be null");
        return (ctx, input) -> handle(ctx, input, terminal);
    }

    /**
     * A listing of the steps and their middleware in execution order.
     */
    public String describe() {
        var sb = new StringBuilder(id).append(" stack step\n");
        for (var step : steps()) {
            sb.append(step.id()).append('\n');
            for (var mwId : step.ids()) {
                sb.append("\t").append(mwId).append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe();
    }

    // --- Builder ---

    public static final class Builder {
        private String id;
        private Supplier<?> requestFactory;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /** Set the factory creating the request for each invocation of the serialize step. */
        public Builder requestFactory(Supplier<?> requestFactory) {
            this.requestFactory = requestFactory;
            return this;
        }

        public Stack build() {
            Objects.requireNonNull(id, "id must not be null");
            return new Stack(this);
        }
    }
}
