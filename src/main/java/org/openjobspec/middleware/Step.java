package org.openjobspec.middleware;

import java.util.List;
import java.util.Objects;

import static java.lang.System.Logger.Level;

/**
 * An ordered group of middleware that operates on a step-specific input and output,
 * presented to the enclosing stack as a single {@code Middleware<Object, Object>}.
 *
 * <p>On each invocation the step snapshots its middleware, wraps the generic input into
 * its input type, runs the middleware in order, and hands the payload to the next
 * handler of the stack through a terminal adapter built for that invocation. The output
 * is unwrapped back to a generic result. Exceptions propagate unchanged.
 *
 * @param <I> the step input type
 * @param <O> the step output type
 */
public abstract class Step<I, O> implements Middleware<Object, Object> {

    private static final System.Logger logger = System.getLogger(Step.class.getName());

    private final String id;
    private final Class<I> inputType;
    private final Class<O> outputType;
    private final OrderedRegistry<Middleware<I, O>> registry = new OrderedRegistry<>(Middleware::id);

    protected Step(String id, Class<I> inputType, Class<O> outputType) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.inputType = Objects.requireNonNull(inputType, "inputType must not be null");
        this.outputType = Objects.requireNonNull(outputType, "outputType must not be null");
    }

    /** The fixed id of this step within a stack. */
    @Override
    public final String id() {
        return id;
    }

    @Override
    public final Object handle(Context ctx, Object input, Handler<Object, Object> next) throws Exception {
        Objects.requireNonNull(next, "next must not be null");
        var order = registry.getOrder();

        Handler<I, O> terminal = (c, in) -> {
            if (in == null) {
                throw Payloads.missing(id + " input", inputType);
            }
            return wrapResult(next.handle(c, unwrapInput(in)));
        };

        logger.log(Level.DEBUG, "{0} invoking {1} middleware", id, order.size());

        var out = Handlers.decorate(terminal, order).handle(ctx, wrapInput(input));
        if (out == null) {
            throw Payloads.missing(id + " output", outputType);
        }
        return unwrapOutput(out);
    }

    /** Wrap the generic input from the stack into this step's input. */
    protected abstract I wrapInput(Object input);

    /** Extract the payload passed on to the next handler of the stack. */
    protected abstract Object unwrapInput(I input);

    /** Wrap the result of the next handler of the stack into this step's output. */
    protected abstract O wrapResult(Object result);

    /** Extract the generic result returned to the stack. */
    protected abstract Object unwrapOutput(O output);

    /**
     * Add middleware at the front or back of this step.
     *
     * @throws StackError.StackException {@code duplicate_id} if the id is already present
     */
    public void add(Middleware<I, O> middleware, RelativePosition position) {
        registry.add(middleware, position);
    }

    /**
     * Insert middleware immediately before or after the middleware {@code relativeTo}.
     *
     * @throws StackError.StackException {@code duplicate_id} if the id is already present,
     *                                   {@code anchor_not_found} if {@code relativeTo} is absent
     */
    public void insert(Middleware<I, O> middleware, String relativeTo, RelativePosition position) {
        registry.insert(middleware, relativeTo, position);
    }

    /**
     * Replace the middleware {@code id}, keeping its position.
     *
     * @return the replaced middleware
     * @throws StackError.StackException {@code not_found} if {@code id} is absent,
     *                                   {@code duplicate_id} if the new id belongs to other middleware
     */
    public Middleware<I, O> swap(String id, Middleware<I, O> middleware) {
        return registry.swap(id, middleware);
    }

    /**
     * Remove the middleware {@code id}.
     *
     * @return the removed middleware
     * @throws StackError.StackException {@code not_found} if {@code id} is absent
     */
    public Middleware<I, O> remove(String id) {
        return registry.remove(id);
    }

    /** Remove all middleware from this step. */
    public void clear() {
        registry.clear();
    }

    /** The middleware of this step in execution order, as an immutable snapshot. */
    public List<Middleware<I, O>> getOrder() {
        return registry.getOrder();
    }

    /** The ids of the middleware of this step in execution order. */
    public List<String> ids() {
        return registry.ids();
    }

    public boolean contains(String id) {
        return registry.contains(id);
    }

    @Override
    public String toString() {
        return id + " " + registry;
    }
}
