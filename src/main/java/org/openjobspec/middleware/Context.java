package org.openjobspec.middleware;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Context passed to handlers and middleware on every call of a chain.
 *
 * <p>Carries request-scoped values, a cancellation flag and an optional deadline. Contexts
 * are immutable: {@code with*} methods derive a child, and a child is cancelled whenever
 * one of its ancestors is.
 *
 * <pre>{@code
 * var ctx = Context.background()
 *     .withValue("operation", "PutObject")
 *     .withTimeout(Duration.ofSeconds(5));
 * handler.handle(ctx, input);
 * }</pre>
 *
 * <p>The stack itself never interprets cancellation or deadlines; middleware do.
 */
public final class Context {

    private static final Context BACKGROUND = new Context(null, null, null, null, null);

    private final Context parent;
    private final Object key;
    private final Object value;
    private final AtomicBoolean cancelled;
    private final Instant deadline;

    private Context(Context parent, Object key, Object value, AtomicBoolean cancelled, Instant deadline) {
        this.parent = parent;
        this.key = key;
        this.value = value;
        this.cancelled = cancelled;
        this.deadline = deadline;
    }

    /** The root context. It has no values, no deadline, and cannot be cancelled. */
    public static Context background() {
        return BACKGROUND;
    }

    /**
     * Derive a context carrying {@code value} under {@code key}. Shares this context's
     * cancellation scope and deadline.
     */
    public Context withValue(Object key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        return new Context(this, key, value, cancelled, deadline);
    }

    /** Derive a context that can be cancelled independently of this one. */
    public Context withCancel() {
        return new Context(this, null, null, new AtomicBoolean(), deadline);
    }

    /**
     * Derive a cancellable context with a deadline. The effective deadline is the earlier of
     * {@code deadline} and this context's deadline.
     */
    public Context withDeadline(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline must not be null");
        var effective = this.deadline != null && this.deadline.isBefore(deadline)
                ? this.deadline : deadline;
        return new Context(this, null, null, new AtomicBoolean(), effective);
    }

    /** Derive a cancellable context whose deadline is {@code timeout} from now. */
    public Context withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        return withDeadline(Instant.now().plus(timeout));
    }

    /** The value stored under {@code key} in this context or its ancestors, or null. */
    public Object value(Object key) {
        for (var c = this; c != null; c = c.parent) {
            if (c.key != null && c.key.equals(key)) {
                return c.value;
            }
        }
        return null;
    }

    /**
     * The value stored under {@code key}, narrowed to {@code type}.
     *
     * @throws StackError.StackException {@code type_mismatch} if the value is not a {@code type}
     */
    public <T> T value(Object key, Class<T> type) {
        return Payloads.narrow(value(key), type, "context value " + key);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Whether this context, or an ancestor, was cancelled or its deadline has passed. */
    public boolean isCancelled() {
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            return true;
        }
        for (var c = this; c != null; c = c.parent) {
            if (c.cancelled != null && c.cancelled.get()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Cancel this context's cancellation scope. A scope starts at a context created by
     * {@link #withCancel()}, {@link #withDeadline(Instant)} or {@link #withTimeout(Duration)}
     * and includes its {@code withValue} children, so cancelling a value child also cancels
     * the context it was derived from. Every context derived from a cancelled scope is
     * cancelled too.
     *
     * @throws IllegalStateException if this is the background context or one of its value children
     */
    public void cancel() {
        if (cancelled == null) {
            throw new IllegalStateException("Context is not cancellable. Derive one with withCancel().");
        }
        cancelled.set(true);
    }

    /**
     * @throws CancellationException if {@link #isCancelled()}
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException(deadline != null && !Instant.now().isBefore(deadline)
                    ? "context deadline exceeded" : "context cancelled");
        }
    }
}
