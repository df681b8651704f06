package org.openjobspec.middleware;

/**
 * A step input that carries the caller's operation parameters.
 *
 * @see TypedMiddleware
 */
public interface ParametersInput {

    /** The operation parameters as passed to the stack. */
    Object parameters();
}
