/**
 * Ordered middleware stacks.
 *
 * <p>A {@link org.openjobspec.middleware.Stack} decorates a terminal
 * {@link org.openjobspec.middleware.Handler} with five
 * {@link org.openjobspec.middleware.Step steps}. Each step keeps its
 * {@link org.openjobspec.middleware.Middleware} in an
 * {@link org.openjobspec.middleware.OrderedRegistry} keyed by id, so middleware can be
 * added, inserted relative to one another, swapped or removed at any time before an
 * invocation.
 */
package org.openjobspec.middleware;
