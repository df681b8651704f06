package org.openjobspec.middleware;

/**
 * Where to place middleware: relative to a whole step for {@code add}, or relative to an
 * existing middleware for {@code insert}.
 */
public enum RelativePosition {
    BEFORE,
    AFTER
}
