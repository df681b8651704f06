package org.openjobspec.middleware;

import org.openjobspec.middleware.StackError.StackException;
import org.openjobspec.middleware.StackError.TypeMismatchError;

import java.util.Objects;

/**
 * Checked narrowing of opaque payloads.
 */
final class Payloads {

    private Payloads() {}

    /**
     * Narrow {@code value} to {@code type}. A null value narrows to null.
     *
     * @throws StackException with code {@code type_mismatch} if the value is not a {@code type}
     */
    static <T> T narrow(Object value, Class<T> type, String what) {
        Objects.requireNonNull(type, "type must not be null");
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new StackException(new TypeMismatchError(
                    "%s is %s, expected %s".formatted(what, value.getClass().getName(), type.getName()),
                    type, value.getClass()));
        }
        return type.cast(value);
    }

    static StackException missing(String what, Class<?> expected) {
        return new StackException(new TypeMismatchError(
                "%s is null, expected %s".formatted(what, expected.getName()), expected, null));
    }
}
