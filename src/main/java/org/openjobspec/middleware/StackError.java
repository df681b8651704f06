package org.openjobspec.middleware;

/**
 * Structured error types for the middleware stack.
 *
 * <p>Uses sealed interface hierarchy to represent different error categories
 * while maintaining a common structure for error code and message.
 * Errors thrown by middleware or terminal handlers are never wrapped in these
 * types; they reach the caller unchanged.
 */
public sealed interface StackError {

    String code();
    String message();

    // Error code constants
    String CODE_DUPLICATE_ID = "duplicate_id";
    String CODE_ANCHOR_NOT_FOUND = "anchor_not_found";
    String CODE_NOT_FOUND = "not_found";
    String CODE_INVALID_ID = "invalid_id";
    String CODE_TYPE_MISMATCH = "type_mismatch";

    /** A registry mutation was rejected. The registry is unchanged. */
    record RegistryError(String code, String message, String id) implements StackError {
        @Override
        public String toString() {
            return "stack: " + code + ": " + message;
        }
    }

    /** An id argument was null or blank. */
    record ValidationError(String code, String message) implements StackError {
        @Override
        public String toString() {
            return "stack: validation: " + message;
        }
    }

    /** A payload could not be narrowed or converted to the type a step or middleware expects. */
    record TypeMismatchError(String message, Class<?> expected, Class<?> actual) implements StackError {
        @Override
        public String code() {
            return CODE_TYPE_MISMATCH;
        }

        @Override
        public String toString() {
            return "stack: type mismatch: " + message;
        }
    }

    /** Exception wrapping a StackError. */
    final class StackException extends RuntimeException {
        private final StackError error;

        public StackException(StackError error) {
            super(error.toString());
            this.error = error;
        }

        public StackException(StackError error, Throwable cause) {
            super(error.toString(), cause);
            this.error = error;
        }

        public StackError error() {
            return error;
        }

        public String code() {
            return error.code();
        }

        public boolean isDuplicateId() {
            return CODE_DUPLICATE_ID.equals(error.code());
        }

        public boolean isAnchorNotFound() {
            return CODE_ANCHOR_NOT_FOUND.equals(error.code());
        }

        public boolean isNotFound() {
            return CODE_NOT_FOUND.equals(error.code());
        }

        public boolean isTypeMismatch() {
            return CODE_TYPE_MISMATCH.equals(error.code());
        }
    }
}
