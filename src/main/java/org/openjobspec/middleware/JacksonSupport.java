package org.openjobspec.middleware;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.openjobspec.middleware.StackError.StackException;
import org.openjobspec.middleware.StackError.TypeMismatchError;

/**
 * Optional Jackson support. Only used when Jackson is on the classpath.
 * The mapper is loaded lazily: if Jackson is absent, conversion fails only
 * when a value actually needs converting.
 */
final class JacksonSupport {

    private JacksonSupport() {}

    private static final class Holder {
        static final ObjectMapper MAPPER = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get the shared ObjectMapper instance.
     *
     * @throws IllegalStateException if Jackson is not on the classpath
     */
    static ObjectMapper requireMapper() {
        try {
            return Holder.MAPPER;
        } catch (NoClassDefFoundError e) {
            throw new IllegalStateException(
                    "Jackson (com.fasterxml.jackson.databind) is required for TypedMiddleware. " +
                    "Add jackson-databind to your dependencies.", e);
        }
    }

    /**
     * Convert {@code value} to {@code type}. Null converts to null; values already of the
     * type are returned as-is.
     *
     * @throws StackException {@code type_mismatch} if Jackson cannot convert the value
     */
    static <T> T convert(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return requireMapper().convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new StackException(new TypeMismatchError(
                    "cannot convert parameters of type %s to %s".formatted(
                            value.getClass().getName(), type.getName()),
                    type, value.getClass()), e);
        }
    }
}
