/**
 * OJS Middleware: ordered, typed middleware stacks for composing named handlers
 * around a terminal handler.
 *
 * <p>Provides the five-step {@code Stack}, id-keyed ordered registries, the chain
 * composer and common logging, retry and timeout middleware.
 */
module org.openjobspec.middleware {
    // Optional: Jackson support for TypedMiddleware
    requires static com.fasterxml.jackson.databind;

    exports org.openjobspec.middleware;
    exports org.openjobspec.middleware.testing;
}
