package io.routedoc.core.model;

import java.util.Objects;

/**
 * Identity of an operation inside a document: its path template and method. Two endpoints with
 * the same key are merged by the compiler.
 */
public record OperationKey(PathTemplate path, HttpMethod method) {

    public OperationKey {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(method, "method must not be null");
    }

    /** Convenience factory, e.g. {@code OperationKey.of(HttpMethod.GET, "/users/{id}")}. */
    public static OperationKey of(HttpMethod method, String path) {
        return new OperationKey(PathTemplate.parse(path), method);
    }

    @Override
    public String toString() {
        return method + " " + path.render();
    }
}
