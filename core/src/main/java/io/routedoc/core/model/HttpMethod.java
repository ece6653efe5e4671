package io.routedoc.core.model;

import java.util.Locale;

/** HTTP methods in OpenAPI path-item order. */
public enum HttpMethod {
    GET,
    PUT,
    POST,
    DELETE,
    OPTIONS,
    HEAD,
    PATCH,
    TRACE;

    /** Lower-case key used in an OpenAPI path item (e.g. {@code "get"}). */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a method name case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known method
     */
    public static HttpMethod parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
