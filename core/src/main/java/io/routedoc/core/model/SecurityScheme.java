package io.routedoc.core.model;

import java.util.Objects;

/**
 * An OpenAPI security scheme definition.
 *
 * @param type         {@code http}, {@code apiKey}, {@code oauth2} or {@code openIdConnect}
 * @param scheme       HTTP auth scheme for {@code type: http} (e.g. {@code basic}), else null
 * @param bearerFormat bearer token format hint, or null
 * @param in           location of an API key ({@code query}, {@code header}, {@code cookie}), or null
 * @param name         API key parameter name, or null
 * @param description  human-readable description, or null
 */
public record SecurityScheme(
        String type, String scheme, String bearerFormat, String in, String name, String description) {

    public SecurityScheme {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static SecurityScheme basic(String description) {
        return new SecurityScheme("http", "basic", null, null, null, description);
    }

    public static SecurityScheme bearer(String bearerFormat) {
        return new SecurityScheme("http", "bearer", bearerFormat, null, null, null);
    }

    public static SecurityScheme apiKey(String in, String name) {
        return new SecurityScheme("apiKey", null, null, in, name, null);
    }
}
