package io.routedoc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * An operation parameter, identified within its operation by {@link #key()}.
 *
 * @param name            parameter name
 * @param in              where the parameter lives
 * @param required        whether the parameter must be present (always true for path parameters)
 * @param schema          parameter schema
 * @param description     description, or null
 * @param allowEmptyValue whether an empty value is allowed (query flags)
 */
public record Parameter(
        String name, ParameterLocation in, boolean required, JsonNode schema, String description, boolean allowEmptyValue) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(in, "in must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        schema = schema.deepCopy();
    }

    /** Identity within one operation: location plus name, e.g. {@code "query:limit"}. */
    public String key() {
        return in.key() + ":" + name;
    }
}
