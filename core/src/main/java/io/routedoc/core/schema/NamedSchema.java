package io.routedoc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * A registry entry: the component name and schema of one type identity.
 *
 * @param name   component name under {@code components.schemas}
 * @param schema schema body, with numeric bounds already inferred
 */
public record NamedSchema(String name, JsonNode schema) {

    public NamedSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
    }
}
