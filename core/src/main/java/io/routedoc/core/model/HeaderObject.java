package io.routedoc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/** A response header. */
public record HeaderObject(JsonNode schema, String description) {

    public HeaderObject {
        Objects.requireNonNull(schema, "schema must not be null");
        schema = schema.deepCopy();
    }
}
