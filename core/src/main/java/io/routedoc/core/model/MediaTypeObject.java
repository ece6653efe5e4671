package io.routedoc.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/** Schema of one content type inside a request or response body. */
public record MediaTypeObject(JsonNode schema) {

    public MediaTypeObject {
        schema = schema != null ? schema.deepCopy() : null;
    }
}
