package io.routedoc.core.model;

import io.routedoc.core.schema.DataType;
import java.util.Objects;

/**
 * A response explicitly declared on an endpoint. Overrides any inferred response with the same
 * status code.
 *
 * @param description response description
 * @param type        body type, or {@code null} for a response without content
 */
public record DeclaredResponse(String description, DataType type) {

    public DeclaredResponse {
        Objects.requireNonNull(description, "description must not be null");
    }
}
