package io.routedoc.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One response of an operation.
 *
 * @param description response description; {@code ""} when none was given
 * @param content     schema per content type; empty for responses without a body
 * @param headers     response headers by name
 */
public record ResponseObject(String description, Map<String, MediaTypeObject> content, Map<String, HeaderObject> headers) {

    public ResponseObject {
        description = description != null ? description : "";
        content = content != null ? Collections.unmodifiableMap(new LinkedHashMap<>(content)) : Map.of();
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
    }

    /** A response with only a description. */
    public static ResponseObject described(String description) {
        return new ResponseObject(description, Map.of(), Map.of());
    }

    public ResponseObject withDescription(String description) {
        return new ResponseObject(description, content, headers);
    }
}
