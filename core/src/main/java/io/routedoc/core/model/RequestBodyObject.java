package io.routedoc.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An operation's request body.
 *
 * @param description description, or null
 * @param content     schema per content type
 * @param required    whether the body is required
 */
public record RequestBodyObject(String description, Map<String, MediaTypeObject> content, boolean required) {

    public RequestBodyObject {
        content = content != null ? Collections.unmodifiableMap(new LinkedHashMap<>(content)) : Map.of();
    }
}
