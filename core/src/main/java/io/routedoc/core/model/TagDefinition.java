package io.routedoc.core.model;

import java.util.Objects;

/** A document-level tag definition. */
public record TagDefinition(String name, String description) {

    public TagDefinition {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static TagDefinition of(String name, String description) {
        return new TagDefinition(name, description);
    }
}
