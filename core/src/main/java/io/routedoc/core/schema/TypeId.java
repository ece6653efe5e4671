package io.routedoc.core.schema;

import java.util.Objects;

/**
 * Stable, content-independent identity of a payload type. Two types with structurally identical
 * schemas but different ids are distinct registry entries.
 *
 * @param value registered name or fully-qualified type tag (e.g. {@code "com.acme.User"})
 */
public record TypeId(String value) {

    public TypeId {
        Objects.requireNonNull(value, "type id must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("type id must not be blank");
        }
    }

    public static TypeId of(String value) {
        return new TypeId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
