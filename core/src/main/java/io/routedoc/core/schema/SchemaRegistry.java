package io.routedoc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.routedoc.core.error.StructuralConflictException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, deduplicating store of named schemas keyed by {@link TypeId}.
 *
 * <p>
 * Entries are deduplicated by type identity, never by structural equality: two types with
 * identical schemas but different ids stay distinct entries. Two different ids may not claim the
 * same component name. Entries keep first-registration order.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class SchemaRegistry {

    private static final SchemaRegistry EMPTY = new SchemaRegistry(Map.of());

    private final Map<TypeId, NamedSchema> entries;

    private SchemaRegistry(Map<TypeId, NamedSchema> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static SchemaRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this registry's entries. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.entries.putAll(entries);
        entries.forEach((id, named) -> builder.names.put(named.name(), id));
        return builder;
    }

    public Optional<NamedSchema> lookup(TypeId id) {
        return Optional.ofNullable(entries.get(id));
    }

    /** Looks up an entry by its component name. */
    public Optional<NamedSchema> byName(String name) {
        return entries.values().stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public boolean contains(TypeId id) {
        return entries.containsKey(id);
    }

    /** Unmodifiable view of all entries in registration order. */
    public Map<TypeId, NamedSchema> entries() {
        return entries;
    }

    public Set<TypeId> typeIds() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns {@code true} if every {@code $ref} inside {@code node} points at an entry of this
     * registry.
     */
    public boolean resolves(JsonNode node) {
        if (node == null) {
            return true;
        }
        if (node.isObject()) {
            JsonNode ref = node.get("$ref");
            if (ref != null && ref.isTextual()) {
                String text = ref.asText();
                if (!text.startsWith(DataType.REF_PREFIX)
                        || byName(text.substring(DataType.REF_PREFIX.length())).isEmpty()) {
                    return false;
                }
            }
        }
        for (JsonNode child : node) {
            if (!resolves(child)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SchemaRegistry other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "SchemaRegistry" + entries.keySet();
    }

    /**
     * Builder for a {@link SchemaRegistry}. Each {@link #declare(DataType)} registers a named type
     * and, transitively, every type it references.
     */
    public static final class Builder {

        private final Map<TypeId, NamedSchema> entries = new LinkedHashMap<>();
        private final Map<String, TypeId> names = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers {@code type} if it is named, then its references. Inline types contribute only
         * their references.
         *
         * @throws StructuralConflictException if another type identity already uses the same name,
         *                                     or the same identity was registered under another
         *                                     name
         */
        public Builder declare(DataType type) {
            if (type.isNamed()) {
                if (!put(type.id(), new NamedSchema(type.schemaName(), NumericBounds.inferBounds(type.schema())))) {
                    return this;
                }
            }
            return declareReferences(type);
        }

        /** Registers only the types referenced by {@code type}, not the type itself. */
        public Builder declareReferences(DataType type) {
            for (DataType reference : type.references()) {
                declare(reference);
            }
            return this;
        }

        /** Adds every entry of {@code other}, subject to the same identity rules. */
        public Builder merge(SchemaRegistry other) {
            other.entries.forEach(this::put);
            return this;
        }

        public SchemaRegistry build() {
            return entries.isEmpty() ? EMPTY : new SchemaRegistry(entries);
        }

        /** Returns {@code true} if the entry was newly added. */
        private boolean put(TypeId id, NamedSchema schema) {
            NamedSchema existing = entries.get(id);
            if (existing != null) {
                if (!existing.name().equals(schema.name())) {
                    throw new StructuralConflictException(
                            "Type '" + id + "' is registered under two names: '" + existing.name() + "' and '"
                                    + schema.name() + "'",
                            null,
                            "schema:" + id);
                }
                return false;
            }
            TypeId owner = names.get(schema.name());
            if (owner != null) {
                throw new StructuralConflictException(
                        "Schema name '" + schema.name() + "' is claimed by two types: '" + owner + "' and '" + id + "'",
                        null,
                        "schema:" + schema.name());
            }
            entries.put(id, schema);
            names.put(schema.name(), id);
            return true;
        }
    }
}
