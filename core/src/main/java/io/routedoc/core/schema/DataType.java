package io.routedoc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Schema description of one payload or parameter type, as supplied by the schema-derivation
 * collaborator.
 *
 * <p>
 * A <em>named</em> type ({@link #schemaName()} non-null) is referenced as
 * {@code {"$ref":"#/components/schemas/<name>"}} and lands in the {@link SchemaRegistry}; an
 * <em>inline</em> type is copied wherever it is used. {@link #references()} lists the named types
 * the schema refers to, so that the registry can be closed over them.
 *
 * <p>
 * Immutable: schema nodes are copied on the way in and must not be modified through the
 * accessors.
 *
 * @param id          stable type identity, the registry deduplication key
 * @param schemaName  component name for named types, {@code null} for inline types
 * @param schema      JSON Schema of the wire encoding
 * @param paramSchema schema used when the type is bound to a path, query or header parameter
 * @param elementType element type for list types, otherwise {@code null}
 * @param references  types referenced from {@code schema} or {@code paramSchema}
 */
public record DataType(
        TypeId id,
        String schemaName,
        JsonNode schema,
        JsonNode paramSchema,
        DataType elementType,
        List<DataType> references) {

    /** Prefix of every registry reference. */
    public static final String REF_PREFIX = "#/components/schemas/";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public DataType {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        if (schemaName != null && schemaName.isBlank()) {
            throw new IllegalArgumentException("schemaName must not be blank");
        }
        schema = schema.deepCopy();
        paramSchema = paramSchema != null ? paramSchema.deepCopy() : schema.deepCopy();
        references = references != null ? List.copyOf(references) : List.of();
    }

    // ── Factories ──

    /** A named type whose id is its schema name. */
    public static DataType named(String name, JsonNode schema, DataType... references) {
        return named(TypeId.of(name), name, schema, references);
    }

    /** A named type with an explicit identity. */
    public static DataType named(TypeId id, String name, JsonNode schema, DataType... references) {
        Objects.requireNonNull(name, "name must not be null");
        return new DataType(id, name, schema, null, null, List.of(references));
    }

    /** An inline type: its schema is copied at every use site. */
    public static DataType inline(TypeId id, JsonNode schema, DataType... references) {
        return new DataType(id, null, schema, null, null, List.of(references));
    }

    /** A list of {@code element}, encoded as a JSON array. */
    public static DataType listOf(DataType element) {
        Objects.requireNonNull(element, "element must not be null");
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "array");
        schema.set("items", element.schemaRef());
        ObjectNode paramSchema = NODES.objectNode();
        paramSchema.put("type", "array");
        paramSchema.set("items", element.paramSchema());
        return new DataType(TypeId.of("[" + element.id().value() + "]"), null, schema, paramSchema, element,
                List.of(element));
    }

    public static DataType string() {
        return primitive("string", "string");
    }

    public static DataType bool() {
        return primitive("boolean", "boolean");
    }

    public static DataType number() {
        return primitive("number", "number");
    }

    /** Signed 32-bit integer with its natural bounds. */
    public static DataType int32() {
        return new DataType(TypeId.of("int32"), null, NumericBounds.integer(32, true), null, null, List.of());
    }

    /** Signed 64-bit integer with its natural bounds. */
    public static DataType int64() {
        return new DataType(TypeId.of("int64"), null, NumericBounds.integer(64, true), null, null, List.of());
    }

    private static DataType primitive(String id, String type) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", type);
        return new DataType(TypeId.of(id), null, schema, null, null, List.of());
    }

    // ── Accessors ──

    public boolean isNamed() {
        return schemaName != null;
    }

    public boolean isList() {
        return elementType != null;
    }

    /**
     * Returns how this type is referenced from an operation or another schema: a {@code $ref} node
     * for named types, a copy of the schema for inline types.
     */
    public JsonNode schemaRef() {
        if (isNamed()) {
            ObjectNode ref = NODES.objectNode();
            ref.put("$ref", REF_PREFIX + schemaName);
            return ref;
        }
        return schema.deepCopy();
    }

    /** Returns a copy of this type with a dedicated parameter schema. */
    public DataType withParamSchema(JsonNode paramSchema) {
        return new DataType(id, schemaName, schema, paramSchema, elementType, references);
    }
}
