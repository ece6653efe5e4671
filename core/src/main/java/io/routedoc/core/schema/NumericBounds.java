package io.routedoc.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.Map;

/**
 * Natural bit-width bounds for integer schemas.
 *
 * <p>
 * An integer schema without explicit {@code minimum}/{@code maximum} receives the bounds of its
 * encoding, e.g. a signed 64-bit integer gets {@code minimum = -9223372036854775808} and
 * {@code maximum = 9223372036854775807}. Existing OpenAPI consumers compare these values
 * exactly.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class NumericBounds {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /** OpenAPI integer formats and their signed bit widths. */
    private static final Map<String, Integer> SIGNED_FORMATS = Map.of("int32", 32, "int64", 64);

    private NumericBounds() {}

    /**
     * Builds an integer schema bounded to the given encoding width.
     *
     * @param bits   width in bits (8, 16, 32 or 64)
     * @param signed whether the encoding is two's-complement signed
     * @return a fresh {@code {"type":"integer","minimum":..,"maximum":..}} node
     */
    public static ObjectNode integer(int bits, boolean signed) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "integer");
        applyBounds(schema, bits, signed);
        return schema;
    }

    /** Lower bound of an integer encoding. */
    public static BigInteger minimum(int bits, boolean signed) {
        requireWidth(bits);
        return signed ? BigInteger.ONE.shiftLeft(bits - 1).negate() : BigInteger.ZERO;
    }

    /** Upper bound of an integer encoding. */
    public static BigInteger maximum(int bits, boolean signed) {
        requireWidth(bits);
        return signed
                ? BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    /**
     * Returns a copy of {@code schema} in which every integer schema carrying
     * {@code format: int32|int64} and lacking a bound receives the missing bound. Nested
     * {@code properties}, {@code items}, {@code additionalProperties} and composition keywords are
     * visited. The input node is never modified.
     */
    public static JsonNode inferBounds(JsonNode schema) {
        if (schema == null) {
            return null;
        }
        JsonNode copy = schema.deepCopy();
        visit(copy);
        return copy;
    }

    private static void visit(JsonNode node) {
        if (!(node instanceof ObjectNode object)) {
            return;
        }
        if ("integer".equals(object.path("type").asText(null)) && object.has("format")) {
            Integer bits = SIGNED_FORMATS.get(object.get("format").asText());
            if (bits != null) {
                if (!object.has("minimum")) {
                    object.set("minimum", numberNode(minimum(bits, true)));
                }
                if (!object.has("maximum")) {
                    object.set("maximum", numberNode(maximum(bits, true)));
                }
            }
        }
        JsonNode properties = object.get("properties");
        if (properties != null && properties.isObject()) {
            properties.forEach(NumericBounds::visit);
        }
        visit(object.get("items"));
        visit(object.get("additionalProperties"));
        for (String composite : new String[] {"allOf", "anyOf", "oneOf"}) {
            JsonNode members = object.get(composite);
            if (members != null && members.isArray()) {
                members.forEach(NumericBounds::visit);
            }
        }
    }

    private static void applyBounds(ObjectNode schema, int bits, boolean signed) {
        schema.set("minimum", numberNode(minimum(bits, signed)));
        schema.set("maximum", numberNode(maximum(bits, signed)));
    }

    private static JsonNode numberNode(BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return NODES.numberNode(value.longValue());
        }
        return NODES.numberNode(value);
    }

    private static void requireWidth(int bits) {
        if (bits != 8 && bits != 16 && bits != 32 && bits != 64) {
            throw new IllegalArgumentException("Unsupported integer width: " + bits);
        }
    }
}
