package io.routedoc.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.routedoc.core.spi.PatternChecker;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Re-checks every {@code pattern} constraint a value is subject to with a caller-supplied
 * {@link PatternChecker}. Follows local {@code $ref}s, {@code properties},
 * {@code additionalProperties}, {@code items} and {@code allOf}; other combinators are left to the
 * schema validator.
 */
final class PatternConstraintWalker {

    /** Guards against self-referencing schemas that would otherwise recurse forever. */
    private static final int MAX_REF_DEPTH = 64;

    /**
     * A string that failed its pattern.
     *
     * @param location path of the string inside the checked value, e.g. {@code $.tags[0]}
     * @param pattern  the pattern from the schema
     * @param value    the offending string
     */
    record Mismatch(String location, String pattern, String value) {}

    private final JsonNode root;
    private final PatternChecker checker;

    PatternConstraintWalker(JsonNode root, PatternChecker checker) {
        this.root = root;
        this.checker = checker;
    }

    /** Returns the first mismatch found in {@code value}, checked against the root schema. */
    Optional<Mismatch> firstMismatch(JsonNode value) {
        return walk(root, value, "$", 0);
    }

    private Optional<Mismatch> walk(JsonNode schema, JsonNode value, String location, int refDepth) {
        if (schema == null || !schema.isObject() || value == null) {
            return Optional.empty();
        }
        JsonNode ref = schema.get("$ref");
        if (ref != null && ref.isTextual() && ref.asText().startsWith("#") && refDepth < MAX_REF_DEPTH) {
            Optional<Mismatch> viaRef = walk(root.at(ref.asText().substring(1)), value, location, refDepth + 1);
            if (viaRef.isPresent()) {
                return viaRef;
            }
        }

        JsonNode pattern = schema.get("pattern");
        if (pattern != null && pattern.isTextual() && value.isTextual()
                && !checker.matches(pattern.asText(), value.asText())) {
            return Optional.of(new Mismatch(location, pattern.asText(), value.asText()));
        }

        JsonNode allOf = schema.get("allOf");
        if (allOf != null && allOf.isArray()) {
            for (JsonNode member : allOf) {
                Optional<Mismatch> found = walk(member, value, location, refDepth);
                if (found.isPresent()) {
                    return found;
                }
            }
        }

        if (value.isObject()) {
            JsonNode properties = schema.path("properties");
            JsonNode additional = schema.get("additionalProperties");
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode fieldSchema = properties.has(field.getKey()) ? properties.get(field.getKey()) : additional;
                Optional<Mismatch> found =
                        walk(fieldSchema, field.getValue(), location + "." + field.getKey(), refDepth);
                if (found.isPresent()) {
                    return found;
                }
            }
        } else if (value.isArray()) {
            JsonNode items = schema.get("items");
            for (int i = 0; i < value.size(); i++) {
                Optional<Mismatch> found = walk(items, value.get(i), location + "[" + i + "]", refDepth);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }
}
