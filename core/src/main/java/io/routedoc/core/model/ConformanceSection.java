package io.routedoc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.routedoc.core.schema.TypeId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of the conformance check for one payload type.
 *
 * @param type      the payload type
 * @param examples  encoded samples that were checked, at least one
 * @param violation the first violation found, or {@code null} if every sample conformed
 */
public record ConformanceSection(TypeId type, List<JsonNode> examples, ConformanceViolation violation) {

    public ConformanceSection {
        Objects.requireNonNull(type, "type must not be null");
        List<JsonNode> copies = new ArrayList<>();
        examples.forEach(example -> copies.add(example.deepCopy()));
        examples = List.copyOf(copies);
    }

    public boolean passed() {
        return violation == null;
    }
}
