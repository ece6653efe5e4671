package io.routedoc.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.routedoc.core.schema.TypeId;
import java.util.Objects;

/**
 * A sample whose wire encoding broke its type's schema. Recorded in the report, never thrown.
 *
 * @param type       the payload type
 * @param sample     the offending encoded sample
 * @param constraint the violated schema keyword, e.g. {@code required}, {@code maximum},
 *                   {@code pattern}, or {@code encoding} when the encoder itself failed
 * @param location   path of the offending value inside {@code sample}, e.g. {@code $.age}
 * @param message    human-readable description
 */
public record ConformanceViolation(TypeId type, JsonNode sample, String constraint, String location, String message) {

    public ConformanceViolation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
        sample = sample != null ? sample.deepCopy() : null;
        location = location != null ? location : "";
    }
}
