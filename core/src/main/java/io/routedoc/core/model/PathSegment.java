package io.routedoc.core.model;

import java.util.Objects;

/**
 * One segment of a {@link PathTemplate}: either a literal or a named capture.
 *
 * <p>
 * Immutable, thread-safe.
 */
public sealed interface PathSegment {

    /** Rendered form inside an OpenAPI path key ({@code users} or {@code {user_id}}). */
    String render();

    /** A literal segment; compared by text. */
    record Static(String literal) implements PathSegment {
        public Static {
            Objects.requireNonNull(literal, "literal must not be null");
            if (literal.isEmpty() || literal.contains("/")) {
                throw new IllegalArgumentException("Static segment must be non-empty and slash-free: '" + literal + "'");
            }
        }

        @Override
        public String render() {
            return literal;
        }
    }

    /** A captured segment; matched by position, its name does not take part in path identity. */
    record Capture(String name) implements PathSegment {
        public Capture {
            Objects.requireNonNull(name, "name must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("capture name must not be blank");
            }
        }

        @Override
        public String render() {
            return "{" + name + "}";
        }
    }
}
