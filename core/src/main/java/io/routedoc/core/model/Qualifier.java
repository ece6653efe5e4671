package io.routedoc.core.model;

import io.routedoc.core.schema.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Something a {@link RouteTree.Sequential} node attaches to every endpoint beneath it: a path
 * segment, a parameter, a request body, documentation text or a security requirement.
 *
 * <p>
 * Implementations are a sealed hierarchy; all variants are known at compile time. Equality is
 * structural, which is what pattern embedding relies on.
 *
 * <p>
 * Immutable, thread-safe.
 */
public sealed interface Qualifier {

    /** Default content type of request and response bodies. */
    String JSON_UTF8 = "application/json;charset=utf-8";

    // ── Path ──

    /**
     * One or more literal path segments, e.g. {@code "users"} or {@code "api/v1"}.
     */
    record StaticSegment(String path) implements Qualifier {
        public StaticSegment {
            Objects.requireNonNull(path, "path must not be null");
            if (path.replace("/", "").isEmpty()) {
                throw new IllegalArgumentException("static path must contain at least one segment");
            }
        }

        /** The slash-separated parts of {@link #path()}. */
        public List<String> parts() {
            return List.of(path.replaceAll("^/+|/+$", "").split("/+"));
        }
    }

    /**
     * A single captured path segment.
     *
     * @param lenient if {@code true}, decoding cannot fail and no 404 response is inferred
     */
    record Capture(String name, DataType type, String description, boolean lenient) implements Qualifier {
        public Capture {
            requireName(name);
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** Captures all remaining path segments as a list. */
    record CaptureAll(String name, DataType type, String description) implements Qualifier {
        public CaptureAll {
            requireName(name);
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    // ── Query and headers ──

    /**
     * A single-valued query parameter.
     *
     * @param required whether the parameter must be present
     * @param lenient  if {@code true}, decoding cannot fail and no 400 response is inferred
     */
    record QueryParam(String name, DataType type, boolean required, boolean lenient, String description)
            implements Qualifier {
        public QueryParam {
            requireName(name);
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** A repeated query parameter, e.g. {@code ?tag=a&tag=b}. Never required. */
    record QueryParams(String name, DataType type, String description) implements Qualifier {
        public QueryParams {
            requireName(name);
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    /** A boolean query flag: present means true. */
    record QueryFlag(String name, String description) implements Qualifier {
        public QueryFlag {
            requireName(name);
        }
    }

    /** A request header. */
    record Header(String name, DataType type, boolean required, boolean lenient, String description)
            implements Qualifier {
        public Header {
            requireName(name);
            Objects.requireNonNull(type, "type must not be null");
        }
    }

    // ── Body ──

    /**
     * A request body accepted in each of {@code contentTypes}.
     *
     * @param lenient if {@code true}, decoding cannot fail and no 400 response is inferred
     */
    record RequestBody(DataType type, List<String> contentTypes, boolean lenient, String description)
            implements Qualifier {
        public RequestBody {
            Objects.requireNonNull(type, "type must not be null");
            contentTypes = contentTypes == null || contentTypes.isEmpty() ? List.of(JSON_UTF8) : List.copyOf(contentTypes);
        }
    }

    // ── Documentation ──

    /** Description text prepended to the description of every operation beneath. */
    record Description(String text) implements Qualifier {
        public Description {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /** Summary for every operation beneath that has none closer to it. */
    record Summary(String text) implements Qualifier {
        public Summary {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    // ── Security ──

    /** Requires the named security scheme on every operation beneath. */
    record Security(String schemeName, SecurityScheme scheme) implements Qualifier {
        public Security {
            requireName(schemeName);
            Objects.requireNonNull(scheme, "scheme must not be null");
        }
    }

    // ── Factories ──

    static Qualifier path(String path) {
        return new StaticSegment(path);
    }

    static Qualifier capture(String name, DataType type) {
        return new Capture(name, type, null, false);
    }

    static Qualifier query(String name, DataType type) {
        return new QueryParam(name, type, false, false, null);
    }

    static Qualifier requiredQuery(String name, DataType type) {
        return new QueryParam(name, type, true, false, null);
    }

    static Qualifier header(String name, DataType type) {
        return new Header(name, type, false, false, null);
    }

    static Qualifier body(DataType type) {
        return new RequestBody(type, List.of(JSON_UTF8), false, null);
    }

    static Qualifier description(String text) {
        return new Description(text);
    }

    static Qualifier summary(String text) {
        return new Summary(text);
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
