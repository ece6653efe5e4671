package io.routedoc.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of {@link PathSegment}s forming an operation path.
 *
 * <p>
 * Equality is positional: static segments compare by literal, capture segments match any other
 * capture at the same position whatever its name. {@code /users/{id}} and {@code /users/{uid}} are
 * therefore the same path; use {@link #sameCaptureNames(PathTemplate)} to tell them apart.
 *
 * <p>
 * Immutable, thread-safe.
 */
public final class PathTemplate {

    private static final PathTemplate ROOT = new PathTemplate(List.of());

    private final List<PathSegment> segments;

    private PathTemplate(List<PathSegment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    /** The root path {@code "/"}. */
    public static PathTemplate root() {
        return ROOT;
    }

    public static PathTemplate of(List<PathSegment> segments) {
        return segments.isEmpty() ? ROOT : new PathTemplate(new ArrayList<>(segments));
    }

    /**
     * Parses a rendered path such as {@code "/users/{user_id}/posts"}. Empty segments are
     * skipped.
     */
    public static PathTemplate parse(String path) {
        Objects.requireNonNull(path, "path must not be null");
        List<PathSegment> segments = new ArrayList<>();
        for (String part : path.split("/")) {
            if (part.isEmpty()) {
                continue;
            }
            if (part.startsWith("{") && part.endsWith("}") && part.length() > 2) {
                segments.add(new PathSegment.Capture(part.substring(1, part.length() - 1)));
            } else {
                segments.add(new PathSegment.Static(part));
            }
        }
        return of(segments);
    }

    public List<PathSegment> segments() {
        return segments;
    }

    /** Returns a new template with {@code segment} appended. */
    public PathTemplate append(PathSegment segment) {
        List<PathSegment> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(Objects.requireNonNull(segment, "segment must not be null"));
        return new PathTemplate(extended);
    }

    /** Capture names in path order. */
    public List<String> captureNames() {
        List<String> names = new ArrayList<>();
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.Capture capture) {
                names.add(capture.name());
            }
        }
        return names;
    }

    /** Returns {@code true} if both templates use the same capture names at the same positions. */
    public boolean sameCaptureNames(PathTemplate other) {
        return captureNames().equals(other.captureNames());
    }

    /** OpenAPI path key, e.g. {@code "/"} or {@code "/users/{user_id}"}. */
    public String render() {
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            sb.append('/').append(segment.render());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathTemplate other) || other.segments.size() != segments.size()) {
            return false;
        }
        for (int i = 0; i < segments.size(); i++) {
            PathSegment mine = segments.get(i);
            PathSegment theirs = other.segments.get(i);
            if (mine instanceof PathSegment.Capture) {
                if (!(theirs instanceof PathSegment.Capture)) {
                    return false;
                }
            } else if (!mine.equals(theirs)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (PathSegment segment : segments) {
            hash = 31 * hash + (segment instanceof PathSegment.Capture ? 0 : segment.hashCode());
        }
        return hash;
    }

    @Override
    public String toString() {
        return render();
    }
}
