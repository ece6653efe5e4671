package io.routedoc.core.model;

import io.routedoc.core.schema.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * The leaf of a route tree: one HTTP method with its success response, waiting for the path and
 * parameter qualifiers of its enclosing {@link RouteTree.Sequential} nodes.
 *
 * <p>
 * Use {@link #builder(HttpMethod)} or the verb shortcuts ({@link #get(DataType)},
 * {@link #post(DataType)}, ...). Immutable, thread-safe.
 *
 * @param method              the HTTP method
 * @param status              success status code (200 by default, 204 for no-content verbs)
 * @param contentTypes        response content types
 * @param responseType        success body type, or {@code null} for no content
 * @param responseDescription description of the success response ({@code ""} by default)
 * @param responseHeaders     success response headers by name
 * @param declaredResponses   extra responses by status code; override inferred ones
 * @param tags                operation tags
 * @param summary             operation summary, or null
 * @param description         operation description, or null
 * @param operationId         operation id, or null
 */
public record EndpointTemplate(
        HttpMethod method,
        int status,
        List<String> contentTypes,
        DataType responseType,
        String responseDescription,
        Map<String, DataType> responseHeaders,
        Map<Integer, DeclaredResponse> declaredResponses,
        Set<String> tags,
        String summary,
        String description,
        String operationId) {

    public EndpointTemplate {
        Objects.requireNonNull(method, "method must not be null");
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("Status code must be between 100 and 599, got: " + status);
        }
        contentTypes = contentTypes == null || contentTypes.isEmpty()
                ? List.of(Qualifier.JSON_UTF8)
                : List.copyOf(contentTypes);
        responseDescription = responseDescription != null ? responseDescription : "";
        responseHeaders = responseHeaders != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(responseHeaders))
                : Map.of();
        declaredResponses = declaredResponses != null
                ? Collections.unmodifiableMap(new TreeMap<>(declaredResponses))
                : Map.of();
        tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
    }

    public static EndpointTemplate get(DataType responseType) {
        return builder(HttpMethod.GET).responseType(responseType).build();
    }

    public static EndpointTemplate post(DataType responseType) {
        return builder(HttpMethod.POST).responseType(responseType).build();
    }

    public static EndpointTemplate put(DataType responseType) {
        return builder(HttpMethod.PUT).responseType(responseType).build();
    }

    public static EndpointTemplate delete(DataType responseType) {
        return builder(HttpMethod.DELETE).responseType(responseType).build();
    }

    /** A verb answering {@code 204 No Content}. */
    public static EndpointTemplate noContent(HttpMethod method) {
        return builder(method).noContent().build();
    }

    public static Builder builder(HttpMethod method) {
        return new Builder(method);
    }

    public boolean hasContent() {
        return responseType != null;
    }

    /** Builder for {@link EndpointTemplate}; every field except the method is optional. */
    public static final class Builder {

        private final HttpMethod method;
        private int status = 200;
        private final List<String> contentTypes = new ArrayList<>();
        private DataType responseType;
        private String responseDescription = "";
        private final Map<String, DataType> responseHeaders = new LinkedHashMap<>();
        private final Map<Integer, DeclaredResponse> declaredResponses = new TreeMap<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private String summary;
        private String description;
        private String operationId;

        private Builder(HttpMethod method) {
            this.method = Objects.requireNonNull(method, "method must not be null");
        }

        public Builder status(int status) {
            this.status = status;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentTypes.add(contentType);
            return this;
        }

        public Builder responseType(DataType responseType) {
            this.responseType = responseType;
            return this;
        }

        /** No response body; status becomes 204 unless set explicitly afterwards. */
        public Builder noContent() {
            this.responseType = null;
            this.status = 204;
            return this;
        }

        public Builder responseDescription(String responseDescription) {
            this.responseDescription = responseDescription;
            return this;
        }

        public Builder responseHeader(String name, DataType type) {
            this.responseHeaders.put(name, type);
            return this;
        }

        public Builder response(int status, String description, DataType type) {
            this.declaredResponses.put(status, new DeclaredResponse(description, type));
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder operationId(String operationId) {
            this.operationId = operationId;
            return this;
        }

        public EndpointTemplate build() {
            return new EndpointTemplate(
                    method,
                    status,
                    contentTypes,
                    responseType,
                    responseDescription,
                    responseHeaders,
                    declaredResponses,
                    tags,
                    summary,
                    description,
                    operationId);
        }
    }
}
