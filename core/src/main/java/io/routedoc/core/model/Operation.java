package io.routedoc.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The compiled form of one (path, method) endpoint, after merging every tree position that
 * shares its identity.
 *
 * <p>
 * Immutable; the {@code with*} methods return modified copies.
 *
 * @param tags        tag names, in first-declaration order
 * @param summary     summary, or null
 * @param description description, or null
 * @param operationId operation id, or null
 * @param parameters  parameters in declaration order
 * @param requestBody request body, or null
 * @param responses   responses by status code, ascending
 * @param security    names of the security schemes required, each rendered as
 *                    {@code {"<name>": []}}
 */
public record Operation(
        List<String> tags,
        String summary,
        String description,
        String operationId,
        List<Parameter> parameters,
        RequestBodyObject requestBody,
        SortedMap<Integer, ResponseObject> responses,
        List<String> security) {

    public Operation {
        tags = tags != null ? List.copyOf(new LinkedHashSet<>(tags)) : List.of();
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        responses = responses != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(responses))
                : Collections.emptySortedMap();
        security = security != null ? List.copyOf(new LinkedHashSet<>(security)) : List.of();
    }

    public ResponseObject response(int status) {
        return responses.get(status);
    }

    public Operation withSummary(String summary) {
        return new Operation(tags, summary, description, operationId, parameters, requestBody, responses, security);
    }

    public Operation withDescription(String description) {
        return new Operation(tags, summary, description, operationId, parameters, requestBody, responses, security);
    }

    public Operation withOperationId(String operationId) {
        return new Operation(tags, summary, description, operationId, parameters, requestBody, responses, security);
    }

    /** Appends tags not yet present. */
    public Operation addTags(Iterable<String> more) {
        Set<String> merged = new LinkedHashSet<>(tags);
        more.forEach(merged::add);
        return new Operation(
                new ArrayList<>(merged), summary, description, operationId, parameters, requestBody, responses, security);
    }

    /** Adds or replaces the response for {@code status}. */
    public Operation withResponse(int status, ResponseObject response) {
        SortedMap<Integer, ResponseObject> updated = new TreeMap<>(responses);
        updated.put(status, response);
        return new Operation(tags, summary, description, operationId, parameters, requestBody, updated, security);
    }

    public Operation withResponses(Map<Integer, ResponseObject> responses) {
        return new Operation(
                tags, summary, description, operationId, parameters, requestBody, new TreeMap<>(responses), security);
    }
}
