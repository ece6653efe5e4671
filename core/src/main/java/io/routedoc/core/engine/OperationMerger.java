package io.routedoc.core.engine;

import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.Parameter;
import io.routedoc.core.model.ResponseObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges two operations that share an {@link OperationKey}.
 *
 * <ul>
 * <li>Responses are unioned; on a colliding status code the right-hand response wins and the
 * override is logged.</li>
 * <li>Tags and security requirements are unioned, left first.</li>
 * <li>Parameter sets must agree on names, locations, schemas and required flags, and the request
 * bodies must be equal. Any difference is a {@link StructuralConflictException}. A parameter's
 * description takes the right-hand value if present; an empty value is allowed if either side
 * allows it.</li>
 * <li>Summary, description and operation id: right-hand value if present, else left.</li>
 * </ul>
 *
 * <p>
 * Thread-safe and stateless.
 */
final class OperationMerger {

    private static final Logger LOG = LoggerFactory.getLogger(OperationMerger.class);

    private OperationMerger() {}

    static Operation merge(OperationKey key, Operation left, Operation right) {
        List<Parameter> parameters = mergeParameters(key, left.parameters(), right.parameters());

        if (!Objects.equals(left.requestBody(), right.requestBody())) {
            throw new StructuralConflictException(
                    "Conflicting request bodies for " + key + ": every declaration of the same operation "
                            + "must accept the same body",
                    key,
                    "body");
        }

        SortedMap<Integer, ResponseObject> responses = new TreeMap<>(left.responses());
        right.responses().forEach((status, response) -> {
            ResponseObject previous = responses.put(status, response);
            if (previous != null && !previous.equals(response)) {
                LOG.info("document.merge.override operation=\"{}\" status={} winner=right", key, status);
            }
        });

        List<String> tags = new ArrayList<>(left.tags());
        tags.addAll(right.tags());
        List<String> security = new ArrayList<>(left.security());
        security.addAll(right.security());

        return new Operation(
                tags,
                right.summary() != null ? right.summary() : left.summary(),
                right.description() != null ? right.description() : left.description(),
                right.operationId() != null ? right.operationId() : left.operationId(),
                parameters,
                left.requestBody(),
                responses,
                security);
    }

    private static List<Parameter> mergeParameters(OperationKey key, List<Parameter> left, List<Parameter> right) {
        Map<String, Parameter> rightByKey = new LinkedHashMap<>();
        right.forEach(parameter -> rightByKey.put(parameter.key(), parameter));

        List<Parameter> merged = new ArrayList<>(left.size());
        for (Parameter mine : left) {
            Parameter theirs = rightByKey.remove(mine.key());
            if (theirs == null) {
                throw conflict(key, mine.key(), "is declared by only one of the merged endpoints");
            }
            if (mine.required() != theirs.required()) {
                throw conflict(key, mine.key(), "is declared both required and optional");
            }
            if (!mine.schema().equals(theirs.schema())) {
                throw conflict(key, mine.key(), "is declared with different schemas");
            }
            merged.add(new Parameter(
                    mine.name(),
                    mine.in(),
                    mine.required(),
                    mine.schema(),
                    theirs.description() != null ? theirs.description() : mine.description(),
                    mine.allowEmptyValue() || theirs.allowEmptyValue()));
        }
        if (!rightByKey.isEmpty()) {
            throw conflict(key, rightByKey.keySet().iterator().next(), "is declared by only one of the merged endpoints");
        }
        return merged;
    }

    private static StructuralConflictException conflict(OperationKey key, String parameter, String reason) {
        return new StructuralConflictException(
                "Conflicting parameter declarations for " + key + ": '" + parameter + "' " + reason, key, parameter);
    }
}
