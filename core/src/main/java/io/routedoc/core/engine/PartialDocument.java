package io.routedoc.core.engine;

import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.HttpMethod;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.PathTemplate;
import io.routedoc.core.model.SecurityScheme;
import io.routedoc.core.schema.SchemaRegistry;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulator of the compiler fold: the document built from one subtree. Confined to a single
 * fold step and never shared.
 */
final class PartialDocument {

    private final Map<PathTemplate, Map<HttpMethod, Operation>> paths = new LinkedHashMap<>();
    private final SchemaRegistry.Builder schemas = SchemaRegistry.builder();
    private final Map<String, SecurityScheme> securitySchemes = new LinkedHashMap<>();

    static PartialDocument empty() {
        return new PartialDocument();
    }

    static PartialDocument of(CompiledEndpoint endpoint) {
        PartialDocument partial = new PartialDocument();
        Map<HttpMethod, Operation> item = new EnumMap<>(HttpMethod.class);
        item.put(endpoint.key().method(), endpoint.operation());
        partial.paths.put(endpoint.path(), item);
        partial.schemas.merge(endpoint.schemas());
        partial.securitySchemes.putAll(endpoint.securitySchemes());
        return partial;
    }

    /**
     * Merges {@code right} into this document; this side is the left-hand operand.
     *
     * @return this document
     */
    PartialDocument absorb(PartialDocument right) {
        for (Map.Entry<PathTemplate, Map<HttpMethod, Operation>> entry : right.paths.entrySet()) {
            PathTemplate path = entry.getKey();
            Map<HttpMethod, Operation> mine = paths.get(path);
            if (mine == null) {
                paths.put(path, new EnumMap<>(entry.getValue()));
                continue;
            }
            PathTemplate existing = existingKey(path);
            if (!existing.sameCaptureNames(path)) {
                throw new StructuralConflictException(
                        "Path naming conflict: " + existing.render() + " is also declared as " + path.render()
                                + " with different capture names; every operation on the same path must use"
                                + " the same capture names, whatever its method",
                        new OperationKey(existing, entry.getValue().keySet().iterator().next()),
                        "path:" + path.render());
            }
            entry.getValue().forEach((method, operation) -> mine.merge(
                    method, operation, (left, rightOp) -> OperationMerger.merge(new OperationKey(existing, method), left, rightOp)));
        }
        schemas.merge(right.schemas.build());
        right.securitySchemes.forEach((name, scheme) -> {
            SecurityScheme previous = securitySchemes.putIfAbsent(name, scheme);
            if (previous != null && !previous.equals(scheme)) {
                throw new StructuralConflictException(
                        "Security scheme '" + name + "' is declared twice with different settings",
                        null,
                        "security:" + name);
            }
        });
        return this;
    }

    ApiDocument toDocument() {
        return ApiDocument.of(paths, schemas.build(), securitySchemes);
    }

    /** The key instance stored in {@link #paths}, which carries the first-declared capture names. */
    private PathTemplate existingKey(PathTemplate path) {
        for (PathTemplate candidate : paths.keySet()) {
            if (candidate.equals(path)) {
                return candidate;
            }
        }
        return path;
    }
}
