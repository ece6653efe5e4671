package io.routedoc.core.model;

import io.routedoc.core.schema.SchemaRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled API specification: paths to operations plus the schema registry and global
 * metadata.
 *
 * <p>
 * Immutable. Every update ({@code with*}) returns a new document whose untouched operations are the
 * same instances as in this one; no document is ever changed in place.
 *
 * @param info            title, version and friends
 * @param servers         server URLs
 * @param paths           operations per path, in first-declaration order
 * @param schemas         named schemas referenced from the operations
 * @param securitySchemes security schemes by name
 * @param tags            document-level tag definitions
 */
public record ApiDocument(
        Info info,
        List<String> servers,
        Map<PathTemplate, Map<HttpMethod, Operation>> paths,
        SchemaRegistry schemas,
        Map<String, SecurityScheme> securitySchemes,
        List<TagDefinition> tags) {

    public ApiDocument {
        info = info != null ? info : Info.empty();
        servers = servers != null ? List.copyOf(servers) : List.of();
        Objects.requireNonNull(paths, "paths must not be null");
        Map<PathTemplate, Map<HttpMethod, Operation>> copy = new LinkedHashMap<>();
        paths.forEach((path, item) -> copy.put(path, freeze(item)));
        paths = Collections.unmodifiableMap(copy);
        schemas = schemas != null ? schemas : SchemaRegistry.empty();
        securitySchemes = securitySchemes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(securitySchemes))
                : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** A document with the given content and empty metadata. */
    public static ApiDocument of(
            Map<PathTemplate, Map<HttpMethod, Operation>> paths,
            SchemaRegistry schemas,
            Map<String, SecurityScheme> securitySchemes) {
        return new ApiDocument(Info.empty(), List.of(), paths, schemas, securitySchemes, List.of());
    }

    public Optional<Operation> operation(OperationKey key) {
        Map<HttpMethod, Operation> item = paths.get(key.path());
        return item == null ? Optional.empty() : Optional.ofNullable(item.get(key.method()));
    }

    /** Every operation identity, by path then method. */
    public List<OperationKey> operationKeys() {
        List<OperationKey> keys = new ArrayList<>();
        paths.forEach((path, item) -> item.keySet().forEach(method -> keys.add(new OperationKey(path, method))));
        return keys;
    }

    public int operationCount() {
        return paths.values().stream().mapToInt(Map::size).sum();
    }

    // ── Copy-on-write updates ──

    public ApiDocument withInfo(Info info) {
        return new ApiDocument(info, servers, paths, schemas, securitySchemes, tags);
    }

    public ApiDocument withServers(List<String> servers) {
        return new ApiDocument(info, servers, paths, schemas, securitySchemes, tags);
    }

    public ApiDocument withSchemas(SchemaRegistry schemas) {
        return new ApiDocument(info, servers, paths, schemas, securitySchemes, tags);
    }

    /**
     * Adds tag definitions. A definition whose name already exists replaces the old one in
     * place.
     */
    public ApiDocument withTagDefinitions(Collection<TagDefinition> definitions) {
        Map<String, TagDefinition> merged = new LinkedHashMap<>();
        tags.forEach(tag -> merged.put(tag.name(), tag));
        definitions.forEach(tag -> merged.put(tag.name(), tag));
        return new ApiDocument(info, servers, paths, schemas, securitySchemes, new ArrayList<>(merged.values()));
    }

    /**
     * Replaces the given operations; every other operation is carried over unchanged.
     *
     * @throws IllegalArgumentException if a key names an operation this document does not have
     */
    public ApiDocument withOperations(Map<OperationKey, Operation> replacements) {
        Map<PathTemplate, Map<HttpMethod, Operation>> updated = new LinkedHashMap<>(paths);
        replacements.forEach((key, operation) -> {
            Map<HttpMethod, Operation> item = updated.get(key.path());
            if (item == null || !item.containsKey(key.method())) {
                throw new IllegalArgumentException("Document has no operation " + key);
            }
            Map<HttpMethod, Operation> replaced = new EnumMap<>(item);
            replaced.put(key.method(), Objects.requireNonNull(operation, "operation must not be null"));
            updated.put(key.path(), replaced);
        });
        return new ApiDocument(info, servers, updated, schemas, securitySchemes, tags);
    }

    private static Map<HttpMethod, Operation> freeze(Map<HttpMethod, Operation> item) {
        if (item.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(item));
    }
}
