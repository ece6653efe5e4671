package io.routedoc.core.engine;

import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.MediaTypeObject;
import io.routedoc.core.model.Qualifier;
import io.routedoc.core.model.ResponseObject;
import io.routedoc.core.model.TagDefinition;
import io.routedoc.core.schema.DataType;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Annotation helpers over a {@link Selection}: tagging, response augmentation and documentation
 * injection. Each returns a new document; the argument is never modified.
 */
public final class OperationAnnotations {

    private OperationAnnotations() {}

    /**
     * Adds the tags to every selected operation and their definitions to the document's
     * {@code tags} list.
     */
    public static ApiDocument applyTagsFor(Selection selection, Collection<TagDefinition> tags, ApiDocument document) {
        Objects.requireNonNull(tags, "tags must not be null");
        List<String> names = tags.stream().map(TagDefinition::name).collect(Collectors.toList());
        return OperationSelector.applyOver(selection, document, operation -> operation.addTags(names))
                .withTagDefinitions(tags);
    }

    /**
     * Adds or replaces the {@code status} response of every selected operation. A non-null
     * {@code type} becomes the response body and is registered in the document's schema registry
     * together with the types it references.
     */
    public static ApiDocument setResponseFor(
            Selection selection, int status, String description, DataType type, ApiDocument document) {
        Map<String, MediaTypeObject> content = type == null
                ? Map.of()
                : Map.of(Qualifier.JSON_UTF8, new MediaTypeObject(type.schemaRef()));
        ResponseObject response = new ResponseObject(description, content, Map.of());
        ApiDocument updated =
                OperationSelector.applyOver(selection, document, operation -> operation.withResponse(status, response));
        if (type == null) {
            return updated;
        }
        return updated.withSchemas(document.schemas().toBuilder().declare(type).build());
    }

    /**
     * Sets summary and description on every selected operation. A null argument leaves that field
     * as it is.
     */
    public static ApiDocument describeFor(Selection selection, String summary, String description, ApiDocument document) {
        return OperationSelector.applyOver(selection, document, operation -> {
            if (summary != null) {
                operation = operation.withSummary(summary);
            }
            return description != null ? operation.withDescription(description) : operation;
        });
    }
}
