package io.routedoc.core.engine;

import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.RouteTree;
import io.routedoc.core.model.RoutedEndpoint;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks a subset of a compiled document's operations by describing them with a smaller route
 * tree, the <em>pattern</em>, and applies a transformation to exactly that subset.
 *
 * <p>
 * A pattern is embeddable in a tree when every endpoint it describes (its qualifier chain plus
 * its leaf template) is also described by the tree. Embeddability is checked before anything is
 * matched; a pattern that fails it is rejected outright, never matched partially.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class OperationSelector {

    private static final Logger LOG = LoggerFactory.getLogger(OperationSelector.class);

    private OperationSelector() {}

    /**
     * Returns the identities the leaves of {@code pattern} compile to, in pattern order.
     *
     * @throws StructuralConflictException if {@code pattern} describes an endpoint that
     *                                     {@code tree} does not
     */
    public static Selection select(RouteTree pattern, RouteTree tree) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(tree, "tree must not be null");

        Set<RoutedEndpoint> available = new HashSet<>(tree.endpoints());
        List<RoutedEndpoint> wanted = pattern.endpoints();
        for (RoutedEndpoint endpoint : wanted) {
            if (!available.contains(endpoint)) {
                OperationKey key = EndpointBuilder.keyOf(endpoint);
                throw new StructuralConflictException(
                        "Pattern endpoint " + key + " is not embeddable in the target route tree", key, "pattern");
            }
        }

        List<OperationKey> keys = new ArrayList<>(wanted.size());
        for (RoutedEndpoint endpoint : wanted) {
            keys.add(EndpointBuilder.keyOf(endpoint));
        }
        Selection selection = Selection.of(keys);
        if (selection.size() < keys.size()) {
            LOG.info(
                    "selection.collapsed pattern_leaves={} operations={}", keys.size(), selection.size());
        }
        LOG.debug("selection.resolved operations={}", selection.keys());
        return selection;
    }

    /**
     * Applies {@code transform} once to every selected operation of {@code document}; every
     * other operation is returned unchanged.
     *
     * @throws StructuralConflictException if the selection names an operation that
     *                                     {@code document} does not contain
     */
    public static ApiDocument applyOver(
            Selection selection, ApiDocument document, UnaryOperator<Operation> transform) {
        Objects.requireNonNull(selection, "selection must not be null");
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(transform, "transform must not be null");

        Map<OperationKey, Operation> replacements = new LinkedHashMap<>();
        for (OperationKey key : selection.keys()) {
            Operation current = document.operation(key).orElseThrow(() -> new StructuralConflictException(
                    "Selected operation " + key + " is not present in the document", key, "selection"));
            replacements.put(key, transform.apply(current));
        }
        return document.withOperations(replacements);
    }

    /** Shorthand for {@code applyOver(select(pattern, tree), document, transform)}. */
    public static ApiDocument applyOver(
            RouteTree pattern, RouteTree tree, ApiDocument document, UnaryOperator<Operation> transform) {
        return applyOver(select(pattern, tree), document, transform);
    }
}
