package io.routedoc.core.engine;

import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.RouteTree;
import io.routedoc.core.model.RoutedEndpoint;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link RouteTree} into an {@link ApiDocument}.
 *
 * <p>
 * A structural fold carrying the enclosing qualifiers:
 * <ul>
 * <li>{@code Sequential(q, t)} folds {@code t} with {@code q} pushed on the scope.</li>
 * <li>{@code Alternative(l, r)} folds both sides against the same scope and merges the results,
 * left before right. Right-hand responses win on colliding status codes.</li>
 * <li>{@code Leaf(e)} materializes {@code e} with every qualifier in scope, outermost first.</li>
 * </ul>
 *
 * <p>
 * Either a complete document is returned or a {@link StructuralConflictException} is thrown; no
 * partial result escapes. Thread-safe and stateless.
 */
public final class DocumentCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentCompiler.class);

    private DocumentCompiler() {}

    /**
     * Compiles {@code tree}.
     *
     * @throws StructuralConflictException if two declarations of the same operation disagree on
     *                                     parameters or body, or the schema registry cannot be
     *                                     built consistently
     */
    public static ApiDocument compile(RouteTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        long startNanos = System.nanoTime();
        ApiDocument document = fold(tree, QualifierScope.EMPTY).toDocument();
        LOG.debug(
                "document.compiled paths={} operations={} schemas={} duration_us={}",
                document.paths().size(),
                document.operationCount(),
                document.schemas().size(),
                (System.nanoTime() - startNanos) / 1_000);
        return document;
    }

    private static PartialDocument fold(RouteTree tree, QualifierScope scope) {
        if (tree instanceof RouteTree.Sequential sequential) {
            return fold(sequential.subtree(), scope.push(sequential.qualifier()));
        }
        if (tree instanceof RouteTree.Alternative alternative) {
            PartialDocument left = fold(alternative.left(), scope);
            PartialDocument right = fold(alternative.right(), scope);
            return left.absorb(right);
        }
        if (tree instanceof RouteTree.Leaf leaf) {
            return PartialDocument.of(EndpointBuilder.materialize(new RoutedEndpoint(scope.toList(), leaf.endpoint())));
        }
        return PartialDocument.empty();
    }
}
