package io.routedoc.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of an API as nested combinators.
 *
 * <ul>
 * <li>{@link Sequential} prepends a {@link Qualifier} to every endpoint reachable in its
 * subtree.</li>
 * <li>{@link Alternative} unions the endpoints of both operands, left before right.</li>
 * <li>{@link Leaf} is a single endpoint awaiting the qualifiers of its ancestors.</li>
 * <li>{@link Empty} has no endpoints.</li>
 * </ul>
 *
 * <p>
 * Equality is structural. Thread-safe.
 */
public sealed interface RouteTree {

    record Sequential(Qualifier qualifier, RouteTree subtree) implements RouteTree {
        public Sequential {
            Objects.requireNonNull(qualifier, "qualifier must not be null");
            Objects.requireNonNull(subtree, "subtree must not be null");
        }
    }

    record Alternative(RouteTree left, RouteTree right) implements RouteTree {
        public Alternative {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Leaf(EndpointTemplate endpoint) implements RouteTree {
        public Leaf {
            Objects.requireNonNull(endpoint, "endpoint must not be null");
        }
    }

    record Empty() implements RouteTree {}

    // ── Builders ──

    static RouteTree empty() {
        return new Empty();
    }

    static RouteTree leaf(EndpointTemplate endpoint) {
        return new Leaf(endpoint);
    }

    /** {@code q1 :> q2 :> ... :> subtree}, first qualifier outermost. */
    static RouteTree prefix(List<Qualifier> qualifiers, RouteTree subtree) {
        RouteTree tree = subtree;
        for (int i = qualifiers.size() - 1; i >= 0; i--) {
            tree = new Sequential(qualifiers.get(i), tree);
        }
        return tree;
    }

    static RouteTree prefix(Qualifier qualifier, RouteTree subtree) {
        return new Sequential(qualifier, subtree);
    }

    /**
     * Right-nested alternative of {@code trees}: {@code alt(a, b, c)} is
     * {@code Alternative(a, Alternative(b, c))}. A single tree is returned unchanged; no trees
     * yields {@link Empty}.
     */
    static RouteTree alt(RouteTree... trees) {
        if (trees.length == 0) {
            return empty();
        }
        RouteTree tree = trees[trees.length - 1];
        for (int i = trees.length - 2; i >= 0; i--) {
            tree = new Alternative(trees[i], tree);
        }
        return tree;
    }

    /**
     * Flattens the tree into its endpoints in left-to-right declaration order, each with the
     * qualifiers of its ancestors (outermost first).
     */
    default List<RoutedEndpoint> endpoints() {
        List<RoutedEndpoint> out = new ArrayList<>();
        collect(this, new ArrayDeque<>(), out);
        return out;
    }

    private static void collect(RouteTree tree, Deque<Qualifier> stack, List<RoutedEndpoint> out) {
        if (tree instanceof Sequential sequential) {
            stack.addLast(sequential.qualifier());
            try {
                collect(sequential.subtree(), stack, out);
            } finally {
                stack.removeLast();
            }
        } else if (tree instanceof Alternative alternative) {
            collect(alternative.left(), stack, out);
            collect(alternative.right(), stack, out);
        } else if (tree instanceof Leaf leaf) {
            out.add(new RoutedEndpoint(new ArrayList<>(stack), leaf.endpoint()));
        }
    }
}
