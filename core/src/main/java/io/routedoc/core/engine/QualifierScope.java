package io.routedoc.core.engine;

import io.routedoc.core.model.Qualifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persistent stack of the qualifiers enclosing a point of the route tree, innermost on top.
 * Pushing returns a new scope, so sibling subtrees can never observe each other's qualifiers.
 */
final class QualifierScope {

    static final QualifierScope EMPTY = new QualifierScope(null, null);

    private final Qualifier head;
    private final QualifierScope outer;

    private QualifierScope(Qualifier head, QualifierScope outer) {
        this.head = head;
        this.outer = outer;
    }

    QualifierScope push(Qualifier qualifier) {
        return new QualifierScope(qualifier, this);
    }

    /** Qualifiers outermost first. */
    List<Qualifier> toList() {
        List<Qualifier> qualifiers = new ArrayList<>();
        for (QualifierScope scope = this; scope.head != null; scope = scope.outer) {
            qualifiers.add(scope.head);
        }
        Collections.reverse(qualifiers);
        return qualifiers;
    }
}
