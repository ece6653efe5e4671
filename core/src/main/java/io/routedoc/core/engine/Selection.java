package io.routedoc.core.engine;

import io.routedoc.core.model.OperationKey;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered set of operation identities picked out of a route tree by
 * {@link OperationSelector#select}. Order is the declaration order of the pattern; an identity
 * reached by several pattern leaves appears once, at its first position.
 *
 * @param keys distinct operation identities, in pattern order
 */
public record Selection(List<OperationKey> keys) {

    public Selection {
        keys = List.copyOf(new LinkedHashSet<>(keys));
    }

    public static Selection of(List<OperationKey> keys) {
        return new Selection(new ArrayList<>(keys));
    }

    public boolean contains(OperationKey key) {
        return keys.contains(key);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }
}
