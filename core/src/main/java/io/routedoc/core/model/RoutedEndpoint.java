package io.routedoc.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One leaf of a route tree together with the qualifiers of its enclosing
 * {@link RouteTree.Sequential} nodes, outermost first.
 */
public record RoutedEndpoint(List<Qualifier> qualifiers, EndpointTemplate endpoint) {

    public RoutedEndpoint {
        qualifiers = List.copyOf(qualifiers);
        Objects.requireNonNull(endpoint, "endpoint must not be null");
    }
}
