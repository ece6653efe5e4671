package io.routedoc.core.error;

import io.routedoc.core.model.OperationKey;

/**
 * Thrown when a route tree cannot be compiled into a consistent document, or when a pattern cannot
 * be embedded into its target tree. Always raised before any document is produced or updated.
 *
 * <p>
 * {@link #operation()} identifies the (path, method) identity involved, or is {@code null} when
 * the conflict is document-wide (e.g. two type identities claiming the same schema name).
 */
public final class StructuralConflictException extends RouteDocException {

    private static final long serialVersionUID = 1L;

    private final transient OperationKey operation;
    private final String qualifier;

    public StructuralConflictException(String message, OperationKey operation, String qualifier) {
        super(message, Phase.COMPILE);
        this.operation = operation;
        this.qualifier = qualifier;
    }

    /** The conflicting operation identity, or {@code null} for document-wide conflicts. */
    public OperationKey operation() {
        return operation;
    }

    /** The qualifier, parameter or entry name that conflicts (e.g. {@code "query:limit"}). */
    public String qualifier() {
        return qualifier;
    }
}
