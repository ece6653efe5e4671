package io.routedoc.core.error;

import io.routedoc.core.schema.TypeId;

/**
 * Abstract parent for configuration errors where a reachable payload type lacks a collaborator
 * needed for conformance validation. Raised before any sample is drawn.
 */
public abstract class CollaboratorUnavailableException extends RouteDocException {

    private static final long serialVersionUID = 1L;

    private final transient TypeId typeId;

    protected CollaboratorUnavailableException(String message, TypeId typeId) {
        super(message, Phase.VALIDATION);
        this.typeId = typeId;
    }

    /** The payload type that has no collaborator registered. */
    public TypeId typeId() {
        return typeId;
    }
}
