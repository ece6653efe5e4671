package io.routedoc.core.error;

import io.routedoc.core.schema.TypeId;

/** Thrown when a reachable payload type has no sample generator registered. */
public final class GeneratorUnavailableException extends CollaboratorUnavailableException {

    private static final long serialVersionUID = 1L;

    public GeneratorUnavailableException(TypeId typeId) {
        super("No sample generator registered for type '" + typeId + "'", typeId);
    }
}
