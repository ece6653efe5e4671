package io.routedoc.core.error;

import io.routedoc.core.schema.TypeId;

/** Thrown when a reachable payload type has no wire encoder registered. */
public final class EncoderUnavailableException extends CollaboratorUnavailableException {

    private static final long serialVersionUID = 1L;

    public EncoderUnavailableException(TypeId typeId) {
        super("No wire encoder registered for type '" + typeId + "'", typeId);
    }
}
