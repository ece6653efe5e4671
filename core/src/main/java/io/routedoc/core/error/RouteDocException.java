package io.routedoc.core.error;

/**
 * Abstract base for all routedoc exceptions. Never thrown directly; use the concrete subclasses
 * grouped under {@link RouteLoadException}, {@link StructuralConflictException} and
 * {@link CollaboratorUnavailableException}.
 */
public abstract class RouteDocException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        COMPILE,
        VALIDATION
    }

    private final Phase phase;

    protected RouteDocException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected RouteDocException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
