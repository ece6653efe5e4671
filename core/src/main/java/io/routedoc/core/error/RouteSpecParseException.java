package io.routedoc.core.error;

/** Thrown when a route description file has invalid syntax, unknown keys or unresolvable type names. */
public final class RouteSpecParseException extends RouteLoadException {

    private static final long serialVersionUID = 1L;

    public RouteSpecParseException(String message, String source) {
        super(message, source);
    }

    public RouteSpecParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
