package io.routedoc.core.error;

/**
 * Abstract parent for errors raised while reading a route description. Carries an additional
 * {@code source} field identifying the file or resource that caused the error.
 */
public abstract class RouteLoadException extends RouteDocException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RouteLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected RouteLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
