package io.routedoc.core.model;

/** Value of a parameter's {@code in} field. */
public enum ParameterLocation {
    PATH("path"),
    QUERY("query"),
    HEADER("header");

    private final String key;

    ParameterLocation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
