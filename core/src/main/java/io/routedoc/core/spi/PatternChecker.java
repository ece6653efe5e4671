package io.routedoc.core.spi;

/**
 * Decides whether a string satisfies a schema {@code pattern}. Supplied per type when the
 * pattern dialect of the schema differs from the validator's regular expressions.
 */
@FunctionalInterface
public interface PatternChecker {

    boolean matches(String pattern, String value);
}
