package io.routedoc.core.spi;

import java.util.Random;

/**
 * Draws random values of one payload type for conformance checks.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface SampleGenerator<T> {

    /** Returns a fresh sample; all randomness must come from {@code random}. */
    T generate(Random random);
}
