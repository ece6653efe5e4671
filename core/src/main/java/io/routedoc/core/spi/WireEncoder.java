package io.routedoc.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Encodes values of one payload type to their JSON wire form.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface WireEncoder<T> {

    JsonNode encode(T value);
}
