package io.routedoc.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.routedoc.core.schema.DataType;
import io.routedoc.core.schema.TypeId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup of sample generators and wire encoders by {@link TypeId}.
 *
 * <p>
 * List types ({@link DataType#isList()}) need no registration of their own: when the element type
 * has a generator (encoder), the list gets a derived one producing between 0 and
 * {@value #MAX_DERIVED_LIST_SIZE} elements (encoding to a JSON array). An explicit registration
 * for the list identity takes precedence.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class PayloadCodecs {

    /** Upper bound on the size of lists drawn by derived generators. */
    public static final int MAX_DERIVED_LIST_SIZE = 5;

    private static final PayloadCodecs EMPTY = new PayloadCodecs(Map.of(), Map.of());

    private final Map<TypeId, SampleGenerator<?>> generators;
    private final Map<TypeId, WireEncoder<?>> encoders;

    private PayloadCodecs(Map<TypeId, SampleGenerator<?>> generators, Map<TypeId, WireEncoder<?>> encoders) {
        this.generators = Collections.unmodifiableMap(new HashMap<>(generators));
        this.encoders = Collections.unmodifiableMap(new HashMap<>(encoders));
    }

    public static PayloadCodecs empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the generator for {@code type}, deriving one for list types. */
    public Optional<SampleGenerator<?>> generatorFor(DataType type) {
        SampleGenerator<?> registered = generators.get(type.id());
        if (registered != null) {
            return Optional.of(registered);
        }
        if (!type.isList()) {
            return Optional.empty();
        }
        return generatorFor(type.elementType()).map(PayloadCodecs::listGenerator);
    }

    /** Returns the encoder for {@code type}, deriving one for list types. */
    public Optional<WireEncoder<?>> encoderFor(DataType type) {
        WireEncoder<?> registered = encoders.get(type.id());
        if (registered != null) {
            return Optional.of(registered);
        }
        if (!type.isList()) {
            return Optional.empty();
        }
        return encoderFor(type.elementType()).map(PayloadCodecs::listEncoder);
    }

    /**
     * Encodes {@code value} with {@code encoder}. The caller guarantees that {@code value} was
     * produced by the generator registered for the same type.
     */
    @SuppressWarnings("unchecked")
    public static JsonNode encode(WireEncoder<?> encoder, Object value) {
        return ((WireEncoder<Object>) encoder).encode(value);
    }

    private static SampleGenerator<?> listGenerator(SampleGenerator<?> element) {
        return random -> {
            int size = random.nextInt(MAX_DERIVED_LIST_SIZE + 1);
            List<Object> values = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                values.add(element.generate(random));
            }
            return values;
        };
    }

    private static WireEncoder<?> listEncoder(WireEncoder<?> element) {
        return (WireEncoder<List<?>>) values -> {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for (Object value : values) {
                array.add(encode(element, value));
            }
            return array;
        };
    }

    /** Builder for {@link PayloadCodecs}. Later registrations replace earlier ones. */
    public static final class Builder {

        private final Map<TypeId, SampleGenerator<?>> generators = new HashMap<>();
        private final Map<TypeId, WireEncoder<?>> encoders = new HashMap<>();

        private Builder() {}

        public <T> Builder register(DataType type, SampleGenerator<T> generator, WireEncoder<? super T> encoder) {
            return registerGenerator(type.id(), generator).registerEncoder(type.id(), encoder);
        }

        public Builder registerGenerator(TypeId id, SampleGenerator<?> generator) {
            generators.put(Objects.requireNonNull(id, "id must not be null"),
                    Objects.requireNonNull(generator, "generator must not be null"));
            return this;
        }

        public Builder registerEncoder(TypeId id, WireEncoder<?> encoder) {
            encoders.put(Objects.requireNonNull(id, "id must not be null"),
                    Objects.requireNonNull(encoder, "encoder must not be null"));
            return this;
        }

        public PayloadCodecs build() {
            return new PayloadCodecs(generators, encoders);
        }
    }
}
