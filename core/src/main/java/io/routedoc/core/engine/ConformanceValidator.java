package io.routedoc.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.routedoc.core.error.CollaboratorUnavailableException;
import io.routedoc.core.error.EncoderUnavailableException;
import io.routedoc.core.error.GeneratorUnavailableException;
import io.routedoc.core.model.ConformanceReport;
import io.routedoc.core.model.ConformanceSection;
import io.routedoc.core.model.ConformanceViolation;
import io.routedoc.core.model.DeclaredResponse;
import io.routedoc.core.model.EndpointTemplate;
import io.routedoc.core.model.Qualifier;
import io.routedoc.core.model.RouteTree;
import io.routedoc.core.model.RoutedEndpoint;
import io.routedoc.core.schema.DataType;
import io.routedoc.core.schema.NamedSchema;
import io.routedoc.core.schema.SchemaRegistry;
import io.routedoc.core.schema.TypeId;
import io.routedoc.core.spi.PatternChecker;
import io.routedoc.core.spi.PayloadCodecs;
import io.routedoc.core.spi.SampleGenerator;
import io.routedoc.core.spi.WireEncoder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the wire encoding of every payload type reachable from a route tree conforms to
 * the schema the document advertises for it.
 *
 * <p>
 * For each distinct request-body or response type: draw samples from its generator, encode each,
 * validate the encoding against the type's schema (JSON Schema 2020-12, networknt). The first
 * failing sample ends that type's section; the remaining types are still checked. A generator or
 * encoder that throws, or an encoder that returns null, is recorded as a {@code generation} or
 * {@code encoding} violation of that type alone. Every section
 * records at least one example, so a passing report is auditable.
 *
 * <p>
 * Missing generators or encoders are detected up front and fail the whole run before any sample
 * is drawn.
 *
 * <p>
 * Not thread-safe when sharing the {@link Random}; create one validator per thread.
 */
public final class ConformanceValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ConformanceValidator.class);

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final String PATTERN_KEYWORD = "pattern";
    private static final String ENCODING_FAILURE = "encoding";
    private static final String GENERATION_FAILURE = "generation";

    private final PayloadCodecs codecs;
    private final Random random;

    public ConformanceValidator(PayloadCodecs codecs) {
        this(codecs, new Random());
    }

    public ConformanceValidator(PayloadCodecs codecs, Random random) {
        this.codecs = Objects.requireNonNull(codecs, "codecs must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /** Validates with the schema's own pattern rules. */
    public ConformanceReport validateAll(RouteTree tree, int samplesPerType) {
        return validateAll(tree, samplesPerType, Map.of());
    }

    /**
     * Validates every payload type of {@code tree}.
     *
     * @param samplesPerType  samples drawn per type, at least 1
     * @param patternCheckers per-type replacements for the validator's {@code pattern} handling
     * @throws CollaboratorUnavailableException if a reachable type has no generator or encoder
     */
    public ConformanceReport validateAll(
            RouteTree tree, int samplesPerType, Map<TypeId, PatternChecker> patternCheckers) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(patternCheckers, "patternCheckers must not be null");
        if (samplesPerType < 1) {
            throw new IllegalArgumentException("samplesPerType must be at least 1, got: " + samplesPerType);
        }

        List<DataType> types = payloadTypes(tree);
        Map<TypeId, SampleGenerator<?>> generators = new LinkedHashMap<>();
        Map<TypeId, WireEncoder<?>> encoders = new LinkedHashMap<>();
        for (DataType type : types) {
            generators.put(type.id(), codecs.generatorFor(type)
                    .orElseThrow(() -> new GeneratorUnavailableException(type.id())));
            encoders.put(type.id(), codecs.encoderFor(type)
                    .orElseThrow(() -> new EncoderUnavailableException(type.id())));
        }

        List<ConformanceSection> sections = new ArrayList<>(types.size());
        for (DataType type : types) {
            ConformanceSection section = validateType(
                    type,
                    generators.get(type.id()),
                    encoders.get(type.id()),
                    samplesPerType,
                    patternCheckers.get(type.id()));
            if (!section.passed()) {
                ConformanceViolation violation = section.violation();
                LOG.warn(
                        "conformance.failed type={} constraint={} location=\"{}\" message=\"{}\"",
                        type.id(),
                        violation.constraint(),
                        violation.location(),
                        violation.message());
            }
            sections.add(section);
        }
        ConformanceReport report = new ConformanceReport(sections);
        LOG.info(
                "conformance.completed types={} failed={} samples_per_type={}",
                sections.size(),
                report.failures().size(),
                samplesPerType);
        return report;
    }

    /**
     * Distinct request-body and response types of {@code tree}, deduplicated by identity, in the
     * order they are first reached.
     */
    public static List<DataType> payloadTypes(RouteTree tree) {
        Map<TypeId, DataType> types = new LinkedHashMap<>();
        for (RoutedEndpoint routed : tree.endpoints()) {
            for (Qualifier qualifier : routed.qualifiers()) {
                if (qualifier instanceof Qualifier.RequestBody body) {
                    types.putIfAbsent(body.type().id(), body.type());
                }
            }
            EndpointTemplate endpoint = routed.endpoint();
            if (endpoint.hasContent()) {
                types.putIfAbsent(endpoint.responseType().id(), endpoint.responseType());
            }
            for (DeclaredResponse declared : endpoint.declaredResponses().values()) {
                if (declared.type() != null) {
                    types.putIfAbsent(declared.type().id(), declared.type());
                }
            }
        }
        return new ArrayList<>(types.values());
    }

    private ConformanceSection validateType(
            DataType type,
            SampleGenerator<?> generator,
            WireEncoder<?> encoder,
            int samples,
            PatternChecker patternChecker) {
        JsonNode schemaDocument = schemaDocument(type);
        JsonSchema schema = SCHEMA_FACTORY.getSchema(schemaDocument);
        List<JsonNode> examples = new ArrayList<>();

        for (int i = 0; i < samples; i++) {
            Object value;
            try {
                value = generator.generate(random);
            } catch (RuntimeException e) {
                LOG.debug("conformance.generation_failed type={} error=\"{}\"", type.id(), e.getMessage(), e);
                examples.add(NullNode.getInstance());
                return new ConformanceSection(type.id(), examples, new ConformanceViolation(
                        type.id(), NullNode.getInstance(), GENERATION_FAILURE, "$", "Generator failed: " + e.getMessage()));
            }
            JsonNode encoded;
            try {
                encoded = PayloadCodecs.encode(encoder, value);
            } catch (RuntimeException e) {
                LOG.debug("conformance.encoding_failed type={} error=\"{}\"", type.id(), e.getMessage(), e);
                return encodingFailure(type, examples, value, "Encoder failed: " + e.getMessage());
            }
            if (encoded == null) {
                return encodingFailure(type, examples, value, "Encoder returned no value");
            }
            examples.add(encoded);

            Optional<ConformanceViolation> violation = check(type, schema, schemaDocument, encoded, patternChecker);
            if (violation.isPresent()) {
                return new ConformanceSection(type.id(), examples, violation.get());
            }
        }
        return new ConformanceSection(type.id(), examples, null);
    }

    private static ConformanceSection encodingFailure(
            DataType type, List<JsonNode> examples, Object value, String message) {
        TextNode raw = TextNode.valueOf(String.valueOf(value));
        examples.add(raw);
        return new ConformanceSection(
                type.id(), examples, new ConformanceViolation(type.id(), raw, ENCODING_FAILURE, "$", message));
    }

    private static Optional<ConformanceViolation> check(
            DataType type, JsonSchema schema, JsonNode schemaDocument, JsonNode encoded, PatternChecker patternChecker) {
        Set<ValidationMessage> messages = schema.validate(encoded);
        List<ValidationMessage> relevant = messages.stream()
                .filter(message -> patternChecker == null || !PATTERN_KEYWORD.equals(message.getType()))
                .collect(Collectors.toList());
        if (!relevant.isEmpty()) {
            ValidationMessage first = relevant.get(0);
            return Optional.of(new ConformanceViolation(
                    type.id(),
                    encoded,
                    first.getType(),
                    String.valueOf(first.getInstanceLocation()),
                    first.getMessage()));
        }
        if (patternChecker != null) {
            return new PatternConstraintWalker(schemaDocument, patternChecker)
                    .firstMismatch(encoded)
                    .map(mismatch -> new ConformanceViolation(
                            type.id(),
                            encoded,
                            PATTERN_KEYWORD,
                            mismatch.location(),
                            "'" + mismatch.value() + "' does not match pattern '" + mismatch.pattern() + "'"));
        }
        return Optional.empty();
    }

    /**
     * The type's schema reference at the root, plus a {@code components.schemas} section holding
     * every named schema it transitively references so that local {@code $ref}s resolve.
     */
    static JsonNode schemaDocument(DataType type) {
        JsonNode reference = type.schemaRef();
        ObjectNode document;
        if (reference.isObject()) {
            document = (ObjectNode) reference;
        } else {
            document = JsonNodeFactory.instance.objectNode();
            document.putArray("allOf").add(reference);
        }
        SchemaRegistry registry = SchemaRegistry.builder().declare(type).build();
        if (!registry.isEmpty()) {
            ObjectNode schemas = JsonNodeFactory.instance.objectNode();
            for (NamedSchema named : registry.entries().values()) {
                schemas.set(named.name(), named.schema().deepCopy());
            }
            document.putObject("components").set("schemas", schemas);
        }
        return document;
    }
}
