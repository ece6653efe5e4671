package io.routedoc.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.model.DeclaredResponse;
import io.routedoc.core.model.EndpointTemplate;
import io.routedoc.core.model.HeaderObject;
import io.routedoc.core.model.MediaTypeObject;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.Parameter;
import io.routedoc.core.model.ParameterLocation;
import io.routedoc.core.model.PathSegment;
import io.routedoc.core.model.PathTemplate;
import io.routedoc.core.model.Qualifier;
import io.routedoc.core.model.RequestBodyObject;
import io.routedoc.core.model.ResponseObject;
import io.routedoc.core.model.RoutedEndpoint;
import io.routedoc.core.model.SecurityScheme;
import io.routedoc.core.schema.DataType;
import io.routedoc.core.schema.SchemaRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Materializes one {@link RoutedEndpoint} into an {@link Operation} by applying its qualifiers
 * outermost first, then inferring error responses.
 *
 * <p>
 * Inferred responses: a 400 naming every required parameter or body whose decoding can fail, and a
 * 404 naming every path capture whose decoding can fail. An explicitly declared response with the
 * same status code replaces the inferred one.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class EndpointBuilder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private EndpointBuilder() {}

    /** Computes only the identity an endpoint compiles to. */
    static OperationKey keyOf(RoutedEndpoint endpoint) {
        return new OperationKey(pathOf(endpoint.qualifiers()), endpoint.endpoint().method());
    }

    static CompiledEndpoint materialize(RoutedEndpoint routed) {
        EndpointTemplate template = routed.endpoint();
        PathTemplate path = pathOf(routed.qualifiers());
        OperationKey key = new OperationKey(path, template.method());

        Map<String, Parameter> parameters = new LinkedHashMap<>();
        RequestBodyObject body = null;
        List<String> badRequest = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        String description = null;
        String summary = null;
        Set<String> security = new LinkedHashSet<>();
        Map<String, SecurityScheme> schemes = new LinkedHashMap<>();
        SchemaRegistry.Builder schemas = SchemaRegistry.builder();

        for (Qualifier qualifier : routed.qualifiers()) {
            if (qualifier instanceof Qualifier.Capture capture) {
                addParameter(key, parameters, new Parameter(
                        capture.name(), ParameterLocation.PATH, true, capture.type().paramSchema(),
                        capture.description(), false));
                schemas.declareReferences(capture.type());
                if (!capture.lenient()) {
                    notFound.add(capture.name());
                }
            } else if (qualifier instanceof Qualifier.CaptureAll captureAll) {
                addParameter(key, parameters, new Parameter(
                        captureAll.name(), ParameterLocation.PATH, true, arrayOf(captureAll.type().paramSchema()),
                        captureAll.description(), false));
                schemas.declareReferences(captureAll.type());
                notFound.add(captureAll.name());
            } else if (qualifier instanceof Qualifier.QueryParam query) {
                addParameter(key, parameters, new Parameter(
                        query.name(), ParameterLocation.QUERY, query.required(), query.type().paramSchema(),
                        query.description(), false));
                schemas.declareReferences(query.type());
                if (query.required() && !query.lenient()) {
                    badRequest.add(query.name());
                }
            } else if (qualifier instanceof Qualifier.QueryParams queries) {
                addParameter(key, parameters, new Parameter(
                        queries.name(), ParameterLocation.QUERY, false, arrayOf(queries.type().paramSchema()),
                        queries.description(), false));
                schemas.declareReferences(queries.type());
            } else if (qualifier instanceof Qualifier.QueryFlag flag) {
                ObjectNode schema = NODES.objectNode().put("type", "boolean");
                addParameter(key, parameters, new Parameter(
                        flag.name(), ParameterLocation.QUERY, false, schema, flag.description(), true));
            } else if (qualifier instanceof Qualifier.Header header) {
                addParameter(key, parameters, new Parameter(
                        header.name(), ParameterLocation.HEADER, header.required(), header.type().paramSchema(),
                        header.description(), false));
                schemas.declareReferences(header.type());
                if (header.required() && !header.lenient()) {
                    badRequest.add(header.name());
                }
            } else if (qualifier instanceof Qualifier.RequestBody requestBody) {
                if (body != null) {
                    throw new StructuralConflictException(
                            "Endpoint " + key + " declares more than one request body", key, "body");
                }
                body = new RequestBodyObject(
                        requestBody.description(), content(requestBody.contentTypes(), requestBody.type()), false);
                schemas.declare(requestBody.type());
                if (!requestBody.lenient()) {
                    badRequest.add("body");
                }
            } else if (qualifier instanceof Qualifier.Description text) {
                description = appendDescription(description, text.text());
            } else if (qualifier instanceof Qualifier.Summary text) {
                summary = text.text();
            } else if (qualifier instanceof Qualifier.Security required) {
                SecurityScheme previous = schemes.putIfAbsent(required.schemeName(), required.scheme());
                if (previous != null && !previous.equals(required.scheme())) {
                    throw new StructuralConflictException(
                            "Security scheme '" + required.schemeName() + "' is declared twice with different settings",
                            key,
                            "security:" + required.schemeName());
                }
                security.add(required.schemeName());
            }
            // StaticSegment only shapes the path, see pathOf
        }

        if (template.description() != null) {
            description = appendDescription(description, template.description());
        }
        if (template.summary() != null) {
            summary = template.summary();
        }

        Map<Integer, ResponseObject> responses = new TreeMap<>();
        Map<String, HeaderObject> headers = new LinkedHashMap<>();
        template.responseHeaders().forEach((name, type) -> {
            headers.put(name, new HeaderObject(type.paramSchema(), null));
            schemas.declareReferences(type);
        });
        Map<String, MediaTypeObject> successContent = Map.of();
        if (template.hasContent()) {
            successContent = content(template.contentTypes(), template.responseType());
            schemas.declare(template.responseType());
        }
        responses.put(template.status(), new ResponseObject(template.responseDescription(), successContent, headers));

        if (!badRequest.isEmpty()) {
            responses.putIfAbsent(400, ResponseObject.described("Invalid " + quoteAll(badRequest)));
        }
        if (!notFound.isEmpty()) {
            responses.putIfAbsent(404, ResponseObject.described(quoteAll(notFound) + " not found"));
        }
        for (Map.Entry<Integer, DeclaredResponse> declared : template.declaredResponses().entrySet()) {
            DeclaredResponse response = declared.getValue();
            Map<String, MediaTypeObject> declaredContent = Map.of();
            if (response.type() != null) {
                declaredContent = content(template.contentTypes(), response.type());
                schemas.declare(response.type());
            }
            responses.put(declared.getKey(), new ResponseObject(response.description(), declaredContent, Map.of()));
        }

        Operation operation = new Operation(
                new ArrayList<>(template.tags()),
                summary,
                description,
                template.operationId(),
                new ArrayList<>(parameters.values()),
                body,
                new TreeMap<>(responses),
                new ArrayList<>(security));
        return new CompiledEndpoint(key, path, operation, schemas.build(), schemes);
    }

    private static PathTemplate pathOf(List<Qualifier> qualifiers) {
        PathTemplate path = PathTemplate.root();
        for (Qualifier qualifier : qualifiers) {
            if (qualifier instanceof Qualifier.StaticSegment segment) {
                for (String part : segment.parts()) {
                    path = path.append(new PathSegment.Static(part));
                }
            } else if (qualifier instanceof Qualifier.Capture capture) {
                path = path.append(new PathSegment.Capture(capture.name()));
            } else if (qualifier instanceof Qualifier.CaptureAll captureAll) {
                path = path.append(new PathSegment.Capture(captureAll.name()));
            }
        }
        return path;
    }

    private static void addParameter(OperationKey key, Map<String, Parameter> parameters, Parameter parameter) {
        if (parameters.putIfAbsent(parameter.key(), parameter) != null) {
            throw new StructuralConflictException(
                    "Endpoint " + key + " declares parameter '" + parameter.key() + "' more than once",
                    key,
                    parameter.key());
        }
    }

    private static Map<String, MediaTypeObject> content(List<String> contentTypes, DataType type) {
        Map<String, MediaTypeObject> content = new LinkedHashMap<>();
        for (String contentType : contentTypes) {
            content.put(contentType, new MediaTypeObject(type.schemaRef()));
        }
        return content;
    }

    private static JsonNode arrayOf(JsonNode items) {
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "array");
        schema.set("items", items.deepCopy());
        return schema;
    }

    private static String appendDescription(String outer, String inner) {
        return outer == null ? inner : outer + "\n\n" + inner;
    }

    private static String quoteAll(List<String> names) {
        return names.stream().map(name -> "`" + name + "`").collect(Collectors.joining(" or "));
    }
}
