package io.routedoc.core.spec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.HeaderObject;
import io.routedoc.core.model.HttpMethod;
import io.routedoc.core.model.Info;
import io.routedoc.core.model.MediaTypeObject;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.Parameter;
import io.routedoc.core.model.PathTemplate;
import io.routedoc.core.model.RequestBodyObject;
import io.routedoc.core.model.ResponseObject;
import io.routedoc.core.model.SecurityScheme;
import io.routedoc.core.model.TagDefinition;
import io.routedoc.core.schema.NamedSchema;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders an {@link ApiDocument} as an OpenAPI 3.0 JSON tree.
 *
 * <p>
 * Empty optional sections are omitted rather than rendered empty: no {@code parameters},
 * {@code tags} or {@code security} key on an operation that has none, no {@code components} when
 * there are neither schemas nor security schemes. {@code required} appears only when true. Every
 * response carries a {@code description}, {@code ""} if nothing else was given.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class OpenApiWriter {

    /** The OpenAPI version written to every document. */
    public static final String OPENAPI_VERSION = "3.0.0";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OpenApiWriter() {}

    public static ObjectNode write(ApiDocument document) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("openapi", OPENAPI_VERSION);
        root.set("info", info(document.info()));
        if (!document.servers().isEmpty()) {
            ArrayNode servers = root.putArray("servers");
            document.servers().forEach(url -> servers.addObject().put("url", url));
        }

        ObjectNode paths = root.putObject("paths");
        for (Map.Entry<PathTemplate, Map<HttpMethod, Operation>> item : document.paths().entrySet()) {
            ObjectNode pathItem = paths.putObject(item.getKey().render());
            item.getValue().forEach((method, operation) -> pathItem.set(method.key(), operation(operation)));
        }

        if (!document.schemas().isEmpty() || !document.securitySchemes().isEmpty()) {
            ObjectNode components = root.putObject("components");
            if (!document.schemas().isEmpty()) {
                ObjectNode schemas = components.putObject("schemas");
                for (NamedSchema named : document.schemas().entries().values()) {
                    schemas.set(named.name(), named.schema().deepCopy());
                }
            }
            if (!document.securitySchemes().isEmpty()) {
                ObjectNode schemes = components.putObject("securitySchemes");
                document.securitySchemes().forEach((name, scheme) -> schemes.set(name, securityScheme(scheme)));
            }
        }

        if (!document.tags().isEmpty()) {
            ArrayNode tags = root.putArray("tags");
            for (TagDefinition tag : document.tags()) {
                ObjectNode node = tags.addObject().put("name", tag.name());
                putIfPresent(node, "description", tag.description());
            }
        }
        return root;
    }

    /** Serializes {@link #write(ApiDocument)} to a JSON string. */
    public static String toJson(ApiDocument document, boolean pretty) {
        try {
            JsonNode tree = write(document);
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize OpenAPI document", e);
        }
    }

    private static ObjectNode info(Info info) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("title", info.title());
        node.put("version", info.version());
        putIfPresent(node, "description", info.description());
        if (info.license() != null) {
            node.putObject("license").put("name", info.license());
        }
        return node;
    }

    private static ObjectNode operation(Operation operation) {
        ObjectNode node = MAPPER.createObjectNode();
        if (!operation.tags().isEmpty()) {
            ArrayNode tags = node.putArray("tags");
            operation.tags().forEach(tags::add);
        }
        putIfPresent(node, "summary", operation.summary());
        putIfPresent(node, "description", operation.description());
        putIfPresent(node, "operationId", operation.operationId());
        if (!operation.parameters().isEmpty()) {
            ArrayNode parameters = node.putArray("parameters");
            operation.parameters().forEach(parameter -> parameters.add(parameter(parameter)));
        }
        if (operation.requestBody() != null) {
            node.set("requestBody", requestBody(operation.requestBody()));
        }
        ObjectNode responses = node.putObject("responses");
        operation.responses().forEach((status, response) -> responses.set(String.valueOf(status), response(response)));
        if (!operation.security().isEmpty()) {
            ArrayNode security = node.putArray("security");
            operation.security().forEach(name -> security.addObject().putArray(name));
        }
        return node;
    }

    private static ObjectNode parameter(Parameter parameter) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("in", parameter.in().key());
        node.put("name", parameter.name());
        if (parameter.required()) {
            node.put("required", true);
        }
        putIfPresent(node, "description", parameter.description());
        if (parameter.allowEmptyValue()) {
            node.put("allowEmptyValue", true);
        }
        node.set("schema", parameter.schema().deepCopy());
        return node;
    }

    private static ObjectNode requestBody(RequestBodyObject body) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "description", body.description());
        node.set("content", content(body.content()));
        if (body.required()) {
            node.put("required", true);
        }
        return node;
    }

    private static ObjectNode response(ResponseObject response) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("description", response.description());
        if (!response.content().isEmpty()) {
            node.set("content", content(response.content()));
        }
        if (!response.headers().isEmpty()) {
            ObjectNode headers = node.putObject("headers");
            for (Map.Entry<String, HeaderObject> header : response.headers().entrySet()) {
                ObjectNode headerNode = headers.putObject(header.getKey());
                putIfPresent(headerNode, "description", header.getValue().description());
                headerNode.set("schema", header.getValue().schema().deepCopy());
            }
        }
        return node;
    }

    private static ObjectNode content(Map<String, MediaTypeObject> content) {
        ObjectNode node = MAPPER.createObjectNode();
        content.forEach((contentType, media) -> {
            ObjectNode mediaNode = node.putObject(contentType);
            if (media.schema() != null) {
                mediaNode.set("schema", media.schema().deepCopy());
            }
        });
        return node;
    }

    private static ObjectNode securityScheme(SecurityScheme scheme) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", scheme.type());
        putIfPresent(node, "scheme", scheme.scheme());
        putIfPresent(node, "bearerFormat", scheme.bearerFormat());
        putIfPresent(node, "in", scheme.in());
        putIfPresent(node, "name", scheme.name());
        putIfPresent(node, "description", scheme.description());
        return node;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
