package io.routedoc.core.engine;

import static io.routedoc.core.testkit.UserApi.USER;
import static io.routedoc.core.testkit.UserApi.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;

import io.routedoc.core.model.ApiDocument;
import io.routedoc.core.model.EndpointTemplate;
import io.routedoc.core.model.HttpMethod;
import io.routedoc.core.model.Operation;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.model.Qualifier;
import io.routedoc.core.model.RouteTree;
import io.routedoc.core.model.TagDefinition;
import io.routedoc.core.schema.DataType;
import io.routedoc.core.schema.TypeId;
import io.routedoc.core.testkit.UserApi;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OperationAnnotations")
class OperationAnnotationsTest {

    private static final RouteTree USERS = RouteTree.prefix(Qualifier.path("users"), UserApi.tree());
    private static final RouteTree HEALTH =
            RouteTree.prefix(Qualifier.path("health"), RouteTree.leaf(EndpointTemplate.get(DataType.string())));
    private static final RouteTree API = RouteTree.alt(USERS, HEALTH);

    private static final OperationKey LIST = OperationKey.of(HttpMethod.GET, "/users");
    private static final OperationKey CREATE = OperationKey.of(HttpMethod.POST, "/users");
    private static final OperationKey STATUS = OperationKey.of(HttpMethod.GET, "/health");

    private final ApiDocument document = DocumentCompiler.compile(API);

    private static Operation operation(ApiDocument document, OperationKey key) {
        return document.operation(key).orElseThrow();
    }

    @Test
    @DisplayName("applyTagsFor tags the selection and defines the tags once")
    void tagsSelection() {
        Selection users = OperationSelector.select(USERS, API);
        TagDefinition tag = TagDefinition.of("users", "User management");

        ApiDocument tagged = OperationAnnotations.applyTagsFor(users, List.of(tag), document);
        ApiDocument retagged = OperationAnnotations.applyTagsFor(users, List.of(tag), tagged);

        assertThat(operation(retagged, LIST).tags()).containsExactly("users");
        assertThat(operation(retagged, CREATE).tags()).containsExactly("users");
        assertThat(operation(retagged, STATUS).tags()).isEmpty();
        assertThat(retagged.tags()).containsExactly(tag);
    }

    @Test
    @DisplayName("setResponseFor overrides an inferred response and registers its type")
    void overridesResponse() {
        DataType problem = DataType.named("Problem", UserApi.json("""
                {"type":"object","properties":{"detail":{"type":"string"}}}
                """));
        Selection create = OperationSelector.select(
                RouteTree.prefix(
                        Qualifier.path("users"),
                        RouteTree.prefix(Qualifier.body(USER), RouteTree.leaf(EndpointTemplate.post(USER_ID)))),
                API);

        ApiDocument updated = OperationAnnotations.setResponseFor(create, 400, "Malformed user", problem, document);

        assertThat(operation(updated, CREATE).response(400).description()).isEqualTo("Malformed user");
        assertThat(operation(updated, CREATE).response(400).content().get(Qualifier.JSON_UTF8).schema().get("$ref").asText())
                .isEqualTo("#/components/schemas/Problem");
        assertThat(updated.schemas().contains(TypeId.of("Problem"))).isTrue();
        assertThat(document.schemas().contains(TypeId.of("Problem"))).isFalse();
    }

    @Test
    @DisplayName("setResponseFor without a type adds a bodiless response")
    void bodilessResponse() {
        Selection health = OperationSelector.select(HEALTH, API);

        ApiDocument updated = OperationAnnotations.setResponseFor(health, 503, "Draining", null, document);

        assertThat(operation(updated, STATUS).responses()).containsOnlyKeys(200, 503);
        assertThat(operation(updated, STATUS).response(503).content()).isEmpty();
        assertThat(updated.schemas()).isEqualTo(document.schemas());
    }

    @Test
    @DisplayName("describeFor sets only the fields given")
    void describes() {
        Selection health = OperationSelector.select(HEALTH, API);

        ApiDocument described = OperationAnnotations.describeFor(health, "Liveness", null, document);
        ApiDocument redescribed = OperationAnnotations.describeFor(health, null, "Returns ok.", described);

        assertThat(operation(redescribed, STATUS).summary()).isEqualTo("Liveness");
        assertThat(operation(redescribed, STATUS).description()).isEqualTo("Returns ok.");
        assertThat(operation(redescribed, LIST).summary()).isNull();
    }
}
