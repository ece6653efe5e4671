package io.routedoc.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.routedoc.core.model.HttpMethod;
import io.routedoc.core.model.OperationKey;
import io.routedoc.core.schema.TypeId;
import org.junit.jupiter.api.Test;

/** The exception hierarchy: abstract tiers, phases and carried context. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void routeDocExceptionIsAbstractAndRoot() {
        assertThat(RouteDocException.class).isAbstract();
        assertThat(RouteDocException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndCollaboratorTiersAreAbstract() {
        assertThat(RouteLoadException.class).isAbstract();
        assertThat(CollaboratorUnavailableException.class).isAbstract();
    }

    // --- Load phase ---

    @Test
    void routeSpecParseExceptionCarriesSource() {
        var cause = new IllegalStateException("bad indent");
        var ex = new RouteSpecParseException("bad yaml", cause, "/routes/api.yaml");

        assertThat(ex).isInstanceOf(RouteLoadException.class);
        assertThat(ex.phase()).isEqualTo(RouteDocException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/routes/api.yaml");
        assertThat(ex.detail()).isEqualTo("bad yaml");
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void schemaDefinitionExceptionCarriesSchemaName() {
        var ex = new SchemaDefinitionException("invalid", "User", "/routes/api.yaml");

        assertThat(ex).isInstanceOf(RouteLoadException.class);
        assertThat(ex.schemaName()).isEqualTo("User");
        assertThat(ex.source()).isEqualTo("/routes/api.yaml");
    }

    // --- Compile phase ---

    @Test
    void structuralConflictCarriesIdentityAndQualifier() {
        OperationKey key = OperationKey.of(HttpMethod.GET, "/users/{id}");
        var ex = new StructuralConflictException("conflict", key, "query:limit");

        assertThat(ex.phase()).isEqualTo(RouteDocException.Phase.COMPILE);
        assertThat(ex.operation()).isEqualTo(key);
        assertThat(ex.qualifier()).isEqualTo("query:limit");
    }

    // --- Validation phase ---

    @Test
    void missingCollaboratorsNameTheType() {
        var generator = new GeneratorUnavailableException(TypeId.of("User"));
        var encoder = new EncoderUnavailableException(TypeId.of("User"));

        assertThat(generator).isInstanceOf(CollaboratorUnavailableException.class);
        assertThat(generator.phase()).isEqualTo(RouteDocException.Phase.VALIDATION);
        assertThat(generator.typeId()).isEqualTo(TypeId.of("User"));
        assertThat(generator.getMessage()).isEqualTo("No sample generator registered for type 'User'");
        assertThat(encoder.getMessage()).isEqualTo("No wire encoder registered for type 'User'");
    }
}
