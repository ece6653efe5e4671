package io.routedoc.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routedoc.core.error.StructuralConflictException;
import io.routedoc.core.testkit.UserApi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaRegistry")
class SchemaRegistryTest {

    private static final DataType ADDRESS = DataType.named("Address", UserApi.json("""
            {"type":"object","properties":{"city":{"type":"string"}}}
            """));

    private static final DataType CUSTOMER = DataType.named("Customer", UserApi.json("""
            {"type":"object","properties":{"home":{"$ref":"#/components/schemas/Address"}}}
            """), ADDRESS);

    @Nested
    @DisplayName("declare")
    class Declare {

        @Test
        @DisplayName("registers a named type with everything it references")
        void transitiveClosure() {
            SchemaRegistry registry = SchemaRegistry.builder().declare(DataType.listOf(CUSTOMER)).build();

            assertThat(registry.typeIds()).containsExactly(TypeId.of("Customer"), TypeId.of("Address"));
            assertThat(registry.resolves(registry.lookup(TypeId.of("Customer")).orElseThrow().schema())).isTrue();
        }

        @Test
        @DisplayName("inline types contribute nothing of their own")
        void inlineTypes() {
            assertThat(SchemaRegistry.builder().declare(DataType.int64()).build().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("deduplicates by identity, not structure")
        void identityNotStructure() {
            DataType twin = DataType.named("AddressCopy", ADDRESS.schema());

            SchemaRegistry registry = SchemaRegistry.builder()
                    .declare(ADDRESS)
                    .declare(ADDRESS)
                    .declare(twin)
                    .build();

            assertThat(registry.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("stored schemas get inferred integer bounds")
        void storesInferredBounds() {
            SchemaRegistry registry = SchemaRegistry.builder().declare(UserApi.USER_ID).build();

            assertThat(registry.byName("UserId").orElseThrow().schema().get("maximum").longValue())
                    .isEqualTo(Long.MAX_VALUE);
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("two identities may not share a component name")
        void nameClash() {
            DataType impostor = DataType.named(TypeId.of("other.Address"), "Address", UserApi.json("{}"));

            assertThatThrownBy(() -> SchemaRegistry.builder().declare(ADDRESS).declare(impostor))
                    .isInstanceOf(StructuralConflictException.class)
                    .hasMessageContaining("claimed by two types");
        }

        @Test
        @DisplayName("one identity may not be registered under two names")
        void renamedIdentity() {
            DataType renamed = DataType.named(TypeId.of("Address"), "Location", ADDRESS.schema());

            assertThatThrownBy(() -> SchemaRegistry.builder().declare(ADDRESS).declare(renamed))
                    .isInstanceOf(StructuralConflictException.class)
                    .hasMessageContaining("two names");
        }
    }

    @Test
    @DisplayName("merge and toBuilder keep registration order")
    void mergeKeepsOrder() {
        SchemaRegistry first = SchemaRegistry.builder().declare(ADDRESS).build();
        SchemaRegistry second = SchemaRegistry.builder().declare(UserApi.USER).build();

        SchemaRegistry merged = first.toBuilder().merge(second).build();

        assertThat(merged.typeIds()).containsExactly(TypeId.of("Address"), TypeId.of("User"));
        assertThat(first.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("resolves rejects dangling references")
    void danglingReference() {
        SchemaRegistry registry = SchemaRegistry.builder().declare(ADDRESS).build();

        assertThat(registry.resolves(UserApi.json("{\"$ref\":\"#/components/schemas/Missing\"}"))).isFalse();
        assertThat(registry.resolves(UserApi.json("{\"items\":{\"$ref\":\"#/components/schemas/Address\"}}")))
                .isTrue();
    }
}
