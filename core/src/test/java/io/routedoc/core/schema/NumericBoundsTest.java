package io.routedoc.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.routedoc.core.testkit.UserApi;
import java.math.BigInteger;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumericBounds")
class NumericBoundsTest {

    @ParameterizedTest(name = "{0}-bit signed={1}")
    @CsvSource({
        "8,  true,  -128,                 127",
        "16, true,  -32768,               32767",
        "32, true,  -2147483648,          2147483647",
        "64, true,  -9223372036854775808, 9223372036854775807",
        "8,  false, 0,                    255",
        "64, false, 0,                    18446744073709551615"
    })
    void naturalBounds(int bits, boolean signed, String min, String max) {
        JsonNode schema = NumericBounds.integer(bits, signed);

        assertThat(schema.get("type").asText()).isEqualTo("integer");
        assertThat(schema.get("minimum").bigIntegerValue()).isEqualTo(new BigInteger(min));
        assertThat(schema.get("maximum").bigIntegerValue()).isEqualTo(new BigInteger(max));
    }

    @Test
    void int64BoundsRenderExactly() {
        assertThat(NumericBounds.integer(64, true).toString())
                .isEqualTo("{\"type\":\"integer\",\"minimum\":-9223372036854775808,\"maximum\":9223372036854775807}");
    }

    @Test
    void rejectsUnsupportedWidths() {
        assertThatThrownBy(() -> NumericBounds.integer(12, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void infersNestedFormatsWithoutTouchingTheInput() {
        JsonNode schema = UserApi.json("""
                {"type":"object","properties":{
                  "count":{"type":"integer","format":"int32"},
                  "ids":{"type":"array","items":{"type":"integer","format":"int64","minimum":1}},
                  "plain":{"type":"integer"}
                }}
                """);

        JsonNode inferred = NumericBounds.inferBounds(schema);

        assertThat(inferred.at("/properties/count/minimum").longValue()).isEqualTo(Integer.MIN_VALUE);
        assertThat(inferred.at("/properties/count/maximum").longValue()).isEqualTo(Integer.MAX_VALUE);
        assertThat(inferred.at("/properties/ids/items/minimum").intValue()).isEqualTo(1);
        assertThat(inferred.at("/properties/ids/items/maximum").longValue()).isEqualTo(Long.MAX_VALUE);
        assertThat(inferred.at("/properties/plain").has("minimum")).isFalse();
        assertThat(schema.at("/properties/count").has("minimum")).isFalse();
    }
}
