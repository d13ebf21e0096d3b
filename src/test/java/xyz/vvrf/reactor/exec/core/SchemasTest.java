package xyz.vvrf.reactor.exec.core;

import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemasTest {

    private final Schema schema = Schemas.schema(
            Schemas.field("i32", Schemas.INT32),
            Schemas.field("str", Schemas.UTF8));

    @Test
    void findsFieldsByName() {
        assertThat(Schemas.fieldIndex(schema, "str")).isEqualTo(1);
        assertThatThrownBy(() -> Schemas.fieldIndex(schema, "missing"))
                .isInstanceOf(ExecPlanException.class)
                .hasMessage("No field named 'missing' in schema [i32: int32, str: string]");
    }

    @Test
    void renameKeepsTypes() {
        Schema renamed = Schemas.rename(schema, Arrays.asList("a", "b"));

        assertThat(Schemas.describe(renamed)).isEqualTo("[a: int32, b: string]");
        assertThatThrownBy(() -> Schemas.rename(schema, Arrays.asList("a")))
                .hasMessage("Cannot rename 2 fields with 1 names");
    }

    @Test
    void infersTypesFromValues() {
        assertThat(Schemas.typeOf(1)).isEqualTo(Schemas.INT32);
        assertThat(Schemas.typeOf(1L)).isEqualTo(Schemas.INT64);
        assertThat(Schemas.typeOf(1.0)).isEqualTo(Schemas.FLOAT64);
        assertThat(Schemas.typeOf(null)).isEqualTo(Schemas.NULL);
        assertThat(Schemas.typeName(Schemas.FLOAT64)).isEqualTo("double");
        assertThat(Schemas.describe(null)).isEqualTo("null");
    }

    @Test
    void wrapPreservesMessage() {
        ExecPlanException wrapped = ExecPlanException.wrap(new IllegalStateException("boom"));

        assertThat(wrapped.getCode()).isEqualTo(StatusCode.UNKNOWN_ERROR);
        assertThat(wrapped).hasMessage("boom").hasCauseInstanceOf(IllegalStateException.class);
        assertThat(ExecPlanException.wrap(wrapped)).isSameAs(wrapped);
        assertThat(ExecPlanException.keyError("k %d", 1)).hasToString("KEY_ERROR: k 1");
    }
}
