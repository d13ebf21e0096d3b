package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.Collections;
import java.util.List;

/**
 * 常量，对每一行取同一个值。
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Literal extends Expression {

    private final Object value;

    public Literal(Object value) {
        Schemas.typeOf(value);
        this.value = value;
    }

    @Override
    public ArrowType getType(Schema schema) {
        return Schemas.typeOf(value);
    }

    @Override
    public List<Object> evaluate(ExecBatch batch, Schema schema) {
        return Collections.nCopies(batch.getLength(), value);
    }

    @Override
    public String toString() {
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }
}
