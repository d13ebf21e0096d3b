package xyz.vvrf.reactor.exec.compute;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.Schemas;

import java.util.List;
import java.util.Objects;

/**
 * 按名称引用输入列。
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class FieldRef extends Expression {

    private final String name;

    public FieldRef(String name) {
        this.name = Objects.requireNonNull(name, "字段名不能为空");
    }

    @Override
    public ArrowType getType(Schema schema) {
        return schema.getFields().get(Schemas.fieldIndex(schema, name)).getType();
    }

    @Override
    public List<Object> evaluate(ExecBatch batch, Schema schema) {
        return batch.getColumn(Schemas.fieldIndex(schema, name));
    }

    @Override
    public String toString() {
        return name;
    }
}
