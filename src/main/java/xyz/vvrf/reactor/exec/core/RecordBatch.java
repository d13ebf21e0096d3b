package xyz.vvrf.reactor.exec.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Objects;

/**
 * 携带自身 schema 的批次。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class RecordBatch {

    private final Schema schema;
    private final ExecBatch batch;

    public RecordBatch(Schema schema, ExecBatch batch) {
        this.schema = Objects.requireNonNull(schema, "Schema 不能为空");
        this.batch = Objects.requireNonNull(batch, "批次不能为空");
        if (batch.getNumValues() != schema.getFields().size()) {
            throw ExecPlanException.invalid("RecordBatch with %d columns does not match schema %s",
                    batch.getNumValues(), Schemas.describe(schema));
        }
    }

    public int getNumRows() {
        return batch.getLength();
    }

    @Override
    public String toString() {
        return "RecordBatch{schema=" + Schemas.describe(schema) + ", rows=" + batch.getLength() + '}';
    }
}
