package xyz.vvrf.reactor.exec.core;

import lombok.Getter;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 已物化的表：一个 schema 加上按顺序排列的批次。
 *
 * @author ruifeng.wen
 */
@Getter
public final class Table {

    private final Schema schema;
    private final List<ExecBatch> batches;

    private Table(Schema schema, List<ExecBatch> batches) {
        this.schema = Objects.requireNonNull(schema, "Schema 不能为空");
        int numFields = schema.getFields().size();
        for (ExecBatch batch : batches) {
            if (batch.getNumValues() != numFields) {
                throw ExecPlanException.invalid("Batch with %d columns does not match schema %s",
                        batch.getNumValues(), Schemas.describe(schema));
            }
        }
        this.batches = Collections.unmodifiableList(new ArrayList<>(batches));
    }

    public static Table fromBatches(Schema schema, List<ExecBatch> batches) {
        return new Table(schema, Objects.requireNonNull(batches, "批次列表不能为空"));
    }

    public static Table fromRows(Schema schema, List<? extends List<?>> rows) {
        return new Table(schema, Collections.singletonList(ExecBatch.fromRows(schema.getFields().size(), rows)));
    }

    public long getNumRows() {
        long rows = 0;
        for (ExecBatch batch : batches) {
            rows += batch.getLength();
        }
        return rows;
    }

    public List<List<Object>> getRows() {
        List<List<Object>> rows = new ArrayList<>();
        for (ExecBatch batch : batches) {
            rows.addAll(batch.getRows());
        }
        return rows;
    }

    /**
     * 按固定行数重新切分，除最后一块外每块恰好 {@code batchSize} 行。
     */
    public List<ExecBatch> toBatches(int batchSize) {
        if (batchSize <= 0) {
            throw ExecPlanException.invalid("batch_size > 0 is required, but got %d", batchSize);
        }
        List<List<Object>> rows = getRows();
        List<ExecBatch> chunks = new ArrayList<>();
        int numFields = schema.getFields().size();
        for (int offset = 0; offset < rows.size(); offset += batchSize) {
            chunks.add(ExecBatch.fromRows(numFields, rows.subList(offset, Math.min(rows.size(), offset + batchSize))));
        }
        return chunks;
    }

    @Override
    public String toString() {
        return "Table{schema=" + Schemas.describe(schema) + ", rows=" + getNumRows() + '}';
    }
}
