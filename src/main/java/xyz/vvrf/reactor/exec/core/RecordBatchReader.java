package xyz.vvrf.reactor.exec.core;

import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;

/**
 * 逐个读取 {@link RecordBatch} 的读取器。
 *
 * @author ruifeng.wen
 */
public interface RecordBatchReader extends AutoCloseable {

    Schema getSchema();

    /**
     * @return 下一个批次，读取完毕时返回 null
     * @throws IOException 读取失败
     */
    RecordBatch next() throws IOException;

    @Override
    default void close() throws Exception {
    }

    static RecordBatchReader fromBatches(Schema schema, Iterable<RecordBatch> batches) {
        Objects.requireNonNull(schema, "Schema 不能为空");
        Iterator<RecordBatch> iterator = batches.iterator();
        return new RecordBatchReader() {
            @Override
            public Schema getSchema() {
                return schema;
            }

            @Override
            public RecordBatch next() {
                return iterator.hasNext() ? iterator.next() : null;
            }
        };
    }
}
