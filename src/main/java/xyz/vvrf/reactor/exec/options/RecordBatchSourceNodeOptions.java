package xyz.vvrf.reactor.exec.options;

import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.RecordBatch;

import java.util.Iterator;
import java.util.function.Supplier;

/**
 * 迭代出的 RecordBatch 必须与 schema 一致，否则源节点以 TYPE_ERROR 结束。
 */
public class RecordBatchSourceNodeOptions extends SchemaSourceNodeOptions<RecordBatch> {

    public RecordBatchSourceNodeOptions(Schema schema, Supplier<Iterator<RecordBatch>> itMaker) {
        super(schema, itMaker);
    }
}
