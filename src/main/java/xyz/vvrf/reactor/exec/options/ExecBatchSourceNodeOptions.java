package xyz.vvrf.reactor.exec.options;

import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;

import java.util.Iterator;
import java.util.function.Supplier;

public class ExecBatchSourceNodeOptions extends SchemaSourceNodeOptions<ExecBatch> {

    public ExecBatchSourceNodeOptions(Schema schema, Supplier<Iterator<ExecBatch>> itMaker) {
        super(schema, itMaker);
    }
}
