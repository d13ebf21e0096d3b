package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Schema;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.exec.backpressure.BackpressureControl;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Table;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.TableSinkNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 收集全部批次，结束时物化为 {@link Table}。
 *
 * @author ruifeng.wen
 */
public class TableSinkNode extends ConsumingSinkNode {

    public static final String KIND_NAME = "TableSinkNode";

    public TableSinkNode(ExecPlan plan, List<ExecNode> inputs, AtomicReference<Table> outputTable, List<String> names) {
        super(plan, inputs, new TableSinkConsumer(outputTable), names);
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        TableSinkNodeOptions sinkOptions = NodeArgs.castOptions(options, TableSinkNodeOptions.class, KIND_NAME);
        if (sinkOptions.getOutputTable() == null) {
            throw ExecPlanException.invalid("%s requires an output table reference which is not null", KIND_NAME);
        }
        return plan.addNode(new TableSinkNode(plan, inputs, sinkOptions.getOutputTable(), sinkOptions.getNames()));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    private static final class TableSinkConsumer implements SinkNodeConsumer {

        private final AtomicReference<Table> outputTable;
        private final List<ExecBatch> batches = new ArrayList<>();
        private volatile Schema schema;

        TableSinkConsumer(AtomicReference<Table> outputTable) {
            this.outputTable = outputTable;
        }

        @Override
        public void init(Schema schema, BackpressureControl backpressureControl, ExecPlan plan) {
            this.schema = schema;
        }

        @Override
        public void consume(ExecBatch batch) {
            synchronized (batches) {
                batches.add(batch);
            }
        }

        @Override
        public Mono<Void> finish() {
            return Mono.fromRunnable(() -> {
                synchronized (batches) {
                    outputTable.set(Table.fromBatches(schema, batches));
                }
            });
        }
    }
}
