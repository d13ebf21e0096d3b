package xyz.vvrf.reactor.exec.node;

import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Table;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.TableSourceNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.List;

/**
 * 把已物化的表按固定行数切分后逐批产出。
 *
 * @author ruifeng.wen
 */
public class TableSourceNode extends SourceNode {

    public static final String KIND_NAME = "TableSourceNode";

    public TableSourceNode(ExecPlan plan, Table table, int batchSize) {
        super(plan, table.getSchema(), Flux.defer(() -> Flux.fromIterable(table.toBatches(batchSize))));
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 0, KIND_NAME);
        TableSourceNodeOptions tableOptions = NodeArgs.castOptions(options, TableSourceNodeOptions.class, KIND_NAME);
        if (tableOptions.getTable() == null) {
            throw ExecPlanException.invalid("%s requires table which is not null", KIND_NAME);
        }
        if (tableOptions.getMaxBatchSize() <= 0) {
            throw ExecPlanException.invalid("%s node requires, batch_size > 0 , but got %d",
                    KIND_NAME, tableOptions.getMaxBatchSize());
        }
        return plan.addNode(new TableSourceNode(plan, tableOptions.getTable(), tableOptions.getMaxBatchSize()));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }
}
