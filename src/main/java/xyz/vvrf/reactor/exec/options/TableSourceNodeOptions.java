package xyz.vvrf.reactor.exec.options;

import lombok.Getter;
import xyz.vvrf.reactor.exec.core.Table;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

@Getter
public class TableSourceNodeOptions extends ExecNodeOptions {

    private final Table table;
    private final int maxBatchSize;

    public TableSourceNodeOptions(Table table) {
        this(table, ExecPlan.MAX_BATCH_SIZE);
    }

    public TableSourceNodeOptions(Table table, int maxBatchSize) {
        this.table = table;
        this.maxBatchSize = maxBatchSize;
    }
}
