package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.exec.compute.RowComparators;
import xyz.vvrf.reactor.exec.compute.SortOptions;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.OrderBySinkNodeOptions;
import xyz.vvrf.reactor.exec.options.SinkNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 缓冲全部输入，结束时稳定排序后作为单个结果 (按最大批次大小切分) 推入生成器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class OrderBySinkNode extends SinkNode {

    public static final String KIND_NAME = "OrderBySinkNode";

    private final SortOptions sortOptions;
    private final Comparator<List<Object>> comparator;
    private final List<List<Object>> rows = new ArrayList<>();

    public OrderBySinkNode(ExecPlan plan, List<ExecNode> inputs, OrderBySinkNodeOptions options) {
        this(plan, inputs, options, options.getSortOptions());
    }

    protected OrderBySinkNode(ExecPlan plan, List<ExecNode> inputs, SinkNodeOptions options, SortOptions sortOptions) {
        super(plan, inputs, options);
        this.sortOptions = sortOptions;
        this.comparator = RowComparators.forKeys(getOutputSchema(), sortOptions.getSortKeys(), sortOptions.getNullPlacement());
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        OrderBySinkNodeOptions sortOptions = NodeArgs.castOptions(options, OrderBySinkNodeOptions.class, KIND_NAME);
        return plan.addNode(new OrderBySinkNode(plan, inputs, sortOptions));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected void accept(ExecBatch batch) {
        List<List<Object>> batchRows = batch.getRows();
        synchronized (rows) {
            rows.addAll(batchRows);
        }
    }

    @Override
    protected void finish() {
        List<List<Object>> sorted;
        synchronized (rows) {
            sorted = new ArrayList<>(rows);
            rows.clear();
        }
        sorted.sort(comparator);
        List<List<Object>> result = selectRows(sorted);
        log.debug("节点 '{}' ({}) 排序完成，输出 {} 行", getLabel(), getKindName(), result.size());
        ExecBatch output = ExecBatch.fromRows(Schemas.numFields(getOutputSchema()), result);
        super.accept(output);
        super.finish();
    }

    /**
     * 从排好序的行中取出要输出的部分，默认全部输出。
     */
    protected List<List<Object>> selectRows(List<List<Object>> sorted) {
        return sorted;
    }

    @Override
    protected String toStringExtra(int indent) {
        return "by={" + sortOptions + "}";
    }
}
