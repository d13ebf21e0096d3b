package xyz.vvrf.reactor.exec.node;

import xyz.vvrf.reactor.exec.compute.NullPlacement;
import xyz.vvrf.reactor.exec.compute.SelectKOptions;
import xyz.vvrf.reactor.exec.compute.SortOptions;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.SelectKSinkNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.List;

/**
 * 与 {@link OrderBySinkNode} 相同的排序，只输出前 k 行。
 */
public class SelectKSinkNode extends OrderBySinkNode {

    public static final String KIND_NAME = "SelectKSinkNode";

    private final SelectKOptions selectKOptions;

    public SelectKSinkNode(ExecPlan plan, List<ExecNode> inputs, SelectKSinkNodeOptions options) {
        super(plan, inputs, options, new SortOptions(options.getSelectKOptions().getSortKeys(), NullPlacement.AT_END));
        this.selectKOptions = options.getSelectKOptions();
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        SelectKSinkNodeOptions selectKOptions = NodeArgs.castOptions(options, SelectKSinkNodeOptions.class, KIND_NAME);
        if (selectKOptions.getSelectKOptions().getK() < 0) {
            throw ExecPlanException.invalid("%s requires k >= 0, but got %d", KIND_NAME, selectKOptions.getSelectKOptions().getK());
        }
        return plan.addNode(new SelectKSinkNode(plan, inputs, selectKOptions));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected List<List<Object>> selectRows(List<List<Object>> sorted) {
        return sorted.subList(0, Math.min(selectKOptions.getK(), sorted.size()));
    }

    @Override
    protected String toStringExtra(int indent) {
        return "select_k={" + selectKOptions + "}";
    }
}
