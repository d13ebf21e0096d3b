package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.ArrowType;
import xyz.vvrf.reactor.exec.compute.Expression;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.options.FilterNodeOptions;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.List;

/**
 * 只保留过滤表达式为 true 的行，null 视为不满足。
 */
public class FilterNode extends MapNode {

    public static final String KIND_NAME = "FilterNode";

    private final Expression filter;

    public FilterNode(ExecPlan plan, List<ExecNode> inputs, Expression filter) {
        super(plan, inputs, inputs.isEmpty() ? null : inputs.get(0).getOutputSchema());
        this.filter = filter;
        ArrowType type = filter.getType(getInputSchema());
        if (!(type instanceof ArrowType.Bool)) {
            throw ExecPlanException.typeError("Filter expression must evaluate to bool, but %s evaluates to %s",
                    filter, Schemas.typeName(type));
        }
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, KIND_NAME);
        FilterNodeOptions filterOptions = NodeArgs.castOptions(options, FilterNodeOptions.class, KIND_NAME);
        return plan.addNode(new FilterNode(plan, inputs, filterOptions.getFilterExpression()));
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected ExecBatch process(ExecBatch batch) {
        List<Object> mask = filter.evaluate(batch, getInputSchema());
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < mask.size(); i++) {
            if (Boolean.TRUE.equals(mask.get(i))) {
                selected.add(i);
            }
        }
        return batch.selectRows(selected);
    }

    @Override
    protected String toStringExtra(int indent) {
        return "filter=" + filter;
    }
}
