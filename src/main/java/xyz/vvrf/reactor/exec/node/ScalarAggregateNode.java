package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.compute.Aggregate;
import xyz.vvrf.reactor.exec.compute.AggregateFunctions;
import xyz.vvrf.reactor.exec.compute.Aggregator;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 没有分组键的聚合，输出恰好一行。
 */
public class ScalarAggregateNode extends AbstractAggregateNode {

    public static final String KIND_NAME = "ScalarAggregateNode";

    private final List<Aggregator> aggregators = new ArrayList<>();

    public ScalarAggregateNode(ExecPlan plan, List<ExecNode> inputs, List<Aggregate> aggregates,
                               int[] targetIndices, Schema outputSchema) {
        super(plan, inputs, aggregates, targetIndices, outputSchema);
        for (Aggregate aggregate : aggregates) {
            aggregators.add(AggregateFunctions.newAggregator(aggregate));
        }
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected void consume(ExecBatch batch) {
        synchronized (aggregators) {
            for (int i = 0; i < aggregators.size(); i++) {
                Aggregator aggregator = aggregators.get(i);
                for (Object value : batch.getColumn(targetIndices[i])) {
                    aggregator.update(value);
                }
            }
        }
    }

    @Override
    protected List<ExecBatch> produce() {
        List<List<Object>> columns = new ArrayList<>(aggregators.size());
        synchronized (aggregators) {
            for (Aggregator aggregator : aggregators) {
                columns.add(Collections.singletonList(aggregator.finish()));
            }
        }
        return Collections.singletonList(new ExecBatch(columns, 1));
    }

    @Override
    protected String toStringExtra(int indent) {
        return aggregatesToString(indent);
    }
}
