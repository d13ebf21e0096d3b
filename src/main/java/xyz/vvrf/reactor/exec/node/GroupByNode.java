package xyz.vvrf.reactor.exec.node;

import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.compute.Aggregate;
import xyz.vvrf.reactor.exec.compute.AggregateFunctions;
import xyz.vvrf.reactor.exec.compute.Aggregator;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 按分组键聚合。输出列为各聚合结果加上分组键，分组按首次出现的顺序输出。
 *
 * @author ruifeng.wen
 */
public class GroupByNode extends AbstractAggregateNode {

    public static final String KIND_NAME = "GroupByNode";

    private final List<String> keys;
    private final int[] keyIndices;
    private final Map<List<Object>, Aggregator[]> groups = new LinkedHashMap<>();

    public GroupByNode(ExecPlan plan, List<ExecNode> inputs, List<Aggregate> aggregates, int[] targetIndices,
                       List<String> keys, int[] keyIndices, Schema outputSchema) {
        super(plan, inputs, aggregates, targetIndices, outputSchema);
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
        this.keyIndices = keyIndices.clone();
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    protected void consume(ExecBatch batch) {
        synchronized (groups) {
            for (int row = 0; row < batch.getLength(); row++) {
                List<Object> key = new ArrayList<>(keyIndices.length);
                for (int keyIndex : keyIndices) {
                    key.add(batch.getValue(keyIndex, row));
                }
                Aggregator[] state = groups.computeIfAbsent(key, k -> newState());
                for (int i = 0; i < state.length; i++) {
                    state[i].update(batch.getValue(targetIndices[i], row));
                }
            }
        }
    }

    private Aggregator[] newState() {
        Aggregator[] state = new Aggregator[aggregates.size()];
        for (int i = 0; i < state.length; i++) {
            state[i] = AggregateFunctions.newAggregator(aggregates.get(i));
        }
        return state;
    }

    @Override
    protected List<ExecBatch> produce() {
        List<List<Object>> rows = new ArrayList<>();
        synchronized (groups) {
            for (Map.Entry<List<Object>, Aggregator[]> group : groups.entrySet()) {
                List<Object> row = new ArrayList<>(aggregates.size() + keyIndices.length);
                for (Aggregator aggregator : group.getValue()) {
                    row.add(aggregator.finish());
                }
                row.addAll(group.getKey());
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        ExecBatch result = ExecBatch.fromRows(Schemas.numFields(getOutputSchema()), rows);
        return ExecBatch.sliceToMaxSize(result, ExecPlan.MAX_BATCH_SIZE);
    }

    @Override
    protected String toStringExtra(int indent) {
        String keyList = keys.stream().map(key -> "\"" + key + "\"").collect(Collectors.joining(", "));
        return "keys=[" + keyList + "], " + aggregatesToString(indent);
    }
}
