package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.compute.Aggregate;
import xyz.vvrf.reactor.exec.compute.AggregateFunctions;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.AggregateNodeOptions;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;
import xyz.vvrf.reactor.exec.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 聚合节点的公共部分：累积全部输入，输入结束后一次性产出结果批次并报告批次总数。
 * 被停止时丢弃累积状态，不再产出。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class AbstractAggregateNode extends AbstractExecNode {

    protected final List<Aggregate> aggregates;
    protected final int[] targetIndices;
    private final BatchCounter inputCounter = new BatchCounter();

    protected AbstractAggregateNode(ExecPlan plan, List<ExecNode> inputs, List<Aggregate> aggregates,
                                    int[] targetIndices, Schema outputSchema) {
        super(plan, inputs, Collections.singletonList("groupby"), outputSchema, 1);
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
        this.targetIndices = targetIndices.clone();
    }

    /**
     * 按是否有分组键创建 {@link ScalarAggregateNode} 或 {@link GroupByNode}。
     */
    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        NodeArgs.requireInputs(inputs, 1, "AggregateNode");
        AggregateNodeOptions aggregateOptions = NodeArgs.castOptions(options, AggregateNodeOptions.class, "AggregateNode");
        Schema inputSchema = inputs.get(0).getOutputSchema();
        List<String> keys = aggregateOptions.getKeys();
        boolean grouped = !keys.isEmpty();
        List<Aggregate> aggregates = aggregateOptions.getAggregates();

        int[] targetIndices = new int[aggregates.size()];
        List<Field> fields = new ArrayList<>();
        for (int i = 0; i < aggregates.size(); i++) {
            Aggregate aggregate = aggregates.get(i);
            AggregateFunctions.validate(aggregate, grouped);
            targetIndices[i] = Schemas.fieldIndex(inputSchema, aggregate.getTarget());
            ArrowType inputType = inputSchema.getFields().get(targetIndices[i]).getType();
            fields.add(Schemas.field(aggregate.getName(), AggregateFunctions.outputType(aggregate, inputType)));
        }
        if (!grouped) {
            return plan.addNode(new ScalarAggregateNode(plan, inputs, aggregates, targetIndices, Schemas.schema(fields)));
        }
        int[] keyIndices = new int[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            keyIndices[i] = Schemas.fieldIndex(inputSchema, keys.get(i));
            fields.add(inputSchema.getFields().get(keyIndices[i]));
        }
        return plan.addNode(new GroupByNode(plan, inputs, aggregates, targetIndices, keys, keyIndices, Schemas.schema(fields)));
    }

    /**
     * 累积一个批次，可能被并发调用。
     */
    protected abstract void consume(ExecBatch batch);

    /**
     * @return 输入结束后的结果批次
     */
    protected abstract List<ExecBatch> produce();

    @Override
    public void startProducing() {
        log.debug("节点 '{}' ({}) 已启动", getLabel(), getKindName());
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        if (isFinished()) {
            return;
        }
        try {
            consume(batch);
        } catch (RuntimeException e) {
            ExecPlanException error = ExecPlanException.wrap(e);
            log.warn("节点 '{}' ({}) 聚合失败: {}", getLabel(), getKindName(), error.toString());
            boolean claimed = inputCounter.cancel();
            getOutput().errorReceived(this, error);
            if (claimed) {
                markFinished(error);
            }
            getInputs().get(0).stopProducing(this);
            return;
        }
        if (inputCounter.increment()) {
            outputResult();
        }
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        getOutput().errorReceived(this, error);
        if (inputCounter.cancel()) {
            markFinished(null);
        }
    }

    @Override
    public void inputFinished(ExecNode input, int totalBatches) {
        if (inputCounter.setTotal(totalBatches)) {
            outputResult();
        }
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        // 输出在输入结束后一次性产出，暂停无意义
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        // 同上
    }

    @Override
    public void stopProducing(ExecNode output) {
        stopProducing();
    }

    @Override
    public void stopProducing() {
        if (inputCounter.cancel()) {
            markFinished(null);
        }
        getInputs().get(0).stopProducing(this);
    }

    private void outputResult() {
        List<ExecBatch> result;
        try {
            result = produce();
        } catch (RuntimeException e) {
            ExecPlanException error = ExecPlanException.wrap(e);
            getOutput().errorReceived(this, error);
            markFinished(error);
            return;
        }
        ExecNode output = getOutput();
        for (ExecBatch batch : result) {
            output.inputReceived(this, batch);
        }
        output.inputFinished(this, result.size());
        markFinished(null);
    }

    protected String aggregatesToString(int indent) {
        StringBuilder sb = new StringBuilder("aggregates=[\n");
        for (Aggregate aggregate : aggregates) {
            sb.append(GraphUtils.spaces(indent)).append('\t').append(aggregate).append(",\n");
        }
        return sb.append(GraphUtils.spaces(indent)).append(']').toString();
    }
}
