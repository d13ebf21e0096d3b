package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.core.Schemas;
import xyz.vvrf.reactor.exec.options.ExecNodeOptions;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 转发所有输入的批次。每个输入独立结束；全部输入结束后向下游报告批次总数之和。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class UnionNode extends AbstractExecNode {

    public static final String KIND_NAME = "UnionNode";

    private final AtomicInteger finishedInputs = new AtomicInteger();
    private final AtomicInteger totalBatches = new AtomicInteger();
    private final BatchCounter batchCounter = new BatchCounter();

    public UnionNode(ExecPlan plan, List<ExecNode> inputs) {
        super(plan, inputs, inputLabels(inputs.size()), inputs.isEmpty() ? null : inputs.get(0).getOutputSchema(), 1);
    }

    public static ExecNode make(ExecPlan plan, List<ExecNode> inputs, ExecNodeOptions options) {
        if (inputs.isEmpty()) {
            throw ExecPlanException.invalid("%s requires at least one input", KIND_NAME);
        }
        Schema schema = inputs.get(0).getOutputSchema();
        for (ExecNode input : inputs) {
            if (!schema.equals(input.getOutputSchema())) {
                throw ExecPlanException.invalid("%s input schemas must all match, first schema was %s and got %s",
                        KIND_NAME, Schemas.describe(schema), Schemas.describe(input.getOutputSchema()));
            }
        }
        return plan.addNode(new UnionNode(plan, inputs));
    }

    private static List<String> inputLabels(int numInputs) {
        List<String> labels = new ArrayList<>(numInputs);
        for (int i = 0; i < numInputs; i++) {
            labels.add("input_" + i + "_label");
        }
        return labels;
    }

    @Override
    public String getKindName() {
        return KIND_NAME;
    }

    @Override
    public void startProducing() {
        log.debug("节点 '{}' ({}) 已启动，{} 个输入", getLabel(), getKindName(), getInputs().size());
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        inputIndex(input);
        if (isFinished()) {
            return;
        }
        getOutput().inputReceived(this, batch);
        if (batchCounter.increment()) {
            markFinished(null);
        }
    }

    @Override
    public void errorReceived(ExecNode input, Throwable error) {
        getOutput().errorReceived(this, error);
        if (batchCounter.cancel()) {
            markFinished(null);
        }
    }

    @Override
    public void inputFinished(ExecNode input, int total) {
        inputIndex(input);
        int sum = totalBatches.addAndGet(total);
        if (finishedInputs.incrementAndGet() == getInputs().size()) {
            log.debug("节点 '{}' ({}) 全部输入结束，共 {} 个批次", getLabel(), getKindName(), sum);
            getOutput().inputFinished(this, sum);
            if (batchCounter.setTotal(sum)) {
                markFinished(null);
            }
        }
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        for (ExecNode input : getInputs()) {
            input.pauseProducing(this, counter);
        }
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        for (ExecNode input : getInputs()) {
            input.resumeProducing(this, counter);
        }
    }

    @Override
    public void stopProducing(ExecNode output) {
        stopProducing();
    }

    @Override
    public void stopProducing() {
        if (batchCounter.cancel()) {
            markFinished(null);
        }
        for (ExecNode input : getInputs()) {
            input.stopProducing(this);
        }
    }
}
