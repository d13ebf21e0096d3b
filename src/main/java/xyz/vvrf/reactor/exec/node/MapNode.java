package xyz.vvrf.reactor.exec.node;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.types.pojo.Schema;
import xyz.vvrf.reactor.exec.core.ExecBatch;
import xyz.vvrf.reactor.exec.core.ExecPlanException;
import xyz.vvrf.reactor.exec.plan.AbstractExecNode;
import xyz.vvrf.reactor.exec.plan.BatchCounter;
import xyz.vvrf.reactor.exec.plan.ExecNode;
import xyz.vvrf.reactor.exec.plan.ExecPlan;

import java.util.Collections;
import java.util.List;

/**
 * 逐批变换的单输入节点骨架。每个输入批次恰好产出一个输出批次，
 * 因此输入结束时可以立即把相同的批次总数转告下游。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class MapNode extends AbstractExecNode {

    private final BatchCounter inputCounter = new BatchCounter();

    protected MapNode(ExecPlan plan, List<ExecNode> inputs, Schema outputSchema) {
        super(plan, inputs, Collections.singletonList("target"), outputSchema, 1);
    }

    /**
     * 变换一个批次。抛出的异常作为错误发往下游，并停止本节点。
     */
    protected abstract ExecBatch process(ExecBatch batch);

    protected Schema getInputSchema() {
        return getInputs().get(0).getOutputSchema();
    }

    @Override
    public void startProducing() {
        log.debug("节点 '{}' ({}) 已启动", getLabel(), getKindName());
    }

    @Override
    public void inputReceived(ExecNode input, ExecBatch batch) {
        if (isFinished()) {
            return;
        }
        ExecBatch output;
        try {
            output = process(batch);
        } catch (RuntimeException e) {
            ExecPlanException error = ExecPlanException.wrap(e);
            log.warn("节点 '{}' ({}) 处理批次失败: {}", getLabel(), getKindName(), error.toString());
            // 先占住计数器，下游回调 stopProducing 时不会以成功结束本节点
            boolean claimed = inputCounter.cancel();
            getOutput().errorReceived(this, error);
            if (claimed) {
                markFinished(error);
            }
            getInputs().get(0).stopProducing(this);
            return;
        }
        getOutput().inputReceived(this, output);
        if (inputCounter.increment()) {
            markFinished(null);
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
        getOutput().inputFinished(this, totalBatches);
        if (inputCounter.setTotal(totalBatches)) {
            markFinished(null);
        }
    }

    @Override
    public void pauseProducing(ExecNode output, int counter) {
        getInputs().get(0).pauseProducing(this, counter);
    }

    @Override
    public void resumeProducing(ExecNode output, int counter) {
        getInputs().get(0).resumeProducing(this, counter);
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
}
